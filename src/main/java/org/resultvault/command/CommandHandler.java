package org.resultvault.command;

import org.bson.BsonDocument;

@FunctionalInterface
public interface CommandHandler {
    BsonDocument handle(BsonDocument command);
}
