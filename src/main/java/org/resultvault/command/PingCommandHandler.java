package org.resultvault.command;

import org.bson.BsonDocument;
import org.bson.BsonDouble;

final class PingCommandHandler implements CommandHandler {
    @Override
    public BsonDocument handle(final BsonDocument command) {
        return new BsonDocument("ok", new BsonDouble(1.0));
    }
}
