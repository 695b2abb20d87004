package org.resultvault.wire;

import java.util.Objects;
import org.bson.BsonDocument;

/**
 * Legacy OP_QUERY. Drivers still open a connection with an {@code isMaster} sent this way against
 * {@code admin.$cmd}.
 */
public record OpQuery(int requestId, String fullCollectionName, BsonDocument query) {
    public static final int OP_CODE = 2004;

    public OpQuery {
        Objects.requireNonNull(fullCollectionName, "fullCollectionName");
        Objects.requireNonNull(query, "query");
    }
}
