package org.resultvault.persist;

import org.bson.BsonDocument;

/**
 * Rewrites a state document from {@link #fromVersion()} to the next schema version.
 */
interface SchemaMigration {
    int fromVersion();

    BsonDocument apply(BsonDocument state);
}
