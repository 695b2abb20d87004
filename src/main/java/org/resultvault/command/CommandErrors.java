package org.resultvault.command;

import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;

/**
 * Catalog of command error documents returned to clients.
 */
final class CommandErrors {
    static final int CODE_INVALID_ARGUMENT = 14;
    static final int CODE_NO_SUCH_RUN = 26;
    static final int CODE_RUN_LOCKED = 46;
    static final int CODE_COMMAND_NOT_FOUND = 59;
    static final int CODE_BLOB_NOT_FOUND = 70;
    static final int CODE_STORAGE_CONFLICT = 112;
    static final int CODE_NO_SUCH_SESSION = 206;
    static final int CODE_INGESTION_INCOMPLETE = 251;
    static final int CODE_RUN_LIMIT_EXCEEDED = 261;

    private CommandErrors() {}

    static BsonDocument commandNotFound(final String commandName) {
        return error("no such command: " + commandName, CODE_COMMAND_NOT_FOUND, "CommandNotFound");
    }

    static BsonDocument badValue(final String message) {
        return error(message, CODE_INVALID_ARGUMENT, "BadValue");
    }

    static BsonDocument typeMismatch(final String message) {
        return error(message, CODE_INVALID_ARGUMENT, "TypeMismatch");
    }

    static BsonDocument noSuchRun(final String message) {
        return error(message, CODE_NO_SUCH_RUN, "NoSuchRun");
    }

    static BsonDocument runLocked(final String message) {
        return error(message, CODE_RUN_LOCKED, "RunLocked");
    }

    static BsonDocument blobNotFound(final String message) {
        return error(message, CODE_BLOB_NOT_FOUND, "BlobNotFound");
    }

    static BsonDocument storageConflict(final String message) {
        return error(message, CODE_STORAGE_CONFLICT, "StorageConflict");
    }

    static BsonDocument noSuchSession(final String message) {
        return error(message, CODE_NO_SUCH_SESSION, "NoSuchSession");
    }

    static BsonDocument ingestionIncomplete(final String message) {
        return error(message, CODE_INGESTION_INCOMPLETE, "IngestionIncomplete");
    }

    static BsonDocument runLimitExceeded(final String message) {
        return error(message, CODE_RUN_LIMIT_EXCEEDED, "RunLimitExceeded");
    }

    private static BsonDocument error(final String message, final int code, final String codeName) {
        return new BsonDocument()
                .append("ok", new BsonDouble(0.0))
                .append("errmsg", new BsonString(message))
                .append("code", new BsonInt32(code))
                .append("codeName", new BsonString(codeName));
    }
}
