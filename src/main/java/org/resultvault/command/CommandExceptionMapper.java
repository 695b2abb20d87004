package org.resultvault.command;

import org.bson.BsonDocument;
import org.resultvault.blob.BlobNotFoundException;
import org.resultvault.engine.RunLimitExceededException;
import org.resultvault.engine.RunLockedException;
import org.resultvault.engine.RunNotFoundException;
import org.resultvault.engine.StorageConflictException;
import org.resultvault.ingest.IngestionIncompleteException;
import org.resultvault.ingest.UnknownSessionException;

/**
 * Maps store, coordinator and argument exceptions to deterministic command error envelopes.
 */
final class CommandExceptionMapper {
    private CommandExceptionMapper() {}

    /**
     * @return the error document, or {@code null} when the exception is not a known command failure
     */
    static BsonDocument fromException(final RuntimeException exception) {
        if (exception instanceof StorageConflictException conflict) {
            return CommandErrors.storageConflict(conflict.getMessage());
        }
        if (exception instanceof RunLockedException locked) {
            return CommandErrors.runLocked(locked.getMessage());
        }
        if (exception instanceof IngestionIncompleteException incomplete) {
            return CommandErrors.ingestionIncomplete(incomplete.getMessage());
        }
        if (exception instanceof RunNotFoundException notFound) {
            return CommandErrors.noSuchRun(notFound.getMessage());
        }
        if (exception instanceof BlobNotFoundException notFound) {
            return CommandErrors.blobNotFound(notFound.getMessage());
        }
        if (exception instanceof RunLimitExceededException limit) {
            return CommandErrors.runLimitExceeded(limit.getMessage());
        }
        if (exception instanceof UnknownSessionException unknown) {
            return CommandErrors.noSuchSession(unknown.getMessage());
        }
        if (exception instanceof IllegalArgumentException illegal) {
            return fromIllegalArgument(illegal);
        }
        return null;
    }

    static BsonDocument fromIllegalArgument(final IllegalArgumentException exception) {
        final String message = exception.getMessage();
        if (exception instanceof CommandArgumentException) {
            return CommandErrors.typeMismatch(message);
        }
        if (message == null || message.isBlank()) {
            return CommandErrors.badValue("invalid argument");
        }
        return CommandErrors.badValue(message);
    }
}
