package org.resultvault.command;

import java.time.Clock;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.bson.BsonDocument;
import org.resultvault.blob.SourceBlobStore;
import org.resultvault.engine.ReportStore;
import org.resultvault.identity.FingerprintCalculator;
import org.resultvault.ingest.IngestionCoordinator;
import org.resultvault.query.Deduplicator;
import org.resultvault.query.DiffEngine;

/**
 * Routes a command document to its handler by the (case-insensitive) name of its first key.
 *
 * <p>Known store and ingestion failures come back as error documents. Any other runtime exception propagates
 * to the caller, which owns the connection.
 */
public final class CommandDispatcher {
    private static final Set<String> HANDSHAKE_COMMANDS = Set.of("hello", "ismaster");

    private final Map<String, CommandHandler> handlers;
    private final ThreadLocal<String> dispatchConnection = new ThreadLocal<>();

    public CommandDispatcher(
            final ReportStore store, final SourceBlobStore blobs, final IngestionCoordinator coordinator) {
        this(store, blobs, coordinator, new FingerprintCalculator(), Clock.systemUTC());
    }

    public CommandDispatcher(
            final ReportStore store,
            final SourceBlobStore blobs,
            final IngestionCoordinator coordinator,
            final FingerprintCalculator calculator,
            final Clock clock) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(blobs, "blobs");
        Objects.requireNonNull(coordinator, "coordinator");
        Objects.requireNonNull(calculator, "calculator");
        Objects.requireNonNull(clock, "clock");
        final Supplier<String> connection = dispatchConnection::get;
        final Deduplicator deduplicator = new Deduplicator();

        final Map<String, CommandHandler> configuredHandlers = new HashMap<>();
        final HelloCommandHandler hello = new HelloCommandHandler(connection);
        for (final String handshake : HANDSHAKE_COMMANDS) {
            configuredHandlers.put(handshake, hello);
        }
        final PingCommandHandler ping = new PingCommandHandler();
        configuredHandlers.put("ping", ping);
        configuredHandlers.put("endsessions", ping);
        configuredHandlers.put("openingestion", new OpenIngestionCommandHandler(coordinator, connection));
        configuredHandlers.put("submitresults", new SubmitResultsCommandHandler(coordinator, connection));
        configuredHandlers.put("finalizeingestion", new FinalizeIngestionCommandHandler(coordinator));
        configuredHandlers.put("abortingestion", new AbortIngestionCommandHandler(coordinator));
        configuredHandlers.put("listreports", new ListReportsCommandHandler(store, deduplicator));
        configuredHandlers.put(
                "diff", new DiffCommandHandler(new DiffEngine(store, deduplicator), calculator, blobs));
        configuredHandlers.put("getrun", new GetRunCommandHandler(store));
        configuredHandlers.put("listruns", new ListRunsCommandHandler(store));
        configuredHandlers.put("deleterun", new DeleteRunCommandHandler(store));
        configuredHandlers.put("setreviewstatus", new SetReviewStatusCommandHandler(store, clock));
        configuredHandlers.put("getsourcefile", new GetSourceFileCommandHandler(blobs));
        this.handlers = Map.copyOf(configuredHandlers);
    }

    public BsonDocument dispatch(final BsonDocument command) {
        return dispatch(command, null);
    }

    /**
     * @param connectionId the connection the command arrived on, or {@code null} for in-process callers
     */
    public BsonDocument dispatch(final BsonDocument command, final String connectionId) {
        if (command == null || command.isEmpty()) {
            return CommandErrors.badValue("command document must not be empty");
        }

        final String commandName = command.getFirstKey().toLowerCase(Locale.ROOT);
        final CommandHandler handler = handlers.get(commandName);
        if (handler == null) {
            return CommandErrors.commandNotFound(commandName);
        }

        dispatchConnection.set(connectionId);
        try {
            return handler.handle(command);
        } catch (final RuntimeException failure) {
            final BsonDocument error = CommandExceptionMapper.fromException(failure);
            if (error == null) {
                throw failure;
            }
            return error;
        } finally {
            dispatchConnection.remove();
        }
    }
}
