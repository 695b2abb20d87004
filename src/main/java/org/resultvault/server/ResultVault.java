package org.resultvault.server;

import java.time.Clock;
import java.util.Objects;
import org.resultvault.blob.FileSystemSourceBlobStore;
import org.resultvault.blob.InMemorySourceBlobStore;
import org.resultvault.blob.SourceBlobStore;
import org.resultvault.command.CommandDispatcher;
import org.resultvault.engine.InMemoryReportStore;
import org.resultvault.engine.ReportStore;
import org.resultvault.identity.FingerprintCalculator;
import org.resultvault.ingest.IngestionCoordinator;
import org.resultvault.obs.JsonLinesLogger;
import org.resultvault.persist.DurableReportStore;
import org.resultvault.suppress.SourceCodeCommentParser;

/**
 * The wired back end: report store, blob store, ingestion coordinator and the dispatcher on top of them.
 */
public record ResultVault(
        ReportStore store, SourceBlobStore blobs, IngestionCoordinator coordinator, CommandDispatcher dispatcher) {
    static final String BLOB_DIRECTORY = "blobs";

    public ResultVault {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(blobs, "blobs");
        Objects.requireNonNull(coordinator, "coordinator");
        Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public static ResultVault inMemory() {
        return create(ServerConfig.defaults(), Clock.systemUTC(), JsonLinesLogger.noop());
    }

    /**
     * @throws org.resultvault.persist.SchemaVersionMismatchException when the data directory was written by a
     *     newer schema
     */
    public static ResultVault create(final ServerConfig config, final Clock clock, final JsonLinesLogger logger) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(logger, "logger");
        final ReportStore store;
        final SourceBlobStore blobs;
        if (config.dataDirectory() == null) {
            store = new InMemoryReportStore(clock, config.maxRuns(), logger);
            blobs = new InMemorySourceBlobStore();
        } else {
            store = DurableReportStore.open(config.dataDirectory(), clock, config.maxRuns(), logger);
            blobs = new FileSystemSourceBlobStore(config.dataDirectory().resolve(BLOB_DIRECTORY));
        }
        final FingerprintCalculator calculator = new FingerprintCalculator();
        final IngestionCoordinator coordinator = new IngestionCoordinator(
                store,
                blobs,
                calculator,
                new SourceCodeCommentParser(config.suppressionPrefix()),
                config.ingestionSettings(),
                clock,
                logger);
        final CommandDispatcher dispatcher = new CommandDispatcher(store, blobs, coordinator, calculator, clock);
        return new ResultVault(store, blobs, coordinator, dispatcher);
    }
}
