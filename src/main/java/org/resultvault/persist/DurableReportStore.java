package org.resultvault.persist;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.resultvault.engine.CommitResult;
import org.resultvault.engine.GenerationHandle;
import org.resultvault.engine.GenerationOptions;
import org.resultvault.engine.InMemoryReportStore;
import org.resultvault.engine.Report;
import org.resultvault.engine.ReportStore;
import org.resultvault.engine.ReportStoreState;
import org.resultvault.engine.ReviewDecision;
import org.resultvault.engine.Run;
import org.resultvault.engine.StagedReport;
import org.resultvault.engine.StateJournal;
import org.resultvault.obs.CorrelationContext;
import org.resultvault.obs.JsonLinesLogger;

/**
 * Report store that keeps its state in memory and rewrites {@code state.json} for every change.
 *
 * <p>The file is written before the change is published. A failed write leaves both the file and the in-memory
 * store as they were and surfaces as the error of the operation.
 */
public final class DurableReportStore implements ReportStore {
    private final InMemoryReportStore delegate;
    private final StateFile stateFile;

    private DurableReportStore(final InMemoryReportStore delegate, final StateFile stateFile) {
        this.delegate = delegate;
        this.stateFile = stateFile;
    }

    /**
     * Loads {@code state.json} from {@code dataDirectory}, upgrading older schema versions, or starts empty.
     *
     * @throws SchemaVersionMismatchException when the file was written by a newer schema
     */
    public static DurableReportStore open(
            final Path dataDirectory, final Clock clock, final int maxRuns, final JsonLinesLogger logger) {
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        Objects.requireNonNull(logger, "logger");
        final StateFile stateFile = new StateFile(dataDirectory);
        final Optional<ReportStoreState> stored = stateFile.read();
        final StateJournal journal = state -> save(stateFile, logger, state);
        final InMemoryReportStore delegate = stored
                .map(state -> InMemoryReportStore.restore(state, clock, maxRuns, logger, journal))
                .orElseGet(() -> new InMemoryReportStore(clock, maxRuns, logger, journal));
        logger.info("state.load", CorrelationContext.of("startup", "load"), Map.of(
                "file", stateFile.path().toString(),
                "runs", stored.map(state -> state.runs().size()).orElse(0)));
        return new DurableReportStore(delegate, stateFile);
    }

    public Path stateFile() {
        return stateFile.path();
    }

    @Override
    public GenerationHandle beginIngestion(final String runName, final GenerationOptions options) {
        return delegate.beginIngestion(runName, options);
    }

    @Override
    public void addReport(final GenerationHandle handle, final StagedReport report) {
        delegate.addReport(handle, report);
    }

    @Override
    public CommitResult commit(final GenerationHandle handle) {
        return delegate.commit(handle);
    }

    @Override
    public void abort(final GenerationHandle handle) {
        delegate.abort(handle);
    }

    @Override
    public Optional<Run> run(final String runName) {
        return delegate.run(runName);
    }

    @Override
    public List<Run> runs() {
        return delegate.runs();
    }

    @Override
    public List<Report> reports(final String runName) {
        return delegate.reports(runName);
    }

    @Override
    public List<Report> openReportsAt(final String runName, final String tag) {
        return delegate.openReportsAt(runName, tag);
    }

    @Override
    public Optional<ReviewDecision> reviewStatus(final String fingerprint) {
        return delegate.reviewStatus(fingerprint);
    }

    @Override
    public void setReviewStatus(final String fingerprint, final ReviewDecision decision) {
        delegate.setReviewStatus(fingerprint, decision);
    }

    @Override
    public void deleteRun(final String runName) {
        delegate.deleteRun(runName);
    }

    @Override
    public ReportStoreState exportState() {
        return delegate.exportState();
    }

    private static void save(final StateFile stateFile, final JsonLinesLogger logger, final ReportStoreState state) {
        try {
            stateFile.write(state);
        } catch (final RuntimeException failure) {
            logger.error("state.save_failed", CorrelationContext.of("state", "save"), Map.of(
                    "file", stateFile.path().toString(),
                    "runs", state.runs().size(),
                    "error", String.valueOf(failure.getMessage())));
            throw failure;
        }
    }
}
