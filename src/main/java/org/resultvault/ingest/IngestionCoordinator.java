package org.resultvault.ingest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import org.resultvault.blob.BlobId;
import org.resultvault.blob.SourceBlobStore;
import org.resultvault.blob.SourceFile;
import org.resultvault.engine.CommitResult;
import org.resultvault.engine.GenerationHandle;
import org.resultvault.engine.Occurrence;
import org.resultvault.engine.ReportStore;
import org.resultvault.engine.ReviewDecision;
import org.resultvault.engine.RunLockedException;
import org.resultvault.engine.StagedReport;
import org.resultvault.identity.Finding;
import org.resultvault.identity.Fingerprint;
import org.resultvault.identity.FingerprintCalculator;
import org.resultvault.identity.IdentityConfidence;
import org.resultvault.identity.SourceText;
import org.resultvault.obs.CorrelationContext;
import org.resultvault.obs.JsonLinesLogger;
import org.resultvault.suppress.SourceCodeComment;
import org.resultvault.suppress.SourceCodeCommentParser;
import org.resultvault.suppress.SuppressionLookup;

/**
 * Funnels result submissions from many connections into one generation per run.
 *
 * <p>Opening a session claims the run name: a second open of the same run waits for the lock timeout and then
 * fails with {@link RunLockedException}, while different runs ingest in parallel. A session idle for longer
 * than the session timeout is treated as abandoned and aborted by the next caller that wants the run.
 * Submissions are buffered until their last chunk arrives and only then fingerprinted and staged.
 */
public final class IngestionCoordinator {
    private static final long LOCK_POLL_MILLIS = 25L;

    private final ReportStore store;
    private final SourceBlobStore blobs;
    private final FingerprintCalculator calculator;
    private final SourceCodeCommentParser commentParser;
    private final Settings settings;
    private final Clock clock;
    private final JsonLinesLogger logger;
    private final ConcurrentMap<String, Semaphore> runLocks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, IngestionSession> sessions = new ConcurrentHashMap<>();

    public IngestionCoordinator(final ReportStore store, final SourceBlobStore blobs) {
        this(
                store,
                blobs,
                new FingerprintCalculator(),
                new SourceCodeCommentParser(),
                Settings.DEFAULT,
                Clock.systemUTC(),
                JsonLinesLogger.noop());
    }

    public IngestionCoordinator(
            final ReportStore store,
            final SourceBlobStore blobs,
            final FingerprintCalculator calculator,
            final SourceCodeCommentParser commentParser,
            final Settings settings,
            final Clock clock,
            final JsonLinesLogger logger) {
        this.store = Objects.requireNonNull(store, "store");
        this.blobs = Objects.requireNonNull(blobs, "blobs");
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.commentParser = Objects.requireNonNull(commentParser, "commentParser");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public IngestionSession open(final String runName, final IngestionOptions options) {
        return open(runName, options, null);
    }

    /**
     * @throws RunLockedException when the run stays claimed by another session for the whole lock timeout
     */
    public IngestionSession open(final String runName, final IngestionOptions options, final String connectionId) {
        Objects.requireNonNull(runName, "runName");
        Objects.requireNonNull(options, "options");
        final String name = runName.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("run name must not be blank");
        }

        final Semaphore runLock = runLocks.computeIfAbsent(name, key -> new Semaphore(1, true));
        acquire(name, runLock);

        final GenerationHandle handle;
        try {
            handle = store.beginIngestion(name, options.generation());
        } catch (final RuntimeException failure) {
            runLock.release();
            throw failure;
        }
        final IngestionSession session = new IngestionSession(
                UUID.randomUUID().toString(), name, options, handle, connectionId, clock.instant());
        sessions.put(session.id(), session);
        final Object expected = options.expectedSubmissions() == null ? "unknown" : options.expectedSubmissions();
        logger.info("ingestion.open", correlation(session, "openIngestion"), Map.of(
                "baseGeneration", handle.baseGeneration(),
                "expectedSubmissions", expected));
        return session;
    }

    public SubmissionReceipt submit(
            final String sessionId, final String submissionId, final String connectionId, final SubmissionChunk chunk) {
        Objects.requireNonNull(submissionId, "submissionId");
        Objects.requireNonNull(chunk, "chunk");
        final IngestionSession session = requireSession(sessionId);
        final Lock shared = session.lock().readLock();
        shared.lock();
        try {
            if (session.isClosed()) {
                throw new UnknownSessionException(sessionId);
            }
            session.touch(clock.instant());
            final IngestionSession.PendingSubmission complete = session.append(submissionId, connectionId, chunk);
            if (complete == null) {
                return new SubmissionReceipt(submissionId, false, session.bufferedFindings(submissionId), 0);
            }
            final int staged = apply(session, complete);
            return new SubmissionReceipt(submissionId, true, complete.bufferedFindings(), staged);
        } finally {
            shared.unlock();
        }
    }

    /**
     * Drops every incomplete submission that was started on {@code connectionId}.
     *
     * @return the number of submissions dropped
     */
    public int discardConnection(final String connectionId) {
        Objects.requireNonNull(connectionId, "connectionId");
        int discarded = 0;
        for (final IngestionSession session : sessions.values()) {
            final int dropped = session.discardFrom(connectionId);
            if (dropped > 0) {
                discarded += dropped;
                logger.warn("ingestion.discard", correlation(session, "discardConnection"), Map.of(
                        "droppedSubmissions", dropped,
                        "discardedConnection", connectionId));
            }
        }
        return discarded;
    }

    /**
     * Commits the session's generation.
     *
     * @throws IngestionIncompleteException when expected submissions are missing or partial ones remain; the
     *     generation is aborted
     * @throws org.resultvault.engine.StorageConflictException when the run moved on since the session opened
     */
    public IngestionResult finalize(final String sessionId) {
        final IngestionSession session = requireSession(sessionId);
        final Lock exclusive = session.lock().writeLock();
        exclusive.lock();
        try {
            if (session.isClosed()) {
                throw new UnknownSessionException(sessionId);
            }
            final CorrelationContext correlation = correlation(session, "finalizeIngestion");
            final Integer expected = session.options().expectedSubmissions();
            final int completed = session.completedSubmissions();
            final int partial = session.incompleteSubmissions();
            if (partial > 0 || expected != null && completed < expected) {
                closeSession(session, true);
                logger.warn("ingestion.incomplete", correlation, Map.of(
                        "completedSubmissions", completed,
                        "partialSubmissions", partial,
                        "expectedSubmissions", expected == null ? "unknown" : expected));
                throw new IngestionIncompleteException(session.runName(), expected, completed, partial);
            }

            final CommitResult commit;
            try {
                commit = store.commit(session.handle());
            } finally {
                closeSession(session, false);
            }
            return new IngestionResult(
                    commit,
                    completed,
                    session.staged(),
                    session.skippedUnknownSource(),
                    session.skippedByList());
        } finally {
            exclusive.unlock();
        }
    }

    public void abort(final String sessionId) {
        final IngestionSession session = requireSession(sessionId);
        final Lock exclusive = session.lock().writeLock();
        exclusive.lock();
        try {
            if (!session.isClosed()) {
                closeSession(session, true);
            }
        } finally {
            exclusive.unlock();
        }
    }

    public Optional<IngestionSession> session(final String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public List<IngestionSession> openSessions() {
        return new ArrayList<>(sessions.values());
    }

    /**
     * Aborts every session idle for longer than the session timeout.
     *
     * @return the number of sessions aborted
     */
    public int reclaimExpiredSessions() {
        int reclaimed = 0;
        for (final IngestionSession session : sessions.values()) {
            if (reclaimIfExpired(session)) {
                reclaimed++;
            }
        }
        return reclaimed;
    }

    private void acquire(final String runName, final Semaphore runLock) {
        final long deadline = System.nanoTime() + settings.lockTimeout().toNanos();
        try {
            while (true) {
                if (runLock.tryAcquire(Math.min(LOCK_POLL_MILLIS, remainingMillis(deadline)), TimeUnit.MILLISECONDS)) {
                    return;
                }
                reclaimExpired(runName);
                if (System.nanoTime() - deadline >= 0) {
                    if (runLock.tryAcquire()) {
                        return;
                    }
                    throw new RunLockedException(runName, "another ingestion has held it for longer than "
                            + settings.lockTimeout().toMillis() + " ms");
                }
            }
        } catch (final InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new RunLockedException(runName, "interrupted while waiting for the run lock");
        }
    }

    private static long remainingMillis(final long deadline) {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
    }

    private void reclaimExpired(final String runName) {
        for (final IngestionSession session : sessions.values()) {
            if (session.runName().equals(runName)) {
                reclaimIfExpired(session);
            }
        }
    }

    private boolean reclaimIfExpired(final IngestionSession session) {
        final Duration idle = Duration.between(session.lastActivity(), clock.instant());
        if (idle.compareTo(settings.sessionTimeout()) <= 0) {
            return false;
        }
        final Lock exclusive = session.lock().writeLock();
        if (!exclusive.tryLock()) {
            return false;
        }
        try {
            if (session.isClosed()) {
                return false;
            }
            logger.warn("ingestion.expired", correlation(session, "reclaim"), Map.of("idleMillis", idle.toMillis()));
            closeSession(session, true);
            return true;
        } finally {
            exclusive.unlock();
        }
    }

    private void closeSession(final IngestionSession session, final boolean abortGeneration) {
        try {
            if (abortGeneration) {
                store.abort(session.handle());
            }
        } finally {
            session.close();
            sessions.remove(session.id(), session);
            runLocks.get(session.runName()).release();
        }
    }

    private int apply(final IngestionSession session, final IngestionSession.PendingSubmission submission) {
        final CorrelationContext correlation = correlation(session, "submitResults");
        final Map<String, SourceFile> stored = new HashMap<>();
        for (final Map.Entry<String, byte[]> source : submission.sources().entrySet()) {
            stored.put(source.getKey(), blobs.store(source.getKey(), source.getValue()));
        }

        final Map<BlobId, SourceText> decoded = new HashMap<>();
        final Instant now = clock.instant();
        int staged = 0;
        int unknownSource = 0;
        int excluded = 0;
        for (final Finding finding : submission.findings()) {
            if (session.options().skipList().excludes(finding.filePath())) {
                excluded++;
                continue;
            }
            final SourceFile file = stored.computeIfAbsent(finding.filePath(), this::previouslyStored);
            if (file == null) {
                unknownSource++;
                logger.warn("ingestion.source_missing", correlation, Map.of(
                        "file", finding.filePath(),
                        "checkerId", finding.checkerId()));
                continue;
            }
            final SourceText text = decoded.computeIfAbsent(file.blobId(), id -> SourceText.decode(blobs.get(id)));
            final Fingerprint fingerprint = calculator.compute(finding, text);
            if (fingerprint.confidence() == IdentityConfidence.FILE_RELATIVE) {
                logger.debug("identity.fallback", correlation, Map.of(
                        "file", finding.filePath(),
                        "line", finding.line(),
                        "fingerprint", fingerprint.value()));
            }
            store.addReport(session.handle(), new StagedReport(
                    fingerprint,
                    finding.checkerId(),
                    finding.severity(),
                    finding.message(),
                    file,
                    finding.line(),
                    finding.column(),
                    finding.bugPath(),
                    List.of(new Occurrence(
                            finding.compilationUnit(), finding.filePath(), finding.line(), finding.column())),
                    sourceReview(finding, text, now, correlation)));
            staged++;
        }
        session.handle().countSubmission();
        session.recordCompleted(staged, unknownSource, excluded);
        logger.info("ingestion.submission", correlation, Map.of(
                "submissionId", submission.submissionId(),
                "staged", staged,
                "skippedUnknownSource", unknownSource,
                "skippedByList", excluded));
        return staged;
    }

    private SourceFile previouslyStored(final String path) {
        return blobs.latest(path).map(blobId -> new SourceFile(path, blobId)).orElse(null);
    }

    private ReviewDecision sourceReview(
            final Finding finding, final SourceText text, final Instant now, final CorrelationContext correlation) {
        final SuppressionLookup lookup = commentParser.lookup(text, finding.line(), finding.checkerId());
        switch (lookup.outcome()) {
            case MATCHED -> {
                final SourceCodeComment comment = lookup.comment().orElseThrow();
                return ReviewDecision.fromSourceComment(comment.status(), comment.message(), now);
            }
            case AMBIGUOUS, MISSPELLED -> {
                final Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("file", finding.filePath());
                fields.put("line", finding.line());
                fields.put("checkerId", finding.checkerId());
                fields.put("problem", lookup.problem());
                logger.warn(
                        lookup.outcome() == SuppressionLookup.Outcome.AMBIGUOUS
                                ? "suppression.ambiguous"
                                : "suppression.misspelled",
                        correlation,
                        fields);
                return null;
            }
            default -> {
                return null;
            }
        }
    }

    private IngestionSession requireSession(final String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        final IngestionSession session = sessions.get(sessionId);
        if (session == null) {
            throw new UnknownSessionException(sessionId);
        }
        return session;
    }

    private static CorrelationContext correlation(final IngestionSession session, final String operation) {
        return new CorrelationContext(
                session.id(), operation, session.connectionId(), session.runName(), session.id());
    }

    /**
     * @param lockTimeout how long {@code open} waits for a run claimed by another session
     * @param sessionTimeout idle time after which an open session is considered abandoned
     */
    public record Settings(Duration lockTimeout, Duration sessionTimeout) {
        public static final Settings DEFAULT = new Settings(Duration.ofSeconds(30), Duration.ofMinutes(30));

        public Settings {
            Objects.requireNonNull(lockTimeout, "lockTimeout");
            Objects.requireNonNull(sessionTimeout, "sessionTimeout");
            if (lockTimeout.isNegative() || sessionTimeout.isNegative() || sessionTimeout.isZero()) {
                throw new IllegalArgumentException(
                        "lock timeout must not be negative and session timeout must be positive");
            }
        }
    }
}
