package org.resultvault.ingest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.resultvault.engine.GenerationHandle;
import org.resultvault.identity.Finding;

/**
 * Server-side state of one open ingestion: the claimed run, its generation handle and the submissions that
 * are still being transferred.
 *
 * <p>Submissions run under the shared side of {@link #lock()}; finalize and abort take the exclusive side, so
 * a generation is never committed while a submission is half applied.
 */
public final class IngestionSession {
    private final String id;
    private final String runName;
    private final IngestionOptions options;
    private final GenerationHandle handle;
    private final String connectionId;
    private final ConcurrentMap<String, PendingSubmission> pending = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicInteger completedSubmissions = new AtomicInteger();
    private final AtomicInteger staged = new AtomicInteger();
    private final AtomicInteger skippedUnknownSource = new AtomicInteger();
    private final AtomicInteger skippedByList = new AtomicInteger();
    private volatile Instant lastActivity;
    private volatile boolean closed;

    IngestionSession(
            final String id,
            final String runName,
            final IngestionOptions options,
            final GenerationHandle handle,
            final String connectionId,
            final Instant openedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.runName = Objects.requireNonNull(runName, "runName");
        this.options = Objects.requireNonNull(options, "options");
        this.handle = Objects.requireNonNull(handle, "handle");
        this.connectionId = connectionId;
        this.lastActivity = Objects.requireNonNull(openedAt, "openedAt");
    }

    public String id() {
        return id;
    }

    public String runName() {
        return runName;
    }

    public IngestionOptions options() {
        return options;
    }

    public String connectionId() {
        return connectionId;
    }

    public long baseGeneration() {
        return handle.baseGeneration();
    }

    public int completedSubmissions() {
        return completedSubmissions.get();
    }

    public int incompleteSubmissions() {
        return pending.size();
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    GenerationHandle handle() {
        return handle;
    }

    ReadWriteLock lock() {
        return lock;
    }

    boolean isClosed() {
        return closed;
    }

    void close() {
        closed = true;
        pending.clear();
    }

    void touch(final Instant now) {
        lastActivity = now;
    }

    /**
     * Buffers a chunk and returns the whole submission once its last chunk arrived, otherwise {@code null}.
     */
    PendingSubmission append(final String submissionId, final String chunkConnectionId, final SubmissionChunk chunk) {
        final PendingSubmission submission = pending.computeIfAbsent(
                submissionId, key -> new PendingSubmission(key, chunkConnectionId));
        submission.add(chunk);
        if (!chunk.last()) {
            return null;
        }
        return pending.remove(submissionId, submission) ? submission : null;
    }

    int discardFrom(final String discardedConnectionId) {
        int discarded = 0;
        for (final PendingSubmission submission : pending.values()) {
            if (Objects.equals(submission.connectionId(), discardedConnectionId)
                    && pending.remove(submission.submissionId(), submission)) {
                discarded++;
            }
        }
        return discarded;
    }

    void recordCompleted(final int stagedFindings, final int unknownSource, final int excluded) {
        completedSubmissions.incrementAndGet();
        staged.addAndGet(stagedFindings);
        skippedUnknownSource.addAndGet(unknownSource);
        skippedByList.addAndGet(excluded);
    }

    int bufferedFindings(final String submissionId) {
        final PendingSubmission submission = pending.get(submissionId);
        return submission == null ? 0 : submission.bufferedFindings();
    }

    int staged() {
        return staged.get();
    }

    int skippedUnknownSource() {
        return skippedUnknownSource.get();
    }

    int skippedByList() {
        return skippedByList.get();
    }

    static final class PendingSubmission {
        private final String submissionId;
        private final String connectionId;
        private final List<Finding> findings = new ArrayList<>();
        private final Map<String, byte[]> sources = new LinkedHashMap<>();

        private PendingSubmission(final String submissionId, final String connectionId) {
            this.submissionId = submissionId;
            this.connectionId = connectionId;
        }

        String submissionId() {
            return submissionId;
        }

        String connectionId() {
            return connectionId;
        }

        synchronized void add(final SubmissionChunk chunk) {
            findings.addAll(chunk.findings());
            sources.putAll(chunk.sources());
        }

        synchronized List<Finding> findings() {
            return List.copyOf(findings);
        }

        synchronized Map<String, byte[]> sources() {
            return new LinkedHashMap<>(sources);
        }

        synchronized int bufferedFindings() {
            return findings.size();
        }
    }
}
