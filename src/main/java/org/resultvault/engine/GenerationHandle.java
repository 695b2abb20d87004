package org.resultvault.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An open, uncommitted generation of a run.
 *
 * <p>Reports are staged per fingerprint with an atomic merge, so any number of producer threads may add to the
 * same handle. Nothing staged here is visible to readers until the handle is committed.
 */
public final class GenerationHandle {
    private final String id;
    private final String runName;
    private final long baseGeneration;
    private final GenerationOptions options;
    private final ConcurrentMap<String, StagedReport> staged = new ConcurrentHashMap<>();
    private final AtomicInteger submissions = new AtomicInteger();
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);

    GenerationHandle(
            final String id, final String runName, final long baseGeneration, final GenerationOptions options) {
        this.id = Objects.requireNonNull(id, "id");
        this.runName = Objects.requireNonNull(runName, "runName");
        this.baseGeneration = baseGeneration;
        this.options = Objects.requireNonNull(options, "options");
    }

    public String id() {
        return id;
    }

    public String runName() {
        return runName;
    }

    public long baseGeneration() {
        return baseGeneration;
    }

    public GenerationOptions options() {
        return options;
    }

    public State state() {
        return state.get();
    }

    public int stagedCount() {
        return staged.size();
    }

    public int submissions() {
        return submissions.get();
    }

    public void countSubmission() {
        ensureOpen();
        submissions.incrementAndGet();
    }

    void stage(final StagedReport report) {
        Objects.requireNonNull(report, "report");
        ensureOpen();
        staged.merge(report.fingerprint().value(), report, StagedReport::mergedWith);
    }

    List<StagedReport> stagedReports() {
        return new ArrayList<>(staged.values());
    }

    boolean transition(final State from, final State to) {
        return state.compareAndSet(from, to);
    }

    private void ensureOpen() {
        final State current = state.get();
        if (current != State.OPEN) {
            throw new IllegalStateException("generation " + id + " of run '" + runName + "' is " + current);
        }
    }

    public enum State {
        OPEN,
        COMMITTED,
        ABORTED
    }
}
