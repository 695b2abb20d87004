package org.resultvault.engine;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.resultvault.obs.CorrelationContext;
import org.resultvault.obs.JsonLinesLogger;

/**
 * In-memory implementation of the report store.
 *
 * <p>Each run owns a slot holding its latest immutable {@link RunState}. Commits lock only the slot of their
 * run and publish the next state with a single volatile write, so readers see either the old or the new
 * generation. Review decisions are kept per fingerprint across all runs.
 *
 * <p>Every change is handed to the {@link StateJournal} before it is published. Journal writes and publishing
 * share one lock, taken after the slot lock, so the journal sees changes in the order readers do.
 */
public final class InMemoryReportStore implements ReportStore {
    private final ConcurrentMap<String, RunSlot> slots = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReviewDecision> reviews = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReviewDecision> shadowedReviews = new ConcurrentHashMap<>();
    private final Object publishLock = new Object();
    private final AtomicInteger committedRuns = new AtomicInteger();
    private final Clock clock;
    private final int maxRuns;
    private final JsonLinesLogger logger;
    private final StateJournal journal;

    public InMemoryReportStore() {
        this(Clock.systemUTC(), 0, JsonLinesLogger.noop());
    }

    /**
     * @param maxRuns maximum number of stored runs, or {@code 0} for no limit
     */
    public InMemoryReportStore(final Clock clock, final int maxRuns, final JsonLinesLogger logger) {
        this(clock, maxRuns, logger, StateJournal.NONE);
    }

    public InMemoryReportStore(
            final Clock clock, final int maxRuns, final JsonLinesLogger logger, final StateJournal journal) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.journal = Objects.requireNonNull(journal, "journal");
        if (maxRuns < 0) {
            throw new IllegalArgumentException("maxRuns must not be negative: " + maxRuns);
        }
        this.maxRuns = maxRuns;
    }

    public static InMemoryReportStore restore(
            final ReportStoreState state, final Clock clock, final int maxRuns, final JsonLinesLogger logger) {
        return restore(state, clock, maxRuns, logger, StateJournal.NONE);
    }

    public static InMemoryReportStore restore(
            final ReportStoreState state,
            final Clock clock,
            final int maxRuns,
            final JsonLinesLogger logger,
            final StateJournal journal) {
        Objects.requireNonNull(state, "state");
        final InMemoryReportStore store = new InMemoryReportStore(clock, maxRuns, logger, journal);
        for (final RunState run : state.runs()) {
            final RunSlot slot = new RunSlot();
            slot.state = run;
            store.slots.put(run.name(), slot);
            store.committedRuns.incrementAndGet();
        }
        store.reviews.putAll(state.reviews());
        store.shadowedReviews.putAll(state.shadowedReviews());
        return store;
    }

    @Override
    public GenerationHandle beginIngestion(final String runName, final GenerationOptions options) {
        final String name = requireRunName(runName);
        Objects.requireNonNull(options, "options");
        while (true) {
            final RunSlot slot = slots.computeIfAbsent(name, key -> new RunSlot());
            synchronized (slot) {
                if (slot.removed) {
                    continue;
                }
                final RunState current = slot.state;
                if (current == null && maxRuns > 0 && committedRuns.get() >= maxRuns) {
                    throw new RunLimitExceededException(name, maxRuns);
                }
                slot.openHandles++;
                final long base = current == null ? 0L : current.generation();
                return new GenerationHandle(UUID.randomUUID().toString(), name, base, options);
            }
        }
    }

    @Override
    public void addReport(final GenerationHandle handle, final StagedReport report) {
        Objects.requireNonNull(handle, "handle");
        handle.stage(report);
    }

    @Override
    public CommitResult commit(final GenerationHandle handle) {
        Objects.requireNonNull(handle, "handle");
        final RunSlot slot = slotOf(handle);
        final CorrelationContext correlation = correlation(handle, "commit");
        final CommitResult result;
        final Map<String, PendingReview> reviewUpdates = new HashMap<>();
        synchronized (slot) {
            if (handle.state() != GenerationHandle.State.OPEN) {
                throw new IllegalStateException(
                        "generation " + handle.id() + " of run '" + handle.runName() + "' is " + handle.state());
            }
            final RunState current = slot.state;
            final long currentGeneration = current == null ? 0L : current.generation();
            if (currentGeneration != handle.baseGeneration()) {
                release(slot, handle, GenerationHandle.State.ABORTED);
                logger.warn("ingestion.conflict", correlation, Map.of(
                        "baseGeneration", handle.baseGeneration(),
                        "currentGeneration", currentGeneration));
                throw new StorageConflictException(handle.runName(), handle.baseGeneration(), currentGeneration);
            }
            if (current == null && !reserveRun()) {
                release(slot, handle, GenerationHandle.State.ABORTED);
                throw new RunLimitExceededException(handle.runName(), maxRuns);
            }

            final Instant now = clock.instant();
            final long generation = currentGeneration + 1;
            final Map<String, Report> previousReports = current == null ? Map.of() : current.reports();
            final Map<String, Report> nextReports = new TreeMap<>(previousReports);
            final Map<DetectionStatus, Integer> transitions = new EnumMap<>(DetectionStatus.class);
            final Set<String> seen = new HashSet<>();

            for (final StagedReport staged : handle.stagedReports()) {
                final String fingerprint = staged.fingerprint().value();
                seen.add(fingerprint);
                final Report previous = previousReports.get(fingerprint);
                final DetectionStatus status =
                        DetectionStatus.present(previous == null ? null : previous.detectionStatus());
                final ReviewDecision review = reviewFor(fingerprint, staged.sourceReview(), reviewUpdates);
                nextReports.put(fingerprint, new Report(
                        fingerprint,
                        staged.fingerprint().confidence(),
                        staged.checkerId(),
                        staged.severity(),
                        staged.message(),
                        staged.file(),
                        staged.line(),
                        staged.column(),
                        staged.bugPath(),
                        staged.occurrences(),
                        status,
                        review,
                        previous == null ? generation : previous.detectedAtGeneration(),
                        previous == null ? now : previous.detectedAt(),
                        null,
                        null));
                if (previous == null || previous.detectionStatus() != status) {
                    transitions.merge(status, 1, Integer::sum);
                }
            }

            for (final Report previous : previousReports.values()) {
                if (seen.contains(previous.fingerprint())) {
                    continue;
                }
                final DetectionStatus status = DetectionStatus.absent(
                        previous.detectionStatus(), handle.options().checkerState(previous.checkerId()));
                if (status != previous.detectionStatus()) {
                    nextReports.put(previous.fingerprint(), previous.withDetection(status, generation, now));
                    transitions.merge(status, 1, Integer::sum);
                }
            }

            final Map<DetectionStatus, Integer> statusCounts = new EnumMap<>(DetectionStatus.class);
            final Set<String> open = new HashSet<>();
            for (final Report report : nextReports.values()) {
                statusCounts.merge(report.detectionStatus(), 1, Integer::sum);
                if (report.detectionStatus().isActive()) {
                    open.add(report.fingerprint());
                }
            }
            final GenerationOptions options = handle.options();
            final RunGeneration entry = new RunGeneration(
                    generation,
                    options.tag(),
                    now,
                    statusCounts,
                    options.enabledCheckers(),
                    options.disabledCheckers(),
                    handle.submissions(),
                    open);
            final List<RunGeneration> history = new ArrayList<>(current == null ? List.of() : current.history());
            history.add(entry);
            final Map<String, String> metadata = new HashMap<>(current == null ? Map.of() : current.metadata());
            metadata.putAll(options.metadata());

            final RunState next = new RunState(
                    handle.runName(),
                    current == null ? now : current.createdAt(),
                    metadata,
                    history,
                    nextReports);
            try {
                synchronized (publishLock) {
                    journal.write(snapshot(handle.runName(), next, reviewUpdates));
                    slot.state = next;
                    applyReviews(reviewUpdates, reviews, shadowedReviews);
                }
            } catch (final RuntimeException failure) {
                if (current == null) {
                    committedRuns.decrementAndGet();
                }
                release(slot, handle, GenerationHandle.State.ABORTED);
                dropIfUnused(slot, handle.runName());
                logger.warn("ingestion.commit_failed", correlation, Map.of(
                        "generation", generation,
                        "error", String.valueOf(failure.getMessage())));
                throw failure;
            }
            release(slot, handle, GenerationHandle.State.COMMITTED);
            result = new CommitResult(handle.runName(), generation, options.tag(), seen.size(), transitions);
        }
        logger.info("ingestion.commit", correlation, Map.of(
                "generation", result.generation(),
                "reports", result.reportCount(),
                "transitions", result.transitions()));
        return result;
    }

    @Override
    public void abort(final GenerationHandle handle) {
        Objects.requireNonNull(handle, "handle");
        final RunSlot slot = slots.get(handle.runName());
        if (slot == null) {
            handle.transition(GenerationHandle.State.OPEN, GenerationHandle.State.ABORTED);
            return;
        }
        final boolean aborted;
        synchronized (slot) {
            aborted = handle.state() == GenerationHandle.State.OPEN;
            if (aborted) {
                release(slot, handle, GenerationHandle.State.ABORTED);
            }
            dropIfUnused(slot, handle.runName());
        }
        if (aborted) {
            logger.info("ingestion.abort", correlation(handle, "abort"), Map.of("staged", handle.stagedCount()));
        }
    }

    @Override
    public Optional<Run> run(final String runName) {
        return Optional.ofNullable(committedState(runName)).map(RunState::view);
    }

    @Override
    public List<Run> runs() {
        final List<Run> runs = new ArrayList<>();
        for (final RunSlot slot : slots.values()) {
            final RunState state = slot.state;
            if (state != null) {
                runs.add(state.view());
            }
        }
        runs.sort((left, right) -> left.name().compareTo(right.name()));
        return runs;
    }

    @Override
    public List<Report> reports(final String runName) {
        final RunState state = committedState(runName);
        if (state == null) {
            throw new RunNotFoundException(runName);
        }
        final List<Report> reports = new ArrayList<>(state.reports().size());
        for (final Report report : state.reports().values()) {
            reports.add(withCurrentReview(report));
        }
        return reports;
    }

    @Override
    public List<Report> openReportsAt(final String runName, final String tag) {
        Objects.requireNonNull(tag, "tag");
        final RunState state = committedState(runName);
        if (state == null) {
            throw new RunNotFoundException(runName);
        }
        final RunGeneration generation = state.view().tagged(tag)
                .orElseThrow(() -> new RunNotFoundException(runName, tag));
        final List<Report> reports = new ArrayList<>();
        for (final String fingerprint : new TreeSet<>(generation.openFingerprints())) {
            final Report report = state.reports().get(fingerprint);
            if (report != null) {
                reports.add(withCurrentReview(report));
            }
        }
        return reports;
    }

    @Override
    public Optional<ReviewDecision> reviewStatus(final String fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        return Optional.ofNullable(reviews.get(fingerprint));
    }

    @Override
    public void setReviewStatus(final String fingerprint, final ReviewDecision decision) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(decision, "decision");
        final Map<String, PendingReview> change = Map.of(fingerprint, new PendingReview(decision, null));
        synchronized (publishLock) {
            journal.write(snapshot(null, null, change));
            applyReviews(change, reviews, shadowedReviews);
        }
    }

    @Override
    public void deleteRun(final String runName) {
        final String name = requireRunName(runName);
        final RunSlot slot = slots.get(name);
        if (slot == null) {
            throw new RunNotFoundException(name);
        }
        synchronized (slot) {
            if (slot.removed || slot.state == null) {
                throw new RunNotFoundException(name);
            }
            if (slot.openHandles > 0) {
                throw new RunLockedException(name, "an ingestion into this run is still open");
            }
            synchronized (publishLock) {
                journal.write(snapshot(name, null, Map.of()));
                slot.removed = true;
                slots.remove(name, slot);
                committedRuns.decrementAndGet();
            }
        }
    }

    @Override
    public ReportStoreState exportState() {
        synchronized (publishLock) {
            return snapshot(null, null, Map.of());
        }
    }

    /**
     * State as it will be once {@code runName} holds {@code replacement} ({@code null} removes the run) and
     * {@code pending} review changes are applied.
     */
    private ReportStoreState snapshot(
            final String runName, final RunState replacement, final Map<String, PendingReview> pending) {
        final List<RunState> runs = new ArrayList<>();
        for (final Map.Entry<String, RunSlot> entry : slots.entrySet()) {
            final RunState state = entry.getValue().state;
            if (state != null && !entry.getKey().equals(runName)) {
                runs.add(state);
            }
        }
        if (replacement != null) {
            runs.add(replacement);
        }
        runs.sort((left, right) -> left.name().compareTo(right.name()));
        final Map<String, ReviewDecision> nextReviews = new HashMap<>(reviews);
        final Map<String, ReviewDecision> nextShadowed = new HashMap<>(shadowedReviews);
        applyReviews(pending, nextReviews, nextShadowed);
        return new ReportStoreState(runs, nextReviews, nextShadowed);
    }

    /**
     * A comment-derived decision holds only while an ingestion still reads the comment. Once the comment is gone
     * the user decision it overrode comes back, or the fingerprint returns to unreviewed.
     */
    private ReviewDecision reviewFor(
            final String fingerprint,
            final ReviewDecision sourceReview,
            final Map<String, PendingReview> reviewUpdates) {
        final ReviewDecision existing = reviews.get(fingerprint);
        final boolean fromComment = existing != null && existing.origin() == ReviewDecision.Origin.SOURCE_COMMENT;
        if (sourceReview == null) {
            if (!fromComment) {
                return existing;
            }
            final ReviewDecision restored = shadowedReviews.get(fingerprint);
            reviewUpdates.put(fingerprint, new PendingReview(restored, null));
            return restored;
        }
        if (fromComment
                && existing.status() == sourceReview.status()
                && existing.message().equals(sourceReview.message())) {
            return existing;
        }
        final ReviewDecision overridden = fromComment || existing == null
                ? shadowedReviews.get(fingerprint)
                : existing;
        reviewUpdates.put(fingerprint, new PendingReview(sourceReview, overridden));
        return sourceReview;
    }

    private static void applyReviews(
            final Map<String, PendingReview> pending,
            final Map<String, ReviewDecision> reviews,
            final Map<String, ReviewDecision> shadowed) {
        pending.forEach((fingerprint, change) -> {
            putOrRemove(reviews, fingerprint, change.decision());
            putOrRemove(shadowed, fingerprint, change.shadowed());
        });
    }

    private static void putOrRemove(
            final Map<String, ReviewDecision> target, final String fingerprint, final ReviewDecision decision) {
        if (decision == null) {
            target.remove(fingerprint);
        } else {
            target.put(fingerprint, decision);
        }
    }

    private Report withCurrentReview(final Report report) {
        return report.withReview(reviews.get(report.fingerprint()));
    }

    private RunState committedState(final String runName) {
        Objects.requireNonNull(runName, "runName");
        final RunSlot slot = slots.get(runName);
        return slot == null ? null : slot.state;
    }

    private RunSlot slotOf(final GenerationHandle handle) {
        final RunSlot slot = slots.get(handle.runName());
        if (slot == null) {
            throw new IllegalStateException(
                    "generation " + handle.id() + " does not belong to an open run '" + handle.runName() + "'");
        }
        return slot;
    }

    private boolean reserveRun() {
        while (true) {
            final int current = committedRuns.get();
            if (maxRuns > 0 && current >= maxRuns) {
                return false;
            }
            if (committedRuns.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private void dropIfUnused(final RunSlot slot, final String runName) {
        if (slot.state == null && slot.openHandles == 0) {
            slot.removed = true;
            slots.remove(runName, slot);
        }
    }

    private static void release(final RunSlot slot, final GenerationHandle handle, final GenerationHandle.State to) {
        if (handle.transition(GenerationHandle.State.OPEN, to)) {
            slot.openHandles--;
        }
    }

    private static CorrelationContext correlation(final GenerationHandle handle, final String operation) {
        return CorrelationContext.of(handle.id(), operation).withRun(handle.runName());
    }

    private static String requireRunName(final String runName) {
        Objects.requireNonNull(runName, "runName");
        final String trimmed = runName.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("run name must not be blank");
        }
        return trimmed;
    }

    /**
     * Review change of one fingerprint; a {@code null} component clears the entry.
     */
    private record PendingReview(ReviewDecision decision, ReviewDecision shadowed) {}

    private static final class RunSlot {
        private volatile RunState state;
        private int openHandles;
        private boolean removed;
    }
}
