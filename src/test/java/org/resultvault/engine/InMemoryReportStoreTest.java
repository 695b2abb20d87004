package org.resultvault.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.resultvault.engine.ReportFixtures.fingerprint;
import static org.resultvault.engine.ReportFixtures.staged;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.resultvault.obs.JsonLinesLogger;

class InMemoryReportStoreTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private final InMemoryReportStore store = new InMemoryReportStore(CLOCK, 0, JsonLinesLogger.noop());

    @Test
    void vanishedFindingResolvesAndReturningFindingReopens() {
        CommitResult first = ingest("app", GenerationOptions.DEFAULT, "A", "B", "C");
        assertEquals(1L, first.generation());
        assertEquals(3, first.transitionsTo(DetectionStatus.NEW));

        CommitResult second = ingest("app", GenerationOptions.DEFAULT, "A", "C");
        assertEquals(2L, second.generation());
        assertEquals(2, second.transitionsTo(DetectionStatus.UNRESOLVED));
        assertEquals(1, second.transitionsTo(DetectionStatus.RESOLVED));
        Report resolved = byFingerprint("app").get(fingerprint("B"));
        assertEquals(DetectionStatus.RESOLVED, resolved.detectionStatus());
        assertEquals(2L, resolved.fixedAtGeneration());
        assertEquals(1L, resolved.detectedAtGeneration());

        CommitResult third = ingest("app", GenerationOptions.DEFAULT, "A", "B", "C");
        assertEquals(1, third.transitionsTo(DetectionStatus.REOPENED));
        Report reopened = byFingerprint("app").get(fingerprint("B"));
        assertEquals(DetectionStatus.REOPENED, reopened.detectionStatus());
        assertNull(reopened.fixedAtGeneration());
        assertNull(reopened.fixedAt());

        Run run = store.run("app").orElseThrow();
        assertEquals(3L, run.generation());
        assertEquals(3, run.history().size());
        assertEquals(Set.of(fingerprint("A"), fingerprint("B"), fingerprint("C")), run.latest().openFingerprints());
    }

    @Test
    void reingestingSameResultsChangesNothingButGeneration() {
        ingest("app", GenerationOptions.DEFAULT, "A", "B");
        ingest("app", GenerationOptions.DEFAULT, "A", "B");
        Map<String, Report> before = byFingerprint("app");

        CommitResult again = ingest("app", GenerationOptions.DEFAULT, "A", "B");

        assertTrue(again.transitions().isEmpty());
        assertEquals(before, byFingerprint("app"));
        assertEquals(2, store.run("app").orElseThrow().latest().count(DetectionStatus.UNRESOLVED));
    }

    @Test
    void disabledAndNotEnabledCheckersMoveVanishedFindingsAside() {
        CommitResult first = store.commit(open("app", GenerationOptions.DEFAULT,
                staged("A", "core.A"), staged("B", "core.B"), staged("C", "core.C")));
        assertEquals(1L, first.generation());

        GenerationOptions options =
                new GenerationOptions(null, Set.of("core.A", "core.C"), Set.of("core.B"), Map.of());
        store.commit(open("app", options, staged("A", "core.A")));

        Map<String, Report> reports = byFingerprint("app");
        assertEquals(DetectionStatus.OFF, reports.get(fingerprint("B")).detectionStatus());
        assertEquals(DetectionStatus.RESOLVED, reports.get(fingerprint("C")).detectionStatus());

        GenerationOptions onlyA = new GenerationOptions(null, Set.of("core.A"), Set.of(), Map.of());
        store.commit(open("app", onlyA, staged("A", "core.A"), staged("C", "core.C")));
        store.commit(open("app", onlyA, staged("A", "core.A")));
        assertEquals(DetectionStatus.UNAVAILABLE, byFingerprint("app").get(fingerprint("C")).detectionStatus());

        CommitResult back = store.commit(open("app", GenerationOptions.DEFAULT,
                staged("A", "core.A"), staged("B", "core.B"), staged("C", "core.C")));
        reports = byFingerprint("app");
        assertEquals(DetectionStatus.UNRESOLVED, reports.get(fingerprint("B")).detectionStatus());
        assertEquals(DetectionStatus.UNRESOLVED, reports.get(fingerprint("C")).detectionStatus());
        assertEquals(0, back.transitionsTo(DetectionStatus.REOPENED));
    }

    @Test
    void duplicateFingerprintsMergeOccurrencesKeepingFirstLocation() {
        GenerationHandle handle = store.beginIngestion("app");
        store.addReport(handle, staged("A", "core.A", 10, null));
        store.addReport(handle, staged("A", "core.A", 20, null));
        store.addReport(handle, staged("A", "core.A", 10, null));
        CommitResult result = store.commit(handle);

        assertEquals(1, result.reportCount());
        Report report = store.reports("app").get(0);
        assertEquals(10, report.line());
        assertEquals(2, report.occurrences().size());
    }

    @Test
    void concurrentCommitAgainstSameBaseConflicts() {
        GenerationHandle winner = store.beginIngestion("app");
        GenerationHandle loser = store.beginIngestion("app");
        store.addReport(winner, staged("A", "core.A"));
        store.addReport(loser, staged("B", "core.B"));

        store.commit(winner);
        StorageConflictException conflict = assertThrows(StorageConflictException.class, () -> store.commit(loser));

        assertEquals(0L, conflict.baseGeneration());
        assertEquals(1L, conflict.currentGeneration());
        assertEquals(GenerationHandle.State.ABORTED, loser.state());
        assertEquals(Set.of(fingerprint("A")), byFingerprint("app").keySet());
    }

    @Test
    void abortedFirstIngestionLeavesNoRun() {
        GenerationHandle handle = store.beginIngestion("fresh");
        store.addReport(handle, staged("A", "core.A"));

        store.abort(handle);

        assertTrue(store.run("fresh").isEmpty());
        assertTrue(store.runs().isEmpty());
        assertThrows(RunNotFoundException.class, () -> store.reports("fresh"));
        assertThrows(IllegalStateException.class, () -> store.addReport(handle, staged("B", "core.B")));
    }

    @Test
    void runLimitAppliesToNewRunsOnly() {
        InMemoryReportStore limited = new InMemoryReportStore(CLOCK, 1, JsonLinesLogger.noop());
        GenerationHandle first = limited.beginIngestion("one");
        limited.addReport(first, staged("A", "core.A"));
        limited.commit(first);

        RunLimitExceededException failure =
                assertThrows(RunLimitExceededException.class, () -> limited.beginIngestion("two"));
        assertEquals(1, failure.limit());

        GenerationHandle again = limited.beginIngestion("one");
        limited.commit(again);
        assertEquals(2L, limited.run("one").orElseThrow().generation());
    }

    @Test
    void taggedGenerationKeepsItsOpenSet() {
        ingest("app", GenerationOptions.tagged("v1"), "A", "B");
        ingest("app", GenerationOptions.tagged("v2"), "A");

        List<String> openAtV1 = new ArrayList<>();
        for (Report report : store.openReportsAt("app", "v1")) {
            openAtV1.add(report.fingerprint());
        }
        assertEquals(List.of(fingerprint("A"), fingerprint("B")).stream().sorted().toList(), openAtV1);
        assertEquals(1, store.openReportsAt("app", "v2").size());
        assertThrows(RunNotFoundException.class, () -> store.openReportsAt("app", "v3"));
        assertEquals("v1", store.run("app").orElseThrow().tagged("v1").orElseThrow().tag());
    }

    @Test
    void sourceCommentDecisionAppliesAcrossRunsUntilUserOverrides() {
        ReviewDecision comment =
                ReviewDecision.fromSourceComment(ReviewStatus.FALSE_POSITIVE, "noise", CLOCK.instant());
        store.commit(open("app", GenerationOptions.DEFAULT, staged("A", "core.A", 10, comment)));

        Report suppressed = store.reports("app").get(0);
        assertEquals(ReviewStatus.FALSE_POSITIVE, suppressed.reviewStatus());
        assertFalse(suppressed.isActive());

        store.commit(open("other", GenerationOptions.DEFAULT, staged("A", "core.A", 10, comment)));
        assertEquals(ReviewStatus.FALSE_POSITIVE, store.reports("other").get(0).reviewStatus());

        store.setReviewStatus(
                fingerprint("A"),
                ReviewDecision.byUser(ReviewStatus.CONFIRMED, "alice", "real bug", CLOCK.instant()));
        assertEquals(ReviewStatus.CONFIRMED, store.reports("app").get(0).reviewStatus());
        assertEquals(ReviewStatus.CONFIRMED, store.reports("other").get(0).reviewStatus());
        assertTrue(store.reports("app").get(0).isActive());
    }

    @Test
    void removedCommentFallsBackToUnreviewed() {
        ReviewDecision comment =
                ReviewDecision.fromSourceComment(ReviewStatus.FALSE_POSITIVE, "noise", CLOCK.instant());
        store.commit(open("app", GenerationOptions.DEFAULT, staged("A", "core.A", 10, comment)));

        store.commit(open("app", GenerationOptions.DEFAULT, staged("A", "core.A")));

        Report report = store.reports("app").get(0);
        assertEquals(ReviewStatus.UNREVIEWED, report.reviewStatus());
        assertTrue(report.isActive());
        assertTrue(store.reviewStatus(fingerprint("A")).isEmpty());
        assertTrue(store.exportState().shadowedReviews().isEmpty());
    }

    @Test
    void removedCommentRestoresUserDecisionItOverrode() {
        ReviewDecision user = ReviewDecision.byUser(ReviewStatus.CONFIRMED, "alice", "real bug", CLOCK.instant());
        ingest("app", GenerationOptions.DEFAULT, "A");
        store.setReviewStatus(fingerprint("A"), user);

        ReviewDecision comment =
                ReviewDecision.fromSourceComment(ReviewStatus.INTENTIONAL, "by contract", CLOCK.instant());
        store.commit(open("app", GenerationOptions.DEFAULT, staged("A", "core.Checker", 10, comment)));
        assertEquals(ReviewStatus.INTENTIONAL, store.reports("app").get(0).reviewStatus());
        assertEquals(user, store.exportState().shadowedReviews().get(fingerprint("A")));

        InMemoryReportStore restored =
                InMemoryReportStore.restore(store.exportState(), CLOCK, 0, JsonLinesLogger.noop());
        GenerationHandle handle = restored.beginIngestion("app");
        restored.addReport(handle, staged("A", "core.Checker"));
        restored.commit(handle);

        assertEquals(user, restored.reviewStatus(fingerprint("A")).orElseThrow());
        assertEquals(ReviewStatus.CONFIRMED, restored.reports("app").get(0).reviewStatus());
    }

    @Test
    void commentOnVanishedFindingKeepsItsDecision() {
        ReviewDecision comment =
                ReviewDecision.fromSourceComment(ReviewStatus.FALSE_POSITIVE, "noise", CLOCK.instant());
        store.commit(open("app", GenerationOptions.DEFAULT,
                staged("A", "core.A", 10, comment), staged("B", "core.B")));

        store.commit(open("app", GenerationOptions.DEFAULT, staged("B", "core.B")));

        assertEquals(ReviewStatus.FALSE_POSITIVE, store.reviewStatus(fingerprint("A")).orElseThrow().status());
    }

    @Test
    void rejectedJournalWriteLeavesStoreUnchanged() {
        List<ReportStoreState> written = new ArrayList<>();
        AtomicBoolean failing = new AtomicBoolean();
        InMemoryReportStore journaled = new InMemoryReportStore(CLOCK, 1, JsonLinesLogger.noop(), state -> {
            if (failing.get()) {
                throw new IllegalStateException("disk full");
            }
            written.add(state);
        });
        GenerationHandle first = journaled.beginIngestion("app");
        journaled.addReport(first, staged("A", "core.A"));
        journaled.commit(first);
        assertEquals(journaled.exportState(), written.get(written.size() - 1));

        failing.set(true);
        GenerationHandle second = journaled.beginIngestion("app");
        journaled.addReport(second, staged("B", "core.B"));
        assertThrows(IllegalStateException.class, () -> journaled.commit(second));
        assertEquals(GenerationHandle.State.ABORTED, second.state());
        assertEquals(1L, journaled.run("app").orElseThrow().generation());
        assertEquals(Set.of(fingerprint("A")), journaled.reports("app").stream()
                .map(Report::fingerprint)
                .collect(Collectors.toSet()));

        assertThrows(IllegalStateException.class, () -> journaled.setReviewStatus(
                fingerprint("A"),
                ReviewDecision.byUser(ReviewStatus.CONFIRMED, "alice", "", CLOCK.instant())));
        assertTrue(journaled.reviewStatus(fingerprint("A")).isEmpty());
        assertThrows(IllegalStateException.class, () -> journaled.deleteRun("app"));
        assertTrue(journaled.run("app").isPresent());

        failing.set(false);
        GenerationHandle retry = journaled.beginIngestion("app");
        journaled.addReport(retry, staged("B", "core.B"));
        assertEquals(2L, journaled.commit(retry).generation());
        assertEquals(journaled.exportState(), written.get(written.size() - 1));
    }

    @Test
    void rejectedFirstCommitFreesRunAndLimitSlot() {
        InMemoryReportStore journaled = new InMemoryReportStore(CLOCK, 1, JsonLinesLogger.noop(), state -> {
            if (state.runs().stream().anyMatch(run -> run.name().equals("broken"))) {
                throw new IllegalStateException("disk full");
            }
        });
        GenerationHandle broken = journaled.beginIngestion("broken");
        assertThrows(IllegalStateException.class, () -> journaled.commit(broken));

        assertTrue(journaled.runs().isEmpty());
        GenerationHandle other = journaled.beginIngestion("other");
        assertEquals(1L, journaled.commit(other).generation());
    }

    @Test
    void deleteRunRespectsOpenIngestions() {
        ingest("app", GenerationOptions.DEFAULT, "A");
        GenerationHandle open = store.beginIngestion("app");

        assertThrows(RunLockedException.class, () -> store.deleteRun("app"));
        store.abort(open);
        store.deleteRun("app");

        assertTrue(store.run("app").isEmpty());
        assertThrows(RunNotFoundException.class, () -> store.deleteRun("app"));
    }

    @Test
    void exportedStateRestoresRunsAndReviews() {
        ingest("app", GenerationOptions.tagged("v1"), "A", "B");
        store.setReviewStatus(
                fingerprint("B"), ReviewDecision.byUser(ReviewStatus.INTENTIONAL, "bob", "", CLOCK.instant()));

        InMemoryReportStore restored =
                InMemoryReportStore.restore(store.exportState(), CLOCK, 0, JsonLinesLogger.noop());

        assertEquals(store.runs(), restored.runs());
        assertEquals(store.reports("app"), restored.reports("app"));
        assertEquals(ReviewStatus.INTENTIONAL, restored.reviewStatus(fingerprint("B")).orElseThrow().status());
    }

    @Test
    void producersStageIntoOneGenerationConcurrently() throws Exception {
        GenerationHandle handle = store.beginIngestion("app");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                final int offset = worker * 50;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        store.addReport(handle, staged("F" + (offset + i), "core.A"));
                        store.addReport(handle, staged("F" + i, "core.A"));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(400, store.commit(handle).reportCount());
    }

    @Test
    void differentRunsCommitIndependently() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<CommitResult>> futures = new ArrayList<>();
            for (int run = 0; run < 4; run++) {
                final String runName = "run-" + run;
                futures.add(executor.submit(() -> {
                    CommitResult last = null;
                    for (int generation = 0; generation < 20; generation++) {
                        last = ingest(runName, GenerationOptions.DEFAULT, "A", "B" + generation);
                    }
                    return last;
                }));
            }
            Map<String, Long> generations = new HashMap<>();
            for (Future<CommitResult> future : futures) {
                CommitResult result = future.get(10, TimeUnit.SECONDS);
                generations.put(result.runName(), result.generation());
            }
            assertEquals(Map.of("run-0", 20L, "run-1", 20L, "run-2", 20L, "run-3", 20L), generations);
        } finally {
            executor.shutdownNow();
        }
    }

    private CommitResult ingest(final String runName, final GenerationOptions options, final String... names) {
        StagedReport[] reports = new StagedReport[names.length];
        for (int i = 0; i < names.length; i++) {
            reports[i] = staged(names[i], "core.Checker");
        }
        return store.commit(open(runName, options, reports));
    }

    private GenerationHandle open(
            final String runName, final GenerationOptions options, final StagedReport... reports) {
        GenerationHandle handle = store.beginIngestion(runName, options);
        for (StagedReport report : reports) {
            store.addReport(handle, report);
        }
        return handle;
    }

    private Map<String, Report> byFingerprint(final String runName) {
        Map<String, Report> reports = new HashMap<>();
        for (Report report : store.reports(runName)) {
            reports.put(report.fingerprint(), report);
        }
        return reports;
    }
}
