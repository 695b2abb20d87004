package org.resultvault.query;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.resultvault.blob.BlobId;
import org.resultvault.blob.SourceFile;
import org.resultvault.engine.DetectionStatus;
import org.resultvault.engine.Occurrence;
import org.resultvault.engine.Report;
import org.resultvault.identity.ContentHashes;
import org.resultvault.identity.IdentityConfidence;
import org.resultvault.identity.Severity;

class DeduplicatorTest {
    private static final SourceFile HEADER = new SourceFile("include/util.h", BlobId.of(new byte[] {1}));

    private final Deduplicator deduplicator = new Deduplicator();

    @Test
    void headerFindingReachedFromTwoUnitsIsListedPerUnit() {
        Report header = report("A", List.of(
                new Occurrence("src/a.cpp", HEADER.path(), 7, 2),
                new Occurrence("src/b.cpp", HEADER.path(), 7, 2)));

        List<ReportEntry> entries = deduplicator.deduplicate("app", List.of(header));

        assertEquals(2, entries.size());
        assertEquals(List.of("src/a.cpp", "src/b.cpp"), units(entries));
        assertEquals("app", entries.get(0).runName());
        assertEquals(DetectionStatus.NEW, entries.get(0).detectionStatus());
    }

    @Test
    void uniqueCollapsesToOneEntryPerFingerprint() {
        Report header = report("A", List.of(
                new Occurrence("src/a.cpp", HEADER.path(), 7, 2),
                new Occurrence("src/b.cpp", HEADER.path(), 7, 2)));
        List<ReportEntry> fromRuns = new ArrayList<>(deduplicator.deduplicate("app", List.of(header)));
        fromRuns.addAll(deduplicator.deduplicate("lib", List.of(header, report("B", List.of()))));

        List<ReportEntry> unique = deduplicator.unique(fromRuns);

        assertEquals(2, unique.size());
        ReportEntry collapsed = unique.stream()
                .filter(entry -> entry.fingerprint().equals(ContentHashes.md5Hex("A")))
                .findFirst()
                .orElseThrow();
        assertEquals(4, collapsed.occurrences());
        assertEquals("app", collapsed.runName());
    }

    @Test
    void reportWithoutOccurrencesUsesPrimaryLocation() {
        List<ReportEntry> entries = deduplicator.deduplicate("app", List.of(report("B", List.of())));

        assertEquals(1, entries.size());
        assertEquals(HEADER.path(), entries.get(0).compilationUnit());
        assertEquals(12, entries.get(0).line());
    }

    @Test
    void transientEntriesCollapseByFingerprintAndUnit() {
        ReportEntry first = ReportEntry.transientEntry("f1", "core.A", "a.cpp", 3, 1, Severity.LOW, "m", "a.cpp");
        ReportEntry again = ReportEntry.transientEntry("f1", "core.A", "a.cpp", 9, 1, Severity.LOW, "m", "a.cpp");
        ReportEntry other = ReportEntry.transientEntry("f1", "core.A", "a.cpp", 3, 1, Severity.LOW, "m", "b.cpp");

        List<ReportEntry> entries = deduplicator.deduplicateEntries(List.of(first, again, other));

        assertEquals(2, entries.size());
        assertEquals(3, entries.get(0).line());
        assertEquals(2, entries.get(0).occurrences());
    }

    private static List<String> units(final List<ReportEntry> entries) {
        List<String> units = new ArrayList<>();
        for (ReportEntry entry : entries) {
            units.add(entry.compilationUnit());
        }
        return units;
    }

    private static Report report(final String name, final List<Occurrence> occurrences) {
        return new Report(
                ContentHashes.md5Hex(name),
                IdentityConfidence.SCOPED,
                "core.Checker",
                Severity.MEDIUM,
                "finding " + name,
                HEADER,
                12,
                2,
                List.of(),
                occurrences,
                DetectionStatus.NEW,
                null,
                1L,
                Instant.parse("2026-03-01T12:00:00Z"),
                null,
                null);
    }
}
