package org.resultvault.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.resultvault.engine.Occurrence;
import org.resultvault.engine.Report;

/**
 * Read-side collapsing of stored reports for display.
 *
 * <p>Deduplication keeps one entry per fingerprint and compilation unit, so a header finding reached from two
 * translation units stays listed twice. Uniqueing keeps one entry per fingerprint. Both order their output by
 * fingerprint and then by the order in which the locations were first seen.
 */
public final class Deduplicator {
    private static final Comparator<ReportEntry> BY_FINGERPRINT = Comparator.comparing(ReportEntry::fingerprint);

    public List<ReportEntry> deduplicate(final String runName, final List<Report> reports) {
        final Map<String, ReportEntry> byKey = new LinkedHashMap<>();
        for (final Report report : reports) {
            if (report.occurrences().isEmpty()) {
                addFirst(byKey, entry(runName, report, report.file().path(), report.line(), report.column(),
                        report.file().path()));
                continue;
            }
            for (final Occurrence occurrence : report.occurrences()) {
                addFirst(byKey, entry(runName, report, occurrence.filePath(), occurrence.line(), occurrence.column(),
                        occurrence.compilationUnit()));
            }
        }
        return sorted(byKey.values());
    }

    /**
     * Collapses entries of one transient collection by fingerprint and compilation unit.
     */
    public List<ReportEntry> deduplicateEntries(final List<ReportEntry> entries) {
        final Map<String, ReportEntry> byKey = new LinkedHashMap<>();
        for (final ReportEntry entry : entries) {
            addFirst(byKey, entry);
        }
        return sorted(byKey.values());
    }

    /**
     * Collapses entries by fingerprint alone. The entries may come from several runs; the first entry of each
     * fingerprint is kept and its occurrence count becomes the number of entries collapsed into it.
     */
    public List<ReportEntry> unique(final List<ReportEntry> entries) {
        final Map<String, ReportEntry> first = new LinkedHashMap<>();
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final ReportEntry entry : entries) {
            first.putIfAbsent(entry.fingerprint(), entry);
            counts.merge(entry.fingerprint(), entry.occurrences(), Integer::sum);
        }
        final List<ReportEntry> unique = new ArrayList<>(first.size());
        for (final Map.Entry<String, ReportEntry> entry : first.entrySet()) {
            unique.add(entry.getValue().withOccurrences(counts.get(entry.getKey())));
        }
        return sorted(unique);
    }

    private static void addFirst(final Map<String, ReportEntry> byKey, final ReportEntry entry) {
        final String key = entry.fingerprint() + '\u0000' + entry.compilationUnit();
        final ReportEntry existing = byKey.get(key);
        if (existing == null) {
            byKey.put(key, entry);
        } else {
            byKey.put(key, existing.withOccurrences(existing.occurrences() + entry.occurrences()));
        }
    }

    private static ReportEntry entry(
            final String runName,
            final Report report,
            final String filePath,
            final int line,
            final int column,
            final String compilationUnit) {
        return new ReportEntry(
                report.fingerprint(),
                report.checkerId(),
                filePath,
                line,
                column,
                report.severity(),
                report.message(),
                compilationUnit,
                report.detectionStatus(),
                report.reviewStatus(),
                1,
                runName);
    }

    private static List<ReportEntry> sorted(final Iterable<ReportEntry> entries) {
        final List<ReportEntry> result = new ArrayList<>();
        entries.forEach(result::add);
        result.sort(BY_FINGERPRINT);
        return result;
    }
}
