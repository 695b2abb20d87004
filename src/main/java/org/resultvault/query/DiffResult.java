package org.resultvault.query;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The three categories of a diff. New and unresolved entries come from the new side, resolved entries from the
 * baseline.
 */
public record DiffResult(List<ReportEntry> newEntries, List<ReportEntry> resolved, List<ReportEntry> unresolved) {
    public DiffResult {
        newEntries = List.copyOf(newEntries);
        resolved = List.copyOf(resolved);
        unresolved = List.copyOf(unresolved);
    }

    public List<ReportEntry> entries(final DiffMode mode) {
        return switch (mode) {
            case NEW -> newEntries;
            case RESOLVED -> resolved;
            case UNRESOLVED -> unresolved;
        };
    }

    public Set<String> fingerprints(final DiffMode mode) {
        final Set<String> fingerprints = new LinkedHashSet<>();
        for (final ReportEntry entry : entries(mode)) {
            fingerprints.add(entry.fingerprint());
        }
        return fingerprints;
    }
}
