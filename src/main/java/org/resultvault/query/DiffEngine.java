package org.resultvault.query;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import org.resultvault.engine.Report;
import org.resultvault.engine.ReportStore;
import org.resultvault.engine.ReviewDecision;
import org.resultvault.engine.ReviewStatus;

/**
 * Computes new, resolved and unresolved fingerprints between two report collections.
 *
 * <p>A stored side contributes only active reports: detected in the addressed generation and not reviewed as
 * false positive or intentional. A transient side is taken as given, except that when the other side is
 * stored, fingerprints suppressed by a stored review decision are removed from it too.
 */
public final class DiffEngine {
    private final ReportStore store;
    private final Deduplicator deduplicator;

    public DiffEngine(final ReportStore store) {
        this(store, new Deduplicator());
    }

    public DiffEngine(final ReportStore store, final Deduplicator deduplicator) {
        this.store = Objects.requireNonNull(store, "store");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
    }

    public List<ReportEntry> diff(
            final ReportCollection baseline,
            final ReportCollection newSet,
            final DiffMode mode,
            final DiffOptions options) {
        Objects.requireNonNull(mode, "mode");
        return compare(baseline, newSet, options).entries(mode);
    }

    public DiffResult compare(
            final ReportCollection baseline, final ReportCollection newSet, final DiffOptions options) {
        Objects.requireNonNull(baseline, "baseline");
        Objects.requireNonNull(newSet, "newSet");
        Objects.requireNonNull(options, "options");

        final boolean anyStored = baseline.isStored() || newSet.isStored();
        final List<ReportEntry> baseEntries = resolve(baseline, anyStored);
        final List<ReportEntry> newEntries = resolve(newSet, anyStored);
        final Set<String> baseFingerprints = fingerprints(baseEntries);
        final Set<String> newFingerprints = fingerprints(newEntries);

        return new DiffResult(
                finish(select(newEntries, fingerprint -> !baseFingerprints.contains(fingerprint)), options),
                finish(select(baseEntries, fingerprint -> !newFingerprints.contains(fingerprint)), options),
                finish(select(newEntries, baseFingerprints::contains), options));
    }

    private List<ReportEntry> resolve(final ReportCollection side, final boolean applyStoredReviews) {
        if (!side.isStored()) {
            final List<ReportEntry> entries = new ArrayList<>();
            for (final ReportEntry entry : side.entries()) {
                if (!applyStoredReviews || !suppressedByReview(entry.fingerprint())) {
                    entries.add(entry);
                }
            }
            return deduplicator.deduplicateEntries(entries);
        }

        final List<Report> reports = side.tag() == null
                ? store.reports(side.runName())
                : store.openReportsAt(side.runName(), side.tag());
        final List<Report> active = new ArrayList<>();
        for (final Report report : reports) {
            if (isActive(report, side.tag() != null)) {
                active.add(report);
            }
        }
        return deduplicator.deduplicate(side.runName(), active);
    }

    private static boolean isActive(final Report report, final boolean openAtTag) {
        if (openAtTag) {
            return !report.reviewStatus().isSuppressing();
        }
        return report.isActive();
    }

    private boolean suppressedByReview(final String fingerprint) {
        return store.reviewStatus(fingerprint)
                .map(ReviewDecision::status)
                .map(ReviewStatus::isSuppressing)
                .orElse(false);
    }

    private List<ReportEntry> finish(final List<ReportEntry> entries, final DiffOptions options) {
        final List<ReportEntry> result = options.unique() ? deduplicator.unique(entries) : new ArrayList<>(entries);
        if (options.stableOrder()) {
            result.sort(ReportEntry.BY_LOCATION);
        }
        return result;
    }

    private static List<ReportEntry> select(final List<ReportEntry> entries, final Predicate<String> keep) {
        final List<ReportEntry> selected = new ArrayList<>();
        for (final ReportEntry entry : entries) {
            if (keep.test(entry.fingerprint())) {
                selected.add(entry);
            }
        }
        return selected;
    }

    private static Set<String> fingerprints(final List<ReportEntry> entries) {
        final Set<String> fingerprints = new HashSet<>();
        for (final ReportEntry entry : entries) {
            fingerprints.add(entry.fingerprint());
        }
        return fingerprints;
    }
}
