package org.resultvault.query;

import java.util.List;
import java.util.Objects;

/**
 * One side of a diff: either a transient collection of entries that was never stored, or a stored run,
 * optionally addressed by tag.
 */
public final class ReportCollection {
    private final List<ReportEntry> entries;
    private final String runName;
    private final String tag;

    private ReportCollection(final List<ReportEntry> entries, final String runName, final String tag) {
        this.entries = entries;
        this.runName = runName;
        this.tag = tag;
    }

    public static ReportCollection transientOf(final List<ReportEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        return new ReportCollection(List.copyOf(entries), null, null);
    }

    public static ReportCollection stored(final String runName) {
        return stored(runName, null);
    }

    public static ReportCollection stored(final String runName, final String tag) {
        Objects.requireNonNull(runName, "runName");
        return new ReportCollection(null, runName, tag == null || tag.isBlank() ? null : tag);
    }

    public boolean isStored() {
        return runName != null;
    }

    public List<ReportEntry> entries() {
        if (isStored()) {
            throw new IllegalStateException("stored collections are read from the report store");
        }
        return entries;
    }

    public String runName() {
        return runName;
    }

    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        if (!isStored()) {
            return "transient[" + entries.size() + "]";
        }
        return tag == null ? "run[" + runName + "]" : "run[" + runName + "@" + tag + "]";
    }
}
