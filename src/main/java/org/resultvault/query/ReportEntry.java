package org.resultvault.query;

import java.util.Comparator;
import java.util.Objects;
import org.resultvault.engine.DetectionStatus;
import org.resultvault.engine.ReviewStatus;
import org.resultvault.identity.Severity;

/**
 * One displayed report. Entries of transient collections have no run and no detection status.
 */
public record ReportEntry(
        String fingerprint,
        String checkerId,
        String filePath,
        int line,
        int column,
        Severity severity,
        String message,
        String compilationUnit,
        DetectionStatus detectionStatus,
        ReviewStatus reviewStatus,
        int occurrences,
        String runName) {
    public static final Comparator<ReportEntry> BY_LOCATION = Comparator.comparing(ReportEntry::filePath)
            .thenComparingInt(ReportEntry::line)
            .thenComparing(ReportEntry::fingerprint)
            .thenComparing(ReportEntry::compilationUnit);

    public ReportEntry {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(checkerId, "checkerId");
        Objects.requireNonNull(filePath, "filePath");
        severity = severity == null ? Severity.UNSPECIFIED : severity;
        message = message == null ? "" : message;
        compilationUnit = compilationUnit == null ? filePath : compilationUnit;
        reviewStatus = reviewStatus == null ? ReviewStatus.UNREVIEWED : reviewStatus;
        if (occurrences < 1) {
            throw new IllegalArgumentException("occurrences must be positive: " + occurrences);
        }
    }

    public static ReportEntry transientEntry(
            final String fingerprint,
            final String checkerId,
            final String filePath,
            final int line,
            final int column,
            final Severity severity,
            final String message,
            final String compilationUnit) {
        return new ReportEntry(
                fingerprint,
                checkerId,
                filePath,
                line,
                column,
                severity,
                message,
                compilationUnit,
                null,
                ReviewStatus.UNREVIEWED,
                1,
                null);
    }

    ReportEntry withOccurrences(final int count) {
        return new ReportEntry(
                fingerprint,
                checkerId,
                filePath,
                line,
                column,
                severity,
                message,
                compilationUnit,
                detectionStatus,
                reviewStatus,
                count,
                runName);
    }
}
