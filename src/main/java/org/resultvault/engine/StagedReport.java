package org.resultvault.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.resultvault.blob.SourceFile;
import org.resultvault.identity.BugPathStep;
import org.resultvault.identity.Fingerprint;
import org.resultvault.identity.Severity;

/**
 * A finding staged into an open generation, already fingerprinted and backed by a stored source file.
 *
 * <p>{@code sourceReview} is the decision read from an in-source suppression comment, or {@code null}.
 */
public record StagedReport(
        Fingerprint fingerprint,
        String checkerId,
        Severity severity,
        String message,
        SourceFile file,
        int line,
        int column,
        List<BugPathStep> bugPath,
        List<Occurrence> occurrences,
        ReviewDecision sourceReview) {
    public StagedReport {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(checkerId, "checkerId");
        Objects.requireNonNull(file, "file");
        severity = severity == null ? Severity.UNSPECIFIED : severity;
        message = message == null ? "" : message;
        bugPath = bugPath == null ? List.of() : List.copyOf(bugPath);
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
    }

    /**
     * Folds a second detection of the same fingerprint into this one. The primary location and bug path stay
     * those of the first detection; occurrences of the second are appended when not already present.
     */
    public StagedReport mergedWith(final StagedReport later) {
        Objects.requireNonNull(later, "later");
        if (!fingerprint.value().equals(later.fingerprint().value())) {
            throw new IllegalArgumentException(
                    "cannot merge different fingerprints: " + fingerprint + " and " + later.fingerprint());
        }
        final Set<Occurrence> merged = new LinkedHashSet<>(occurrences);
        merged.addAll(later.occurrences());
        if (merged.size() == occurrences.size() && (sourceReview != null || later.sourceReview() == null)) {
            return this;
        }
        return new StagedReport(
                fingerprint,
                checkerId,
                severity,
                message,
                file,
                line,
                column,
                bugPath,
                new ArrayList<>(merged),
                sourceReview != null ? sourceReview : later.sourceReview());
    }
}
