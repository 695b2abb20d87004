package org.resultvault.engine;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.resultvault.blob.SourceFile;
import org.resultvault.identity.BugPathStep;
import org.resultvault.identity.IdentityConfidence;
import org.resultvault.identity.Severity;

/**
 * Stored report row: one per fingerprint in a run generation.
 *
 * <p>{@code fixedAtGeneration} and {@code fixedAt} are set while the report is not active and cleared when it
 * reappears.
 */
public record Report(
        String fingerprint,
        IdentityConfidence confidence,
        String checkerId,
        Severity severity,
        String message,
        SourceFile file,
        int line,
        int column,
        List<BugPathStep> bugPath,
        List<Occurrence> occurrences,
        DetectionStatus detectionStatus,
        ReviewDecision review,
        long detectedAtGeneration,
        Instant detectedAt,
        Long fixedAtGeneration,
        Instant fixedAt) {
    public Report {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(confidence, "confidence");
        Objects.requireNonNull(checkerId, "checkerId");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(detectionStatus, "detectionStatus");
        Objects.requireNonNull(detectedAt, "detectedAt");
        severity = severity == null ? Severity.UNSPECIFIED : severity;
        message = message == null ? "" : message;
        bugPath = bugPath == null ? List.of() : List.copyOf(bugPath);
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
    }

    public ReviewStatus reviewStatus() {
        return review == null ? ReviewStatus.UNREVIEWED : review.status();
    }

    /**
     * Active in a diff: detected in the current generation and not suppressed by review.
     */
    public boolean isActive() {
        return detectionStatus.isActive() && !reviewStatus().isSuppressing();
    }

    public Report withReview(final ReviewDecision decision) {
        if (Objects.equals(review, decision)) {
            return this;
        }
        return new Report(
                fingerprint,
                confidence,
                checkerId,
                severity,
                message,
                file,
                line,
                column,
                bugPath,
                occurrences,
                detectionStatus,
                decision,
                detectedAtGeneration,
                detectedAt,
                fixedAtGeneration,
                fixedAt);
    }

    Report withDetection(
            final DetectionStatus status, final Long fixedGeneration, final Instant fixedTime) {
        return new Report(
                fingerprint,
                confidence,
                checkerId,
                severity,
                message,
                file,
                line,
                column,
                bugPath,
                occurrences,
                status,
                review,
                detectedAtGeneration,
                detectedAt,
                fixedGeneration,
                fixedTime);
    }
}
