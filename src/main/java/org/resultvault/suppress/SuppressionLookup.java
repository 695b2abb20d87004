package org.resultvault.suppress;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of looking up the review comment of one finding.
 */
public record SuppressionLookup(Outcome outcome, List<SourceCodeComment> matches, String problem) {
    public SuppressionLookup {
        Objects.requireNonNull(outcome, "outcome");
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    static SuppressionLookup none() {
        return new SuppressionLookup(Outcome.NONE, List.of(), null);
    }

    static SuppressionLookup matched(final SourceCodeComment comment) {
        return new SuppressionLookup(Outcome.MATCHED, List.of(comment), null);
    }

    static SuppressionLookup ambiguous(final List<SourceCodeComment> comments) {
        return new SuppressionLookup(Outcome.AMBIGUOUS, comments, "more than one review comment matches");
    }

    static SuppressionLookup misspelled(final String problem) {
        return new SuppressionLookup(Outcome.MISSPELLED, List.of(), problem);
    }

    public Optional<SourceCodeComment> comment() {
        return outcome == Outcome.MATCHED ? Optional.of(matches.get(0)) : Optional.empty();
    }

    public enum Outcome {
        NONE,
        MATCHED,
        AMBIGUOUS,
        MISSPELLED
    }
}
