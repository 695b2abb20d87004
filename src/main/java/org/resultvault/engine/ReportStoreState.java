package org.resultvault.engine;

import java.util.List;
import java.util.Map;

/**
 * Everything a report store holds, in a form that can be written out and restored.
 *
 * <p>{@code reviews} holds the decision in force per fingerprint. {@code shadowedReviews} holds user decisions
 * that an in-source comment currently overrides; they come back once the comment is gone.
 */
public record ReportStoreState(
        List<RunState> runs, Map<String, ReviewDecision> reviews, Map<String, ReviewDecision> shadowedReviews) {
    public ReportStoreState {
        runs = runs == null ? List.of() : List.copyOf(runs);
        reviews = reviews == null ? Map.of() : Map.copyOf(reviews);
        shadowedReviews = shadowedReviews == null ? Map.of() : Map.copyOf(shadowedReviews);
    }

    public ReportStoreState(final List<RunState> runs, final Map<String, ReviewDecision> reviews) {
        this(runs, reviews, Map.of());
    }
}
