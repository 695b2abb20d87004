package org.resultvault.suppress;

import java.util.Objects;
import java.util.Set;
import org.resultvault.engine.ReviewStatus;

/**
 * A review comment found in the source above a flagged line.
 *
 * <p>{@code checkers} holds the checker names listed in brackets; {@code all} matches every checker.
 * {@code text} is the raw comment as written.
 */
public record SourceCodeComment(Set<String> checkers, String message, ReviewStatus status, String text) {
    static final String ALL_CHECKERS = "all";

    public SourceCodeComment {
        checkers = Set.copyOf(Objects.requireNonNull(checkers, "checkers"));
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(status, "status");
        text = text == null ? "" : text;
    }

    /**
     * A checker matches when it is listed by name, when {@code all} is listed, or when a listed name is a
     * dotted group prefix of it ({@code core} matches {@code core.DivideZero}).
     */
    public boolean appliesTo(final String checkerId) {
        for (final String checker : checkers) {
            if (ALL_CHECKERS.equals(checker)
                    || checker.equals(checkerId)
                    || checkerId.startsWith(checker + ".")) {
                return true;
            }
        }
        return false;
    }
}
