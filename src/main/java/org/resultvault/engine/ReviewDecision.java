package org.resultvault.engine;

import java.time.Instant;
import java.util.Objects;

/**
 * Review status attached to a fingerprint together with who set it and why.
 */
public record ReviewDecision(ReviewStatus status, String author, String message, Instant date, Origin origin) {
    public ReviewDecision {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(origin, "origin");
        author = author == null ? "" : author;
        message = message == null ? "" : message;
    }

    public static ReviewDecision byUser(
            final ReviewStatus status, final String author, final String message, final Instant date) {
        return new ReviewDecision(status, author, message, date, Origin.USER);
    }

    public static ReviewDecision fromSourceComment(
            final ReviewStatus status, final String message, final Instant date) {
        return new ReviewDecision(status, "", message, date, Origin.SOURCE_COMMENT);
    }

    public enum Origin {
        USER,
        SOURCE_COMMENT
    }
}
