package org.resultvault.suppress;

/**
 * Raised when a comment carries the review marker prefix but does not follow the marker grammar.
 */
public final class MisspelledReviewCommentException extends RuntimeException {
    private final int line;

    public MisspelledReviewCommentException(final int line, final String comment) {
        super("misspelled review status comment @" + line + ": " + comment);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
