package org.resultvault.identity;

import java.util.Objects;

/**
 * One event on the execution path that leads to a finding.
 */
public record BugPathStep(String filePath, int line, int column, String message) {
    public BugPathStep {
        Objects.requireNonNull(filePath, "filePath");
        if (line < 1) {
            throw new IllegalArgumentException("bug path line must be positive: " + line);
        }
        if (column < 0) {
            throw new IllegalArgumentException("bug path column must not be negative: " + column);
        }
        message = message == null ? "" : message;
    }
}
