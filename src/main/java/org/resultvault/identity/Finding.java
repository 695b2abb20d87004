package org.resultvault.identity;

import java.util.List;
import java.util.Objects;

/**
 * A single analyzer finding as produced by the analysis-invocation layer.
 *
 * <p>{@code enclosingScope} is optional scope text supplied by the producer; when absent the scope is derived
 * from the source. {@code compilationUnit} defaults to the file path when the producer does not name one.
 */
public record Finding(
        String checkerId,
        String filePath,
        int line,
        int column,
        Severity severity,
        String message,
        List<BugPathStep> bugPath,
        String enclosingScope,
        String compilationUnit) {
    public Finding {
        checkerId = requireText(checkerId, "checkerId");
        filePath = requireText(filePath, "filePath");
        if (line < 1) {
            throw new IllegalArgumentException("line must be positive: " + line);
        }
        if (column < 0) {
            throw new IllegalArgumentException("column must not be negative: " + column);
        }
        severity = severity == null ? Severity.UNSPECIFIED : severity;
        message = message == null ? "" : message;
        bugPath = bugPath == null ? List.of() : List.copyOf(bugPath);
        enclosingScope = enclosingScope == null || enclosingScope.isBlank() ? null : enclosingScope;
        compilationUnit = compilationUnit == null || compilationUnit.isBlank() ? filePath : compilationUnit.trim();
    }

    public Finding(
            final String checkerId,
            final String filePath,
            final int line,
            final int column,
            final Severity severity,
            final String message) {
        this(checkerId, filePath, line, column, severity, message, List.of(), null, null);
    }

    public Finding withCompilationUnit(final String unit) {
        return new Finding(checkerId, filePath, line, column, severity, message, bugPath, enclosingScope, unit);
    }

    private static String requireText(final String value, final String fieldName) {
        Objects.requireNonNull(value, fieldName);
        final String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return trimmed;
    }
}
