package org.resultvault.identity;

import java.util.Locale;

/**
 * Severity reported by the analyzer for a checker.
 */
public enum Severity {
    UNSPECIFIED,
    STYLE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static Severity parse(final String value) {
        if (value == null || value.isBlank()) {
            return UNSPECIFIED;
        }
        final String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (final Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("unsupported severity: " + value);
    }
}
