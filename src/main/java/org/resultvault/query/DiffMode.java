package org.resultvault.query;

import java.util.Locale;

public enum DiffMode {
    NEW,
    RESOLVED,
    UNRESOLVED;

    public static DiffMode parse(final String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("diff mode must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException unknown) {
            throw new IllegalArgumentException("unsupported diff mode: " + value, unknown);
        }
    }
}
