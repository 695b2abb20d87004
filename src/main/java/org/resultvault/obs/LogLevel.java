package org.resultvault.obs;

import java.util.Locale;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean enables(final LogLevel eventLevel) {
        return eventLevel.ordinal() >= ordinal();
    }

    public static LogLevel parse(final String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        final String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        try {
            return valueOf(normalized);
        } catch (final IllegalArgumentException unknown) {
            throw new IllegalArgumentException("unsupported log level: " + value, unknown);
        }
    }
}
