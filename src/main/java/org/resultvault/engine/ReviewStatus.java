package org.resultvault.engine;

import java.util.Locale;

/**
 * Human or source-comment judgment on a fingerprint.
 */
public enum ReviewStatus {
    UNREVIEWED,
    CONFIRMED,
    FALSE_POSITIVE,
    INTENTIONAL;

    /**
     * Suppressed fingerprints take no part in stored-run diffs.
     */
    public boolean isSuppressing() {
        return this == FALSE_POSITIVE || this == INTENTIONAL;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts the enum name in any case, with or without underscores, and the {@code suppress} alias of
     * {@link #FALSE_POSITIVE}.
     */
    public static ReviewStatus parse(final String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("review status must not be blank");
        }
        final String normalized = value.trim().replace("_", "").toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "unreviewed" -> UNREVIEWED;
            case "confirmed" -> CONFIRMED;
            case "falsepositive", "suppress" -> FALSE_POSITIVE;
            case "intentional" -> INTENTIONAL;
            default -> throw new IllegalArgumentException("unsupported review status: " + value);
        };
    }
}
