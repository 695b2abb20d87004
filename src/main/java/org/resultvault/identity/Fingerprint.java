package org.resultvault.identity;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stable identity of a finding.
 */
public record Fingerprint(String value, IdentityConfidence confidence) {
    private static final Pattern FORM = Pattern.compile("^[0-9a-f]{32}$");

    public Fingerprint {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(confidence, "confidence");
        if (!FORM.matcher(value).matches()) {
            throw new IllegalArgumentException("fingerprint must be 32 lowercase hex characters: " + value);
        }
    }

    public static boolean isWellFormed(final String value) {
        return value != null && FORM.matcher(value).matches();
    }

    @Override
    public String toString() {
        return value;
    }
}
