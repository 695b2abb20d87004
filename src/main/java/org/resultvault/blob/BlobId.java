package org.resultvault.blob;

import java.util.Objects;
import java.util.regex.Pattern;
import org.resultvault.identity.ContentHashes;

/**
 * Content address of a stored source file: the SHA-256 of its bytes in lowercase hex.
 */
public record BlobId(String value) {
    private static final Pattern FORM = Pattern.compile("^[0-9a-f]{64}$");

    public BlobId {
        Objects.requireNonNull(value, "value");
        if (!FORM.matcher(value).matches()) {
            throw new IllegalArgumentException("blob id must be 64 lowercase hex characters: " + value);
        }
    }

    public static BlobId of(final byte[] content) {
        Objects.requireNonNull(content, "content");
        return new BlobId(ContentHashes.sha256Hex(content));
    }

    @Override
    public String toString() {
        return value;
    }
}
