package org.resultvault.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hex digests used for fingerprints and content addressing.
 */
public final class ContentHashes {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ContentHashes() {}

    public static String md5Hex(final String text) {
        return toHex(digest("MD5").digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    public static String sha256Hex(final byte[] content) {
        return toHex(digest("SHA-256").digest(content));
    }

    private static MessageDigest digest(final String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (final NoSuchAlgorithmException exception) {
            throw new IllegalStateException(algorithm + " unavailable", exception);
        }
    }

    private static String toHex(final byte[] bytes) {
        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            chars[i * 2] = HEX[(bytes[i] >> 4) & 0x0f];
            chars[i * 2 + 1] = HEX[bytes[i] & 0x0f];
        }
        return new String(chars);
    }
}
