package org.resultvault.identity;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Source file content normalized to a list of lines.
 *
 * <p>Decoding honours UTF-8 and UTF-16 byte order marks, accepts strict UTF-8 otherwise and falls back to
 * ISO-8859-1. CRLF, CR and LF all terminate a line.
 */
public final class SourceText {
    private static final SourceText EMPTY = new SourceText(List.of());

    private final List<String> lines;
    private volatile List<List<String>> lineScopes;

    private SourceText(final List<String> lines) {
        this.lines = List.copyOf(lines);
    }

    public static SourceText empty() {
        return EMPTY;
    }

    public static SourceText of(final String text) {
        Objects.requireNonNull(text, "text");
        return new SourceText(splitLines(text));
    }

    public static SourceText decode(final byte[] content) {
        Objects.requireNonNull(content, "content");
        return of(decodeText(content));
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Returns the 1-based line, or an empty string when the line is outside the file.
     */
    public String line(final int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return "";
        }
        return lines.get(lineNumber - 1);
    }

    public List<String> lines() {
        return lines;
    }

    public String text() {
        return String.join("\n", lines);
    }

    /**
     * Enclosing scope chain per line, computed on first use.
     */
    List<List<String>> lineScopes() {
        List<List<String>> scopes = lineScopes;
        if (scopes == null) {
            scopes = ScopeResolver.lineScopes(this);
            lineScopes = scopes;
        }
        return scopes;
    }

    static String decodeText(final byte[] content) {
        if (startsWith(content, 0xEF, 0xBB, 0xBF)) {
            return new String(content, 3, content.length - 3, StandardCharsets.UTF_8);
        }
        if (startsWith(content, 0xFE, 0xFF)) {
            return new String(content, 2, content.length - 2, StandardCharsets.UTF_16BE);
        }
        if (startsWith(content, 0xFF, 0xFE)) {
            return new String(content, 2, content.length - 2, StandardCharsets.UTF_16LE);
        }
        try {
            return strictDecoder(StandardCharsets.UTF_8).decode(ByteBuffer.wrap(content)).toString();
        } catch (final CharacterCodingException notUtf8) {
            return new String(content, StandardCharsets.ISO_8859_1);
        }
    }

    private static CharsetDecoder strictDecoder(final Charset charset) {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private static boolean startsWith(final byte[] content, final int... prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((content[i] & 0xff) != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static List<String> splitLines(final String text) {
        final List<String> result = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                result.add(current.toString());
                current.setLength(0);
            } else if (c == '\n') {
                result.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            result.add(current.toString());
        }
        return result;
    }
}
