package org.resultvault.identity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Light lexical parse that finds the namespace/class/function chain enclosing a line.
 *
 * <p>The parser matches braces while skipping comments, string and character literals and preprocessor lines.
 * The text collected since the previous {@code ;}, {@code {} or {@code }} is taken as the header of the next
 * block. Blocks that are neither a namespace, a type nor a function definition (control statements,
 * initializers, linkage blocks) keep the brace balance but contribute nothing to the chain.
 *
 * <p>A file is scanned once; the chain at the start of every line is kept with its {@link SourceText}.
 */
public final class ScopeResolver {
    static final String CHAIN_SEPARATOR = " / ";

    private static final Pattern ACCESS_SPECIFIER = Pattern.compile("^(?:(?:public|private|protected)\\s*:\\s*)+");
    private static final Pattern NAMESPACE =
            Pattern.compile("^(?:inline\\s+)?namespace(?:\\s+([A-Za-z_][\\w:]*))?\\s*$");
    private static final Pattern TYPE = Pattern.compile(
            "(?:^|[\\s;])(class|struct|union|enum(?:\\s+class|\\s+struct)?)(?:\\s+(?:alignas\\s*\\([^)]*\\)\\s*)?"
                    + "([A-Za-z_][\\w:]*(?:<[^{]*>)?))?\\s*(?:final\\s*)?(?::(?!:)[^{]*)?$");
    private static final Set<String> CONTROL_KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "sizeof", "do", "else", "case", "throw",
            "alignof", "decltype", "static_assert", "new", "delete");

    public Optional<String> resolve(final SourceText source, final int lineNumber) {
        Objects.requireNonNull(source, "source");
        if (lineNumber < 1 || lineNumber > source.lineCount()) {
            return Optional.empty();
        }
        final List<String> chain = source.lineScopes().get(lineNumber - 1);
        if (chain.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join(CHAIN_SEPARATOR, chain));
    }

    /**
     * Chain of enclosing labels at the start of each line, outermost first. Element {@code n} belongs to line
     * {@code n + 1} and reflects every brace before that line.
     */
    static List<List<String>> lineScopes(final SourceText source) {
        final String text = source.text() + '\n';
        final List<List<String>> scopes = new ArrayList<>(source.lineCount());
        int nextLine = 1;
        int nextLineStart = 0;
        final Deque<Block> blocks = new ArrayDeque<>();
        List<String> chain = List.of();
        final StringBuilder header = new StringBuilder();
        boolean atLineStart = true;
        int i = 0;
        final int length = text.length();
        while (i < length) {
            while (nextLine <= source.lineCount() && nextLineStart <= i) {
                scopes.add(chain);
                nextLineStart += source.line(nextLine).length() + 1;
                nextLine++;
            }
            final char c = text.charAt(i);
            if (c == '\n') {
                atLineStart = true;
                header.append(' ');
                i++;
                continue;
            }
            if (atLineStart && (c == ' ' || c == '\t')) {
                i++;
                continue;
            }
            if (atLineStart && c == '#') {
                i = skipPreprocessorLine(text, i);
                continue;
            }
            atLineStart = false;
            if (c == '/' && i + 1 < length && text.charAt(i + 1) == '/') {
                i = skipToLineEnd(text, i);
                header.append(' ');
                continue;
            }
            if (c == '/' && i + 1 < length && text.charAt(i + 1) == '*') {
                final int close = text.indexOf("*/", i + 2);
                i = close < 0 ? length : close + 2;
                header.append(' ');
                continue;
            }
            if (c == '"' || c == '\'' && !isDigitSeparator(text, i)) {
                i = skipLiteral(text, i, c);
                header.append(' ');
                continue;
            }
            if (c == '{') {
                blocks.push(new Block(classify(header.toString())));
                chain = labels(blocks);
                header.setLength(0);
            } else if (c == '}') {
                if (!blocks.isEmpty()) {
                    blocks.pop();
                    chain = labels(blocks);
                }
                header.setLength(0);
            } else if (c == ';') {
                header.setLength(0);
            } else {
                header.append(c);
            }
            i++;
        }
        while (scopes.size() < source.lineCount()) {
            scopes.add(chain);
        }
        return List.copyOf(scopes);
    }

    private static List<String> labels(final Deque<Block> blocks) {
        final List<String> chain = new ArrayList<>();
        final Iterator<Block> outermostFirst = blocks.descendingIterator();
        while (outermostFirst.hasNext()) {
            final Block block = outermostFirst.next();
            if (block.label() != null) {
                chain.add(block.label());
            }
        }
        return List.copyOf(chain);
    }

    /**
     * A quote inside a numeric literal ({@code 1'000}, {@code 0xFF'FF}) separates digits. The literal is the
     * identifier-character run the quote sits in, and it starts with a digit.
     */
    static boolean isDigitSeparator(final CharSequence text, final int quote) {
        if (quote == 0 || quote + 1 >= text.length() || !isIdentifierChar(text.charAt(quote + 1))) {
            return false;
        }
        int start = quote;
        while (start > 0 && (isIdentifierChar(text.charAt(start - 1)) || text.charAt(start - 1) == '\'')) {
            start--;
        }
        return start < quote && Character.isDigit(text.charAt(start));
    }

    static String classify(final String rawHeader) {
        String header = rawHeader.replaceAll("\\s+", " ").trim();
        header = ACCESS_SPECIFIER.matcher(header).replaceFirst("");
        header = stripTemplatePrefix(header);
        if (header.isEmpty()) {
            return null;
        }

        final Matcher namespace = NAMESPACE.matcher(header);
        if (namespace.matches()) {
            final String name = namespace.group(1);
            return name == null ? "namespace (anonymous)" : "namespace " + name;
        }

        final int firstParen = header.indexOf('(');
        final Matcher type = TYPE.matcher(header);
        if (type.find() && (firstParen < 0 || type.start(1) < firstParen)) {
            final String keyword = type.group(1).replaceAll("\\s+", " ");
            final String name = type.group(2);
            return keyword + " " + (name == null ? "(anonymous)" : normalizeSignature(name));
        }

        return functionSignature(header, firstParen);
    }

    private static String functionSignature(final String header, final int headerParen) {
        if (headerParen <= 0) {
            return null;
        }
        int firstParen = headerParen;
        if (header.substring(0, firstParen).trim().endsWith("operator") && header.startsWith("()", firstParen)) {
            firstParen = header.indexOf('(', firstParen + 2);
            if (firstParen < 0) {
                return null;
            }
        }
        final String namePart = header.substring(0, firstParen).trim();
        if (namePart.isEmpty() || namePart.contains("=") && !namePart.contains("operator")) {
            return null;
        }
        final String lastWord = lastIdentifier(namePart);
        if (lastWord == null || CONTROL_KEYWORDS.contains(lastWord) && !namePart.endsWith("operator " + lastWord)) {
            return null;
        }
        final int closeParen = matchingParen(header, firstParen);
        if (closeParen < 0) {
            return null;
        }
        String trailer = header.substring(closeParen + 1);
        final int initializer = initializerListStart(trailer);
        if (initializer >= 0) {
            trailer = trailer.substring(0, initializer);
        }
        trailer = trailer.replaceFirst("\\btry\\s*$", "");
        if (trailer.indexOf('(') >= 0 && !trailer.trim().startsWith("noexcept") && !trailer.contains("->")) {
            return null;
        }
        return normalizeSignature(header.substring(0, closeParen + 1) + trailer);
    }

    /**
     * Drops layout whitespace, keeping one blank only where two identifier characters would otherwise merge.
     */
    static String normalizeSignature(final String signature) {
        final String trimmed = signature.trim();
        final StringBuilder normalized = new StringBuilder(trimmed.length());
        boolean pendingSpace = false;
        for (int i = 0; i < trimmed.length(); i++) {
            final char c = trimmed.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = true;
                continue;
            }
            if (pendingSpace
                    && normalized.length() > 0
                    && isIdentifierChar(normalized.charAt(normalized.length() - 1))
                    && isIdentifierChar(c)) {
                normalized.append(' ');
            }
            pendingSpace = false;
            normalized.append(c);
        }
        return normalized.toString();
    }

    private static String stripTemplatePrefix(final String header) {
        String remaining = header;
        while (remaining.startsWith("template")) {
            final int open = remaining.indexOf('<');
            if (open < 0 || !remaining.substring("template".length(), open).isBlank()) {
                return remaining;
            }
            int depth = 0;
            int close = -1;
            for (int i = open; i < remaining.length(); i++) {
                final char c = remaining.charAt(i);
                if (c == '<') {
                    depth++;
                } else if (c == '>') {
                    depth--;
                    if (depth == 0) {
                        close = i;
                        break;
                    }
                }
            }
            if (close < 0) {
                return remaining;
            }
            remaining = remaining.substring(close + 1).trim();
        }
        return remaining;
    }

    private static String lastIdentifier(final String text) {
        int end = text.length();
        while (end > 0 && !isIdentifierChar(text.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && isIdentifierChar(text.charAt(start - 1))) {
            start--;
        }
        return start == end ? null : text.substring(start, end);
    }

    private static int matchingParen(final String text, final int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int initializerListStart(final String trailer) {
        for (int i = 0; i < trailer.length(); i++) {
            if (trailer.charAt(i) != ':') {
                continue;
            }
            final boolean scopeOperator = i + 1 < trailer.length() && trailer.charAt(i + 1) == ':'
                    || i > 0 && trailer.charAt(i - 1) == ':';
            if (!scopeOperator) {
                return i;
            }
        }
        return -1;
    }

    private static int skipPreprocessorLine(final CharSequence text, final int start) {
        int i = start;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == '\n') {
                final boolean continued = i > 0 && text.charAt(i - 1) == '\\';
                if (!continued) {
                    return i;
                }
            }
            i++;
        }
        return i;
    }

    private static int skipToLineEnd(final CharSequence text, final int start) {
        int i = start;
        while (i < text.length() && text.charAt(i) != '\n') {
            i++;
        }
        return i;
    }

    private static int skipLiteral(final CharSequence text, final int start, final char quote) {
        int i = start + 1;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n') {
                return i;
            }
            i++;
        }
        return i;
    }

    private static boolean isIdentifierChar(final char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private record Block(String label) {}
}
