package org.resultvault.suppress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.resultvault.engine.ReviewStatus;
import org.resultvault.identity.SourceText;

/**
 * Reads review comments placed directly above a flagged line.
 *
 * <p>Accepted forms, with the default {@code codechecker} prefix:
 *
 * <pre>
 * // codechecker_suppress [all] message
 * // codechecker_confirmed [checker.one, checker.two] message that
 * // continues on the next line
 * /* codechecker_intentional [checker.one] message *&#47;
 * </pre>
 *
 * <p>{@code suppress} and {@code false_positive} both give {@link ReviewStatus#FALSE_POSITIVE}. Only the
 * uninterrupted run of comment lines above the flagged line is read. A comment that uses the prefix but not
 * the grammar raises {@link MisspelledReviewCommentException}.
 */
public final class SourceCodeCommentParser {
    public static final String DEFAULT_PREFIX = "codechecker";
    static final String MISSING_MESSAGE = "WARNING! source code comment is missing";

    private final String prefix;
    private final Pattern markerMention;
    private final Pattern grammar;

    public SourceCodeCommentParser() {
        this(DEFAULT_PREFIX);
    }

    public SourceCodeCommentParser(final String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        final String trimmed = prefix.trim();
        if (!trimmed.matches("[A-Za-z][A-Za-z0-9]*")) {
            throw new IllegalArgumentException("suppression prefix must be alphanumeric: " + prefix);
        }
        this.prefix = trimmed;
        this.markerMention = Pattern.compile("\\b" + trimmed + "_\\w+");
        this.grammar = Pattern.compile("^\\s*" + trimmed
                + "_(?<status>suppress|false_positive|intentional|confirmed)"
                + "\\s*\\[\\s*(?<checkers>[^\\]]*)\\s*\\]\\s*(?<comment>.*)$");
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Finds the comment that applies to {@code checkerId} at {@code line}.
     */
    public SuppressionLookup lookup(final SourceText source, final int line, final String checkerId) {
        Objects.requireNonNull(checkerId, "checkerId");
        final List<SourceCodeComment> comments;
        try {
            comments = commentsAbove(source, line);
        } catch (final MisspelledReviewCommentException misspelled) {
            return SuppressionLookup.misspelled(misspelled.getMessage());
        }
        final List<SourceCodeComment> matching = new ArrayList<>();
        for (final SourceCodeComment comment : comments) {
            if (comment.appliesTo(checkerId)) {
                matching.add(comment);
            }
        }
        if (matching.isEmpty()) {
            return SuppressionLookup.none();
        }
        if (matching.size() > 1) {
            return SuppressionLookup.ambiguous(matching);
        }
        return SuppressionLookup.matched(matching.get(0));
    }

    /**
     * Every review comment in the comment block directly above {@code line}, nearest first.
     *
     * @throws MisspelledReviewCommentException when a comment line uses the prefix without following the grammar
     */
    public List<SourceCodeComment> commentsAbove(final SourceText source, final int line) {
        Objects.requireNonNull(source, "source");
        final List<SourceCodeComment> comments = new ArrayList<>();
        final List<String> pending = new ArrayList<>();
        boolean insideBlockComment = false;
        for (int number = line - 1; number >= 1; number--) {
            final String text = source.line(number);
            final String trimmed = text.strip();
            final boolean lineComment = trimmed.startsWith("//");
            final boolean blockStart = trimmed.contains("/*");
            final boolean blockEnd = trimmed.contains("*/");
            if (!lineComment && !blockStart && !blockEnd && !insideBlockComment) {
                break;
            }
            if (blockEnd) {
                insideBlockComment = true;
            }

            pending.add(text);
            if (markerMention.matcher(text).find()) {
                comments.add(parseBlock(pending, number));
                pending.clear();
            }
            if (blockStart) {
                break;
            }
        }
        return comments;
    }

    private SourceCodeComment parseBlock(final List<String> bottomUpLines, final int firstLine) {
        final List<String> lines = new ArrayList<>(bottomUpLines);
        Collections.reverse(lines);
        final String original = String.join(" ", lines);

        final String content;
        if (lines.get(0).strip().startsWith("//")) {
            content = original.replace("//", "");
        } else {
            final List<String> parts = new ArrayList<>();
            for (final String line : lines) {
                String part = line.strip().replace("/*", "").replace("*/", "");
                if (part.startsWith("*")) {
                    part = part.substring(1);
                }
                parts.add(part);
            }
            content = String.join(" ", parts).strip();
        }

        final String formatted = String.join(" ", content.trim().split("\\s+"));
        final Matcher matcher = grammar.matcher(formatted);
        if (!matcher.matches()) {
            throw new MisspelledReviewCommentException(firstLine, original.strip());
        }

        final Set<String> checkers = new LinkedHashSet<>();
        final String listed = matcher.group("checkers").trim();
        if (SourceCodeComment.ALL_CHECKERS.equals(listed)) {
            checkers.add(SourceCodeComment.ALL_CHECKERS);
        } else {
            for (final String name : listed.split("[,\\s]+")) {
                if (!name.isEmpty()) {
                    checkers.add(name);
                }
            }
        }
        final String comment = matcher.group("comment");
        final String message = comment == null || comment.isBlank() ? MISSING_MESSAGE : comment;
        return new SourceCodeComment(checkers, message, ReviewStatus.parse(matcher.group("status")), original);
    }
}
