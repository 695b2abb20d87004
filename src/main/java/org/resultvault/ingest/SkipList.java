package org.resultvault.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Path filter written as {@code +glob} / {@code -glob} lines. The first matching line decides; paths matching
 * no line are kept. {@code *} matches any run of characters including {@code /}, {@code ?} a single one.
 */
public final class SkipList {
    private static final SkipList EMPTY = new SkipList(List.of());

    private final List<Rule> rules;

    private SkipList(final List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static SkipList empty() {
        return EMPTY;
    }

    public static SkipList parse(final String content) {
        Objects.requireNonNull(content, "content");
        return parse(List.of(content.split("\\R")));
    }

    public static SkipList parse(final List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        final List<Rule> rules = new ArrayList<>();
        for (final String rawLine : lines) {
            final String line = rawLine == null ? "" : rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            final char sign = line.charAt(0);
            if (sign != '+' && sign != '-') {
                throw new IllegalArgumentException("skip list line must start with '+' or '-': " + line);
            }
            final String glob = line.substring(1).trim();
            if (glob.isEmpty()) {
                throw new IllegalArgumentException("skip list line has no pattern: " + line);
            }
            rules.add(new Rule(sign == '-', glob, toRegex(glob)));
        }
        return rules.isEmpty() ? EMPTY : new SkipList(rules);
    }

    public boolean excludes(final String path) {
        Objects.requireNonNull(path, "path");
        for (final Rule rule : rules) {
            if (rule.pattern().matcher(path).matches()) {
                return rule.exclude();
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public List<String> lines() {
        final List<String> lines = new ArrayList<>(rules.size());
        for (final Rule rule : rules) {
            lines.add((rule.exclude() ? "-" : "+") + rule.glob());
        }
        return lines;
    }

    private static Pattern toRegex(final String glob) {
        final StringBuilder regex = new StringBuilder(glob.length() + 8);
        for (int i = 0; i < glob.length(); i++) {
            final char c = glob.charAt(i);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    private record Rule(boolean exclude, String glob, Pattern pattern) {}
}
