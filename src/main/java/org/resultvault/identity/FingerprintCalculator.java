package org.resultvault.identity;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the stable identity of a finding from its checker, the text of the flagged line and the
 * enclosing scope signature.
 *
 * <p>Whitespace inside the flagged line is ignored, so re-indenting or re-wrapping spacing does not change the
 * fingerprint. Absolute line numbers and file paths never take part. When the producer supplies enclosing
 * scope text it takes precedence over the parsed scope. Without any scope the fingerprint is computed from the
 * checker and line text alone and reported as {@link IdentityConfidence#FILE_RELATIVE}.
 */
public final class FingerprintCalculator {
    static final String COMPONENT_SEPARATOR = "|||";

    private final ScopeResolver scopeResolver;

    public FingerprintCalculator() {
        this(new ScopeResolver());
    }

    public FingerprintCalculator(final ScopeResolver scopeResolver) {
        this.scopeResolver = Objects.requireNonNull(scopeResolver, "scopeResolver");
    }

    public Fingerprint compute(final Finding finding, final SourceText source) {
        Objects.requireNonNull(finding, "finding");
        Objects.requireNonNull(source, "source");

        final String lineText = stripWhitespace(source.line(finding.line()));
        final Optional<String> scope = scopeOf(finding, source);
        if (scope.isPresent()) {
            final String value = hash(List.of(finding.checkerId(), lineText, scope.get()));
            return new Fingerprint(value, IdentityConfidence.SCOPED);
        }
        return new Fingerprint(hash(List.of(finding.checkerId(), lineText)), IdentityConfidence.FILE_RELATIVE);
    }

    Optional<String> scopeOf(final Finding finding, final SourceText source) {
        if (finding.enclosingScope() != null) {
            return Optional.of(ScopeResolver.normalizeSignature(finding.enclosingScope()));
        }
        return scopeResolver.resolve(source, finding.line());
    }

    static String stripWhitespace(final String line) {
        final StringBuilder stripped = new StringBuilder(line.length());
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (!Character.isWhitespace(c)) {
                stripped.append(c);
            }
        }
        return stripped.toString();
    }

    private static String hash(final List<String> components) {
        return ContentHashes.md5Hex(String.join(COMPONENT_SEPARATOR, components));
    }
}
