package org.resultvault.identity;

/**
 * How much of the lexical context went into a fingerprint.
 */
public enum IdentityConfidence {
    /** Checker, line text and the enclosing scope chain. */
    SCOPED,
    /** Checker and line text only; no enclosing scope could be determined. */
    FILE_RELATIVE
}
