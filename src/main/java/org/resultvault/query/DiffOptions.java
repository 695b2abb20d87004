package org.resultvault.query;

/**
 * @param unique collapse result entries to one per fingerprint
 * @param stableOrder order result entries by file path and line instead of by fingerprint
 */
public record DiffOptions(boolean unique, boolean stableOrder) {
    public static final DiffOptions DEFAULT = new DiffOptions(false, false);
}
