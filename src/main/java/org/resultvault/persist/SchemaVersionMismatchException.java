package org.resultvault.persist;

/**
 * Signals a state file written by a newer schema than this build understands.
 */
public final class SchemaVersionMismatchException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int foundVersion;
    private final int supportedVersion;

    public SchemaVersionMismatchException(final int foundVersion, final int supportedVersion) {
        super("state schema version " + foundVersion + " is newer than the supported version " + supportedVersion);
        this.foundVersion = foundVersion;
        this.supportedVersion = supportedVersion;
    }

    public int foundVersion() {
        return foundVersion;
    }

    public int supportedVersion() {
        return supportedVersion;
    }
}
