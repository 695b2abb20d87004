package org.resultvault.engine;

/**
 * Raised when a run is claimed by an ingestion that is still open.
 */
public final class RunLockedException extends RuntimeException {
    private final String runName;

    public RunLockedException(final String runName, final String detail) {
        super("run '" + runName + "' is locked: " + detail);
        this.runName = runName;
    }

    public String runName() {
        return runName;
    }
}
