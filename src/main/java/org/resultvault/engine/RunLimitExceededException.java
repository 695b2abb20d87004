package org.resultvault.engine;

/**
 * Raised when storing a new run would exceed the configured number of runs.
 */
public final class RunLimitExceededException extends RuntimeException {
    private final int limit;

    public RunLimitExceededException(final String runName, final int limit) {
        super("cannot create run '" + runName + "': the server allows at most " + limit + " runs");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
