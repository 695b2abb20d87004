package org.resultvault.engine;

/**
 * Raised when a generation is committed against a base generation that is no longer current.
 * The caller retries with a fresh generation.
 */
public final class StorageConflictException extends RuntimeException {
    private final String runName;
    private final long baseGeneration;
    private final long currentGeneration;

    public StorageConflictException(final String runName, final long baseGeneration, final long currentGeneration) {
        super("run '" + runName + "' moved from generation " + baseGeneration + " to " + currentGeneration
                + " while this ingestion was open");
        this.runName = runName;
        this.baseGeneration = baseGeneration;
        this.currentGeneration = currentGeneration;
    }

    public String runName() {
        return runName;
    }

    public long baseGeneration() {
        return baseGeneration;
    }

    public long currentGeneration() {
        return currentGeneration;
    }
}
