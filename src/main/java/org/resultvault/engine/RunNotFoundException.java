package org.resultvault.engine;

public final class RunNotFoundException extends RuntimeException {
    private final String runName;

    public RunNotFoundException(final String runName) {
        super("no such run: " + runName);
        this.runName = runName;
    }

    public RunNotFoundException(final String runName, final String tag) {
        super("run '" + runName + "' has no generation tagged '" + tag + "'");
        this.runName = runName;
    }

    public String runName() {
        return runName;
    }
}
