package org.resultvault.ingest;

/**
 * Raised by finalize when submissions are missing or still partial. The generation has been aborted.
 */
public final class IngestionIncompleteException extends RuntimeException {
    private final String runName;
    private final Integer expectedSubmissions;
    private final int completedSubmissions;
    private final int incompleteSubmissions;

    public IngestionIncompleteException(
            final String runName,
            final Integer expectedSubmissions,
            final int completedSubmissions,
            final int incompleteSubmissions) {
        super("ingestion into run '" + runName + "' is incomplete: completed=" + completedSubmissions
                + (expectedSubmissions == null ? "" : " expected=" + expectedSubmissions)
                + " partial=" + incompleteSubmissions);
        this.runName = runName;
        this.expectedSubmissions = expectedSubmissions;
        this.completedSubmissions = completedSubmissions;
        this.incompleteSubmissions = incompleteSubmissions;
    }

    public String runName() {
        return runName;
    }

    public Integer expectedSubmissions() {
        return expectedSubmissions;
    }

    public int completedSubmissions() {
        return completedSubmissions;
    }

    public int incompleteSubmissions() {
        return incompleteSubmissions;
    }
}
