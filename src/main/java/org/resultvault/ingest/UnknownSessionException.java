package org.resultvault.ingest;

public final class UnknownSessionException extends RuntimeException {
    private final String sessionId;

    public UnknownSessionException(final String sessionId) {
        super("no open ingestion session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
