package org.resultvault.wire;

/**
 * Bytes on the connection do not form a message this server understands. The connection cannot be resynced
 * and is closed.
 */
public final class WireProtocolException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public WireProtocolException(final String message) {
        super(message);
    }

    public WireProtocolException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
