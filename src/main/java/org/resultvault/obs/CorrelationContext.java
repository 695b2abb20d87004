package org.resultvault.obs;

import java.util.Map;

/**
 * Correlation metadata emitted with every structured log event.
 *
 * <p>{@code requestId} and {@code commandName} are required; the run, session and connection are attached when
 * the event belongs to one. Blank values are treated as absent.
 */
public record CorrelationContext(
        String requestId, String commandName, String connectionId, String runName, String sessionId) {
    public CorrelationContext {
        requestId = require(requestId, "requestId");
        commandName = require(commandName, "commandName");
        connectionId = blankToNull(connectionId);
        runName = blankToNull(runName);
        sessionId = blankToNull(sessionId);
    }

    public static CorrelationContext of(final String requestId, final String commandName) {
        return new CorrelationContext(requestId, commandName, null, null, null);
    }

    public CorrelationContext withConnection(final String id) {
        return new CorrelationContext(requestId, commandName, id, runName, sessionId);
    }

    public CorrelationContext withRun(final String name) {
        return new CorrelationContext(requestId, commandName, connectionId, name, sessionId);
    }

    public CorrelationContext withSession(final String id) {
        return new CorrelationContext(requestId, commandName, connectionId, runName, id);
    }

    /**
     * Adds the present fields to a log event under their component names.
     */
    void appendTo(final Map<String, Object> event) {
        event.put("requestId", requestId);
        event.put("commandName", commandName);
        if (connectionId != null) {
            event.put("connectionId", connectionId);
        }
        if (runName != null) {
            event.put("runName", runName);
        }
        if (sessionId != null) {
            event.put("sessionId", sessionId);
        }
    }

    private static String require(final String value, final String name) {
        final String text = blankToNull(value);
        if (text == null) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return text;
    }

    private static String blankToNull(final String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
