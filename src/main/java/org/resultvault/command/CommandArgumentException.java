package org.resultvault.command;

/**
 * A command field is missing or has the wrong BSON type.
 */
final class CommandArgumentException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    CommandArgumentException(final String message) {
        super(message);
    }
}
