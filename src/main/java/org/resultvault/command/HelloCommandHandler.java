package org.resultvault.command;

import java.util.Objects;
import java.util.function.Supplier;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;

/**
 * Answers the driver handshake ({@code hello}, {@code isMaster}) as a standalone server.
 */
public final class HelloCommandHandler implements CommandHandler {
    static final int MAX_BSON_OBJECT_SIZE = 16 * 1024 * 1024;
    static final int MAX_MESSAGE_SIZE_BYTES = 48_000_000;

    private final Supplier<String> connectionId;

    public HelloCommandHandler(final Supplier<String> connectionId) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        return new BsonDocument()
                .append("isWritablePrimary", BsonBoolean.TRUE)
                .append("ismaster", BsonBoolean.TRUE)
                .append("helloOk", BsonBoolean.TRUE)
                .append("minWireVersion", new BsonInt32(0))
                .append("maxWireVersion", new BsonInt32(17))
                .append("maxBsonObjectSize", new BsonInt32(MAX_BSON_OBJECT_SIZE))
                .append("maxMessageSizeBytes", new BsonInt32(MAX_MESSAGE_SIZE_BYTES))
                .append("maxWriteBatchSize", new BsonInt32(100_000))
                .append("logicalSessionTimeoutMinutes", new BsonInt32(30))
                .append("connectionId", new BsonInt32(numericConnectionId()))
                .append("msg", new BsonString("resultvault"))
                .append("ok", new BsonDouble(1.0));
    }

    private int numericConnectionId() {
        final String current = connectionId.get();
        if (current == null) {
            return 0;
        }
        try {
            return Integer.parseInt(current);
        } catch (final NumberFormatException ignored) {
            return 0;
        }
    }
}
