package org.resultvault.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * The 16-byte little-endian header every MongoDB wire message starts with.
 */
public record MessageHeader(int messageLength, int requestId, int responseTo, int opCode) {
    public static final int LENGTH = 16;

    public static MessageHeader read(final byte[] message) {
        if (message == null || message.length < LENGTH) {
            throw new WireProtocolException("message is shorter than its header");
        }
        final ByteBuffer buffer = ByteBuffer.wrap(message, 0, LENGTH).order(ByteOrder.LITTLE_ENDIAN);
        return new MessageHeader(buffer.getInt(), buffer.getInt(), buffer.getInt(), buffer.getInt());
    }

    void write(final ByteBuffer buffer) {
        buffer.putInt(messageLength);
        buffer.putInt(requestId);
        buffer.putInt(responseTo);
        buffer.putInt(opCode);
    }
}
