package org.resultvault.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.bson.BsonDocument;

/**
 * Decodes OP_QUERY commands and encodes the single-document OP_REPLY that answers them.
 */
public final class OpQueryCodec {
    public static final int OP_REPLY = 1;
    private static final int OP_REPLY_FIELDS_LENGTH = 20;

    public OpQuery decode(final byte[] messageBytes) {
        final MessageHeader header = MessageHeader.read(messageBytes);
        if (header.opCode() != OpQuery.OP_CODE) {
            throw new WireProtocolException("unsupported opCode: " + header.opCode());
        }
        if (header.messageLength() != messageBytes.length) {
            throw new WireProtocolException("messageLength does not match the provided byte array length");
        }
        final ByteBuffer buffer = ByteBuffer.wrap(messageBytes).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(MessageHeader.LENGTH);
        if (buffer.remaining() < Integer.BYTES) {
            throw new WireProtocolException("OP_QUERY is missing its flags");
        }
        buffer.getInt();
        final String fullCollectionName = BsonBytes.readCString(buffer, messageBytes.length);
        if (buffer.remaining() < 2 * Integer.BYTES) {
            throw new WireProtocolException("OP_QUERY is missing numberToSkip and numberToReturn");
        }
        buffer.getInt();
        buffer.getInt();
        final BsonDocument query = BsonBytes.read(buffer, messageBytes.length);
        return new OpQuery(header.requestId(), fullCollectionName, query);
    }

    public byte[] encodeReply(final int requestId, final int responseTo, final BsonDocument document) {
        final byte[] bodyBytes = BsonBytes.encode(document);
        final int totalLength = MessageHeader.LENGTH + OP_REPLY_FIELDS_LENGTH + bodyBytes.length;
        final ByteBuffer buffer = ByteBuffer.allocate(totalLength).order(ByteOrder.LITTLE_ENDIAN);
        new MessageHeader(totalLength, requestId, responseTo, OP_REPLY).write(buffer);
        return buffer
                .putInt(0) // responseFlags
                .putLong(0L) // cursorId
                .putInt(0) // startingFrom
                .putInt(1) // numberReturned
                .put(bodyBytes)
                .array();
    }
}
