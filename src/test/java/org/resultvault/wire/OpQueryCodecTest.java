package org.resultvault.wire;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import org.bson.BsonDocument;
import org.bson.RawBsonDocument;
import org.junit.jupiter.api.Test;

class OpQueryCodecTest {
    private final OpQueryCodec codec = new OpQueryCodec();

    @Test
    void decodesHandshakeQueryAgainstCommandCollection() {
        final BsonDocument handshake = BsonDocument.parse("{\"isMaster\": 1, \"helloOk\": true}");

        final OpQuery query = codec.decode(opQuery(5, "admin.$cmd", handshake));

        assertEquals(5, query.requestId());
        assertEquals("admin.$cmd", query.fullCollectionName());
        assertEquals(handshake, query.query());
    }

    @Test
    void encodesSingleDocumentReply() {
        final BsonDocument reply = BsonDocument.parse("{\"ismaster\": true, \"ok\": 1.0}");

        final byte[] encoded = codec.encodeReply(11, 5, reply);
        final MessageHeader header = MessageHeader.read(encoded);
        final ByteBuffer buffer = ByteBuffer.wrap(encoded).order(ByteOrder.LITTLE_ENDIAN);

        assertEquals(encoded.length, header.messageLength());
        assertEquals(11, header.requestId());
        assertEquals(5, header.responseTo());
        assertEquals(OpQueryCodec.OP_REPLY, header.opCode());
        assertEquals(1, buffer.getInt(32)); // numberReturned
        final byte[] document = new byte[encoded.length - 36];
        buffer.position(36);
        buffer.get(document);
        assertEquals(reply, new RawBsonDocument(document));
    }

    @Test
    void rejectsOtherOpCodes() {
        final byte[] message = opQuery(5, "admin.$cmd", BsonDocument.parse("{\"ping\": 1}"));
        ByteBuffer.wrap(message).order(ByteOrder.LITTLE_ENDIAN).putInt(12, OpMsg.OP_CODE);

        assertThrows(WireProtocolException.class, () -> codec.decode(message));
    }

    @Test
    void rejectsUnterminatedCollectionName() {
        final byte[] name = "admin.$cmd".getBytes(StandardCharsets.UTF_8);
        final int length = MessageHeader.LENGTH + 4 + name.length;
        final byte[] message = ByteBuffer.allocate(length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(length)
                .putInt(1)
                .putInt(0)
                .putInt(OpQuery.OP_CODE)
                .putInt(0)
                .put(name)
                .array();

        assertThrows(WireProtocolException.class, () -> codec.decode(message));
    }

    static byte[] opQuery(final int requestId, final String collection, final BsonDocument query) {
        final byte[] name = collection.getBytes(StandardCharsets.UTF_8);
        final byte[] document = BsonBytes.encode(query);
        final int length = MessageHeader.LENGTH + 4 + name.length + 1 + 8 + document.length;
        return ByteBuffer.allocate(length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(length)
                .putInt(requestId)
                .putInt(0)
                .putInt(OpQuery.OP_CODE)
                .putInt(0)
                .put(name)
                .put((byte) 0)
                .putInt(0)
                .putInt(-1)
                .put(document)
                .array();
    }
}
