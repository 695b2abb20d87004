package org.resultvault.wire;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

class OpMsgCodecTest {
    private final OpMsgCodec codec = new OpMsgCodec();

    @Test
    void encodesReplyThatDecodesToSameBody() {
        final BsonDocument body =
                BsonDocument.parse("{\"runName\": \"app\", \"generation\": {\"$numberLong\": \"3\"}}");

        final byte[] encoded = codec.encode(OpMsg.reply(8, 42, body));
        final MessageHeader header = MessageHeader.read(encoded);
        final OpMsg decoded = codec.decode(encoded);

        assertEquals(encoded.length, header.messageLength());
        assertEquals(OpMsg.OP_CODE, header.opCode());
        assertEquals(8, decoded.requestId());
        assertEquals(42, decoded.responseTo());
        assertEquals(0, decoded.flagBits());
        assertEquals(body, decoded.body());
        assertTrue(decoded.sequences().isEmpty());
    }

    @Test
    void mergesFindingSequenceIntoSubmitBody() {
        final BsonDocument body = BsonDocument.parse(
                "{\"submitResults\": \"session-1\", \"submissionId\": \"producer-1\", \"$db\": \"admin\"}");
        final BsonDocument first = BsonDocument.parse("{\"checkerId\": \"core.DivideZero\", \"line\": 2}");
        final BsonDocument second = BsonDocument.parse("{\"checkerId\": \"deadcode.DeadStores\", \"line\": 6}");

        final OpMsg decoded = codec.decode(codec.encode(
                new OpMsg(99, 0, 0, body, List.of(new DocumentSequence("findings", List.of(first, second))))));

        assertEquals("session-1", decoded.body().getString("submitResults").getValue());
        assertEquals(2, decoded.body().getArray("findings").size());
        assertEquals(first, decoded.body().getArray("findings").get(0).asDocument());
        assertEquals(second, decoded.body().getArray("findings").get(1).asDocument());
        assertEquals(1, decoded.sequences().size());
        assertEquals("findings", decoded.sequences().get(0).identifier());
    }

    @Test
    void appendsSequenceToArrayAlreadyInBody() {
        final BsonDocument body = BsonDocument.parse(
                "{\"submitResults\": \"session-1\", \"sources\": [{\"path\": \"a.cpp\", \"content\": \"\"}]}");
        final BsonDocument extra = BsonDocument.parse("{\"path\": \"b.cpp\", \"content\": \"\"}");

        final OpMsg decoded = codec.decode(codec.encode(
                new OpMsg(1, 0, 0, body, List.of(new DocumentSequence("sources", List.of(extra))))));

        assertEquals(2, decoded.body().getArray("sources").size());
        assertEquals("b.cpp", decoded.body().getArray("sources").get(1).asDocument().getString("path").getValue());
    }

    @Test
    void rejectsSequenceConflictingWithScalarField() {
        final BsonDocument body = BsonDocument.parse("{\"submitResults\": \"session-1\", \"findings\": 1}");
        final byte[] encoded = codec.encode(new OpMsg(
                1, 0, 0, body, List.of(new DocumentSequence("findings", List.of(new BsonDocument())))));

        assertThrows(WireProtocolException.class, () -> codec.decode(encoded));
    }

    @Test
    void skipsChecksumWhenFlagIsPresent() {
        final BsonDocument body = BsonDocument.parse("{\"ping\": 1, \"$db\": \"admin\"}");
        final byte[] unchecked = codec.encode(new OpMsg(7, 0, 0, body));
        final byte[] message = ByteBuffer.allocate(unchecked.length + 4)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(unchecked.length + 4)
                .put(unchecked, 4, unchecked.length - 4)
                .putInt(0x12345678)
                .array();
        ByteBuffer.wrap(message).order(ByteOrder.LITTLE_ENDIAN).putInt(16, OpMsg.CHECKSUM_PRESENT);

        final OpMsg decoded = codec.decode(message);

        assertEquals(OpMsg.CHECKSUM_PRESENT, decoded.flagBits());
        assertEquals(body, decoded.body());
    }

    @Test
    void exposesMoreToComeFlag() {
        final BsonDocument body = BsonDocument.parse("{\"ping\": 1}");

        assertTrue(codec.decode(codec.encode(new OpMsg(3, 0, OpMsg.MORE_TO_COME, body))).moreToCome());
        assertFalse(codec.decode(codec.encode(new OpMsg(3, 0, 0, body))).moreToCome());
    }

    @Test
    void rejectsUnsupportedSectionKind() {
        final byte[] encoded = codec.encode(new OpMsg(10, 0, 0, BsonDocument.parse("{\"ping\": 1}")));
        encoded[20] = 2; // First section kind byte: 16-byte header + 4-byte flags.

        assertThrows(WireProtocolException.class, () -> codec.decode(encoded));
    }

    @Test
    void rejectsLengthMismatchAndTruncatedDocument() {
        final byte[] encoded = codec.encode(new OpMsg(10, 0, 0, BsonDocument.parse("{\"listRuns\": 1}")));
        final byte[] truncated = Arrays.copyOf(encoded, encoded.length - 3);

        assertThrows(WireProtocolException.class, () -> codec.decode(truncated));

        ByteBuffer.wrap(truncated).order(ByteOrder.LITTLE_ENDIAN).putInt(0, truncated.length);
        assertThrows(WireProtocolException.class, () -> codec.decode(truncated));
        assertThrows(WireProtocolException.class, () -> MessageHeader.read(new byte[8]));
    }
}
