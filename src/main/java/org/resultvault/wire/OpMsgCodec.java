package org.resultvault.wire;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;

/**
 * Encodes and decodes OP_MSG frames.
 *
 * <p>Decoding accepts one body section (kind 0) and any number of document sequences (kind 1), which are merged
 * into the body as arrays under their identifiers. A trailing CRC-32C checksum is skipped, not verified. Replies
 * are encoded without checksum.
 */
public final class OpMsgCodec {
    private static final int FLAG_BITS_LENGTH = 4;
    private static final int CHECKSUM_LENGTH = 4;
    private static final byte BODY_SECTION_KIND = 0;
    private static final byte DOCUMENT_SEQUENCE_SECTION_KIND = 1;

    public byte[] encode(final OpMsg message) {
        final ByteArrayOutputStream sections = new ByteArrayOutputStream();
        sections.write(BODY_SECTION_KIND);
        sections.writeBytes(BsonBytes.encode(message.body()));
        for (final DocumentSequence sequence : message.sequences()) {
            final ByteArrayOutputStream payload = new ByteArrayOutputStream();
            payload.writeBytes(sequence.identifier().getBytes(StandardCharsets.UTF_8));
            payload.write(0);
            for (final BsonDocument document : sequence.documents()) {
                payload.writeBytes(BsonBytes.encode(document));
            }
            sections.write(DOCUMENT_SEQUENCE_SECTION_KIND);
            sections.writeBytes(littleEndianInt(Integer.BYTES + payload.size()));
            sections.writeBytes(payload.toByteArray());
        }

        final int messageLength = MessageHeader.LENGTH + FLAG_BITS_LENGTH + sections.size();
        final ByteBuffer buffer = ByteBuffer.allocate(messageLength).order(ByteOrder.LITTLE_ENDIAN);
        new MessageHeader(messageLength, message.requestId(), message.responseTo(), OpMsg.OP_CODE).write(buffer);
        buffer.putInt(message.flagBits() & ~OpMsg.CHECKSUM_PRESENT);
        buffer.put(sections.toByteArray());
        return buffer.array();
    }

    public OpMsg decode(final byte[] messageBytes) {
        final MessageHeader header = MessageHeader.read(messageBytes);
        if (messageBytes.length < MessageHeader.LENGTH + FLAG_BITS_LENGTH + 1 + 5) {
            throw new WireProtocolException("OP_MSG bytes are too short");
        }
        if (header.messageLength() != messageBytes.length) {
            throw new WireProtocolException("messageLength does not match the provided byte array length");
        }
        if (header.opCode() != OpMsg.OP_CODE) {
            throw new WireProtocolException("unsupported opCode: " + header.opCode());
        }

        final ByteBuffer buffer = ByteBuffer.wrap(messageBytes).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(MessageHeader.LENGTH);
        final int flagBits = buffer.getInt();
        final int checksumLength = (flagBits & OpMsg.CHECKSUM_PRESENT) != 0 ? CHECKSUM_LENGTH : 0;
        final int payloadLimit = header.messageLength() - checksumLength;
        if (payloadLimit <= MessageHeader.LENGTH + FLAG_BITS_LENGTH) {
            throw new WireProtocolException("OP_MSG payload is empty");
        }

        BsonDocument body = null;
        final List<DocumentSequence> sequences = new ArrayList<>();
        while (buffer.position() < payloadLimit) {
            final byte sectionKind = buffer.get();
            if (sectionKind == BODY_SECTION_KIND) {
                if (body != null) {
                    throw new WireProtocolException("OP_MSG carries more than one body section");
                }
                body = BsonBytes.read(buffer, payloadLimit);
            } else if (sectionKind == DOCUMENT_SEQUENCE_SECTION_KIND) {
                sequences.add(readDocumentSequence(buffer, payloadLimit));
            } else {
                throw new WireProtocolException("unsupported OP_MSG section kind: " + sectionKind);
            }
        }
        if (body == null) {
            throw new WireProtocolException("OP_MSG body section (kind 0) is required");
        }

        final BsonDocument mergedBody = new BsonDocument();
        for (final String key : body.keySet()) {
            mergedBody.put(key, body.get(key));
        }
        for (final DocumentSequence sequence : sequences) {
            merge(mergedBody, sequence);
        }
        return new OpMsg(header.requestId(), header.responseTo(), flagBits, mergedBody, sequences);
    }

    private static DocumentSequence readDocumentSequence(final ByteBuffer buffer, final int payloadLimit) {
        if (buffer.position() + Integer.BYTES > payloadLimit) {
            throw new WireProtocolException("missing OP_MSG document sequence size");
        }
        final int sectionStart = buffer.position();
        final int sectionSize = buffer.getInt();
        if (sectionSize < Integer.BYTES + 1) {
            throw new WireProtocolException("invalid OP_MSG document sequence size: " + sectionSize);
        }
        final int sectionEnd = sectionStart + sectionSize;
        if (sectionEnd > payloadLimit) {
            throw new WireProtocolException("OP_MSG document sequence exceeds payload boundary");
        }

        final String identifier = BsonBytes.readCString(buffer, sectionEnd);
        final List<BsonDocument> documents = new ArrayList<>();
        while (buffer.position() < sectionEnd) {
            documents.add(BsonBytes.read(buffer, sectionEnd));
        }
        return new DocumentSequence(identifier, documents);
    }

    private static void merge(final BsonDocument body, final DocumentSequence sequence) {
        final BsonValue existing = body.get(sequence.identifier());
        final BsonArray merged = new BsonArray();
        if (existing != null) {
            if (!existing.isArray()) {
                throw new WireProtocolException(
                        "document sequence '" + sequence.identifier() + "' conflicts with a non-array command field");
            }
            merged.addAll(existing.asArray());
        }
        merged.addAll(sequence.documents());
        body.put(sequence.identifier(), merged);
    }

    private static byte[] littleEndianInt(final int value) {
        return ByteBuffer.allocate(Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN).putInt(value).array();
    }
}
