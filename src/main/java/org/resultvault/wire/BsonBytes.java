package org.resultvault.wire;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.bson.BsonBinaryWriter;
import org.bson.BsonDocument;
import org.bson.RawBsonDocument;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;

final class BsonBytes {
    private static final int MIN_DOCUMENT_LENGTH = 5;

    private BsonBytes() {}

    static byte[] encode(final BsonDocument document) {
        final BasicOutputBuffer outputBuffer = new BasicOutputBuffer();
        try (BsonBinaryWriter writer = new BsonBinaryWriter(outputBuffer)) {
            new BsonDocumentCodec()
                    .encode(writer, document, EncoderContext.builder().isEncodingCollectibleDocument(true).build());
            return outputBuffer.toByteArray();
        }
    }

    /**
     * Reads the document starting at the buffer position and advances past it.
     */
    static BsonDocument read(final ByteBuffer buffer, final int limitExclusive) {
        if (buffer.position() + Integer.BYTES > limitExclusive) {
            throw new WireProtocolException("missing BSON document length");
        }
        final int start = buffer.position();
        final int documentLength = buffer.getInt(start);
        if (documentLength < MIN_DOCUMENT_LENGTH) {
            throw new WireProtocolException("invalid BSON document length: " + documentLength);
        }
        if (start + documentLength > limitExclusive) {
            throw new WireProtocolException("declared BSON document length exceeds available bytes");
        }
        final byte[] documentBytes = new byte[documentLength];
        buffer.get(documentBytes);
        return new RawBsonDocument(documentBytes);
    }

    static String readCString(final ByteBuffer buffer, final int limitExclusive) {
        final int start = buffer.position();
        int cursor = start;
        while (cursor < limitExclusive && buffer.get(cursor) != 0) {
            cursor++;
        }
        if (cursor >= limitExclusive) {
            throw new WireProtocolException("unterminated C-string");
        }
        final byte[] bytes = new byte[cursor - start];
        buffer.get(bytes);
        buffer.get();
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
