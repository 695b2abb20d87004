package org.resultvault.wire;

import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;

/**
 * A decoded OP_MSG. {@link #body()} already holds every document sequence merged in as an array field.
 */
public final class OpMsg {
    public static final int OP_CODE = 2013;
    static final int CHECKSUM_PRESENT = 1;
    static final int MORE_TO_COME = 1 << 1;

    private final int requestId;
    private final int responseTo;
    private final int flagBits;
    private final BsonDocument body;
    private final List<DocumentSequence> sequences;

    public OpMsg(final int requestId, final int responseTo, final int flagBits, final BsonDocument body) {
        this(requestId, responseTo, flagBits, body, List.of());
    }

    public OpMsg(
            final int requestId,
            final int responseTo,
            final int flagBits,
            final BsonDocument body,
            final List<DocumentSequence> sequences) {
        this.requestId = requestId;
        this.responseTo = responseTo;
        this.flagBits = flagBits;
        this.body = Objects.requireNonNull(body, "body");
        this.sequences = List.copyOf(sequences);
    }

    public static OpMsg reply(final int requestId, final int responseTo, final BsonDocument body) {
        return new OpMsg(requestId, responseTo, 0, body);
    }

    public int requestId() {
        return requestId;
    }

    public int responseTo() {
        return responseTo;
    }

    public int flagBits() {
        return flagBits;
    }

    /**
     * The sender expects no reply.
     */
    public boolean moreToCome() {
        return (flagBits & MORE_TO_COME) != 0;
    }

    public BsonDocument body() {
        return body;
    }

    public List<DocumentSequence> sequences() {
        return sequences;
    }
}
