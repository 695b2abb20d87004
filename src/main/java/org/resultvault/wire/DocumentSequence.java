package org.resultvault.wire;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;

/**
 * OP_MSG payload type 1 section: a named run of documents sent outside the command body.
 */
public record DocumentSequence(String identifier, List<BsonDocument> documents) {
    public DocumentSequence {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be null or empty");
        }
        Objects.requireNonNull(documents, "documents");
        final List<BsonDocument> copies = new ArrayList<>(documents.size());
        for (final BsonDocument document : documents) {
            copies.add(Objects.requireNonNull(document, "documents entries must not be null"));
        }
        documents = List.copyOf(copies);
    }
}
