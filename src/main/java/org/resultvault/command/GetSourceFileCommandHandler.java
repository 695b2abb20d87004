package org.resultvault.command;

import java.util.Objects;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.resultvault.blob.BlobId;
import org.resultvault.blob.SourceBlobStore;

/**
 * {@code {getSourceFile: <blobId>}} or {@code {getSourceFile: 1, path: <path>}} for the latest content stored
 * under a path.
 */
final class GetSourceFileCommandHandler implements CommandHandler {
    private final SourceBlobStore blobs;

    GetSourceFileCommandHandler(final SourceBlobStore blobs) {
        this.blobs = Objects.requireNonNull(blobs, "blobs");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        final String path = CommandArguments.optionalString(command, "path");
        final BlobId blobId;
        if (path != null) {
            blobId = blobs.latest(path)
                    .orElseThrow(() -> new IllegalArgumentException("no source content stored for " + path));
        } else {
            final String requested = CommandArguments.commandValueText(command);
            if (!requested.matches("[0-9a-f]{64}")) {
                throw new IllegalArgumentException("malformed blob id: " + requested);
            }
            blobId = new BlobId(requested);
        }

        final byte[] content = blobs.get(blobId);
        final BsonDocument response = new BsonDocument()
                .append("blobId", new BsonString(blobId.value()))
                .append("size", new BsonInt32(content.length))
                .append("content", new BsonBinary(content));
        if (path != null) {
            response.append("path", new BsonString(path));
        }
        return response.append("ok", new BsonDouble(1.0));
    }
}
