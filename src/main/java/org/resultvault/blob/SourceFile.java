package org.resultvault.blob;

import java.util.Objects;

public record SourceFile(String path, BlobId blobId) {
    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(blobId, "blobId");
        if (path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
    }
}
