package org.resultvault.blob;

/**
 * Raised when a blob id is not present in the store.
 */
public final class BlobNotFoundException extends RuntimeException {
    private final BlobId blobId;

    public BlobNotFoundException(final BlobId blobId) {
        super("blob not found: " + blobId);
        this.blobId = blobId;
    }

    public BlobId blobId() {
        return blobId;
    }
}
