package org.resultvault.blob;

import java.util.Optional;

/**
 * Content-addressed storage of analyzed source files.
 *
 * <p>Identical bytes are stored once no matter how many paths reference them. Blobs are never removed by the
 * store itself.
 */
public interface SourceBlobStore {
    BlobId put(String path, byte[] content);

    /**
     * @throws BlobNotFoundException when nothing was stored under {@code blobId}
     */
    byte[] get(BlobId blobId);

    boolean contains(BlobId blobId);

    /**
     * Returns the blob most recently stored under {@code path}.
     */
    Optional<BlobId> latest(String path);

    default SourceFile store(final String path, final byte[] content) {
        return new SourceFile(path, put(path, content));
    }
}
