package org.resultvault.blob;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of the blob store.
 */
public final class InMemorySourceBlobStore implements SourceBlobStore {
    private final Map<BlobId, byte[]> blobs = new ConcurrentHashMap<>();
    private final Map<String, BlobId> latestByPath = new ConcurrentHashMap<>();

    @Override
    public BlobId put(final String path, final byte[] content) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
        final BlobId blobId = BlobId.of(content);
        blobs.computeIfAbsent(blobId, key -> Arrays.copyOf(content, content.length));
        latestByPath.put(path, blobId);
        return blobId;
    }

    @Override
    public byte[] get(final BlobId blobId) {
        Objects.requireNonNull(blobId, "blobId");
        final byte[] content = blobs.get(blobId);
        if (content == null) {
            throw new BlobNotFoundException(blobId);
        }
        return Arrays.copyOf(content, content.length);
    }

    @Override
    public boolean contains(final BlobId blobId) {
        Objects.requireNonNull(blobId, "blobId");
        return blobs.containsKey(blobId);
    }

    @Override
    public Optional<BlobId> latest(final String path) {
        Objects.requireNonNull(path, "path");
        return Optional.ofNullable(latestByPath.get(path));
    }

    public int size() {
        return blobs.size();
    }
}
