package org.resultvault.blob;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Blob store backed by a directory.
 *
 * <p>Content lives at {@code objects/<first two hex chars>/<remaining hex chars>}. Every blob is first written
 * to a temporary file and then moved into place, so a reader never sees a partial blob. The path index is an
 * append-only {@code paths.log} of {@code <blobId> TAB <path>} lines replayed on startup. Log records are
 * appended in the same order as the index changes, so a replay restores the same latest blob per path.
 */
public final class FileSystemSourceBlobStore implements SourceBlobStore {
    private static final String OBJECTS_DIRECTORY = "objects";
    private static final String PATH_LOG = "paths.log";

    private final Path objectsRoot;
    private final Path pathLog;
    private final Map<String, BlobId> latestByPath = new ConcurrentHashMap<>();
    private final Object pathLock = new Object();

    public FileSystemSourceBlobStore(final Path root) {
        Objects.requireNonNull(root, "root");
        this.objectsRoot = root.resolve(OBJECTS_DIRECTORY);
        this.pathLog = root.resolve(PATH_LOG);
        try {
            Files.createDirectories(objectsRoot);
        } catch (final IOException exception) {
            throw new UncheckedIOException("failed to create blob directory " + objectsRoot, exception);
        }
        replayPathLog();
    }

    @Override
    public BlobId put(final String path, final byte[] content) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
        final BlobId blobId = BlobId.of(content);
        final Path target = objectPath(blobId);
        if (!Files.exists(target)) {
            writeAtomically(target, content);
        }
        synchronized (pathLock) {
            if (!blobId.equals(latestByPath.get(path))) {
                appendPathRecord(blobId, path);
                latestByPath.put(path, blobId);
            }
        }
        return blobId;
    }

    @Override
    public byte[] get(final BlobId blobId) {
        Objects.requireNonNull(blobId, "blobId");
        try {
            return Files.readAllBytes(objectPath(blobId));
        } catch (final NoSuchFileException missing) {
            throw new BlobNotFoundException(blobId);
        } catch (final IOException exception) {
            throw new UncheckedIOException("failed to read blob " + blobId, exception);
        }
    }

    @Override
    public boolean contains(final BlobId blobId) {
        Objects.requireNonNull(blobId, "blobId");
        return Files.isRegularFile(objectPath(blobId));
    }

    @Override
    public Optional<BlobId> latest(final String path) {
        Objects.requireNonNull(path, "path");
        return Optional.ofNullable(latestByPath.get(path));
    }

    Path objectPath(final BlobId blobId) {
        final String value = blobId.value();
        return objectsRoot.resolve(value.substring(0, 2)).resolve(value.substring(2));
    }

    private static void writeAtomically(final Path target, final byte[] content) {
        try {
            Files.createDirectories(target.getParent());
            final Path temp = Files.createTempFile(target.getParent(), ".blob-", ".tmp");
            try {
                Files.write(temp, content);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (final IOException exception) {
            throw new UncheckedIOException("failed to store blob " + target.getFileName(), exception);
        }
    }

    private static void moveIntoPlace(final Path temp, final Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (final FileAlreadyExistsException concurrentWriter) {
            // same content was stored by another writer
        } catch (final AtomicMoveNotSupportedException unsupported) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void appendPathRecord(final BlobId blobId, final String path) {
        final String record = blobId.value() + '\t' + path.replace('\n', ' ') + '\n';
        try {
            Files.writeString(
                    pathLog,
                    record,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (final IOException exception) {
            throw new UncheckedIOException("failed to append blob path index", exception);
        }
    }

    private void replayPathLog() {
        if (!Files.exists(pathLog)) {
            return;
        }
        final List<String> records;
        try {
            records = Files.readAllLines(pathLog, StandardCharsets.UTF_8);
        } catch (final IOException exception) {
            throw new UncheckedIOException("failed to read blob path index", exception);
        }
        for (final String record : records) {
            final int tab = record.indexOf('\t');
            if (tab != 64 || record.length() == tab + 1) {
                continue;
            }
            latestByPath.put(record.substring(tab + 1), new BlobId(record.substring(0, tab)));
        }
    }
}
