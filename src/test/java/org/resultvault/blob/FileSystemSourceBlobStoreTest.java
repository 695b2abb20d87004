package org.resultvault.blob;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemSourceBlobStoreTest {
    @TempDir
    Path root;

    @Test
    void storesContentUnderShardedObjectPath() {
        FileSystemSourceBlobStore store = new FileSystemSourceBlobStore(root);
        byte[] content = "void f();\n".getBytes(StandardCharsets.UTF_8);

        BlobId id = store.put("src/f.h", content);

        Path object = store.objectPath(id);
        assertEquals(root.resolve("objects").resolve(id.value().substring(0, 2)), object.getParent());
        assertTrue(Files.isRegularFile(object));
        assertArrayEquals(content, store.get(id));
    }

    @Test
    void pathIndexSurvivesReopen() {
        FileSystemSourceBlobStore store = new FileSystemSourceBlobStore(root);
        store.put("src/a.cpp", bytes("old"));
        BlobId current = store.put("src/a.cpp", bytes("new"));
        BlobId other = store.put("src/b.cpp", bytes("other"));

        FileSystemSourceBlobStore reopened = new FileSystemSourceBlobStore(root);

        assertEquals(Optional.of(current), reopened.latest("src/a.cpp"));
        assertEquals(Optional.of(other), reopened.latest("src/b.cpp"));
        assertArrayEquals(bytes("new"), reopened.get(current));
    }

    @Test
    void repeatedPutsWriteOneObjectAndOneIndexRecord() throws IOException {
        FileSystemSourceBlobStore store = new FileSystemSourceBlobStore(root);

        store.put("a.cpp", bytes("same"));
        store.put("a.cpp", bytes("same"));

        List<String> index = Files.readAllLines(root.resolve("paths.log"), StandardCharsets.UTF_8);
        assertEquals(1, index.size());
        try (Stream<Path> files = Files.walk(root.resolve("objects"))) {
            assertEquals(1, files.filter(Files::isRegularFile).count());
        }
    }

    @Test
    void concurrentPutsOfOnePathReplayToSameLatestBlob() throws Exception {
        FileSystemSourceBlobStore store = new FileSystemSourceBlobStore(root);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                final int id = worker;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int round = 0; round < 100; round++) {
                        store.put("src/hot.cpp", bytes("version " + id + "-" + (round % 3)));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        FileSystemSourceBlobStore reopened = new FileSystemSourceBlobStore(root);

        assertEquals(store.latest("src/hot.cpp"), reopened.latest("src/hot.cpp"));
    }

    @Test
    void missingObjectRaisesBlobNotFound() {
        FileSystemSourceBlobStore store = new FileSystemSourceBlobStore(root);

        assertThrows(BlobNotFoundException.class, () -> store.get(BlobId.of(bytes("absent"))));
    }

    private static byte[] bytes(final String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
