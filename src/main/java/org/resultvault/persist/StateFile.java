package org.resultvault.persist;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import org.resultvault.engine.ReportStoreState;

/**
 * The {@code state.json} file of a data directory. Writes go to a sibling temporary file that is then moved over
 * the previous state, so a crash never leaves a half-written file behind.
 */
public final class StateFile {
    public static final String FILE_NAME = "state.json";

    private final Path path;
    private final StateCodec codec;

    public StateFile(final Path dataDirectory) {
        this(dataDirectory, new StateCodec());
    }

    public StateFile(final Path dataDirectory, final StateCodec codec) {
        this.path = Objects.requireNonNull(dataDirectory, "dataDirectory").resolve(FILE_NAME);
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Path path() {
        return path;
    }

    /**
     * @return the stored state, or empty when the file does not exist yet
     * @throws SchemaVersionMismatchException when the file was written by a newer schema
     */
    public Optional<ReportStoreState> read() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.fromJson(Files.readString(path, StandardCharsets.UTF_8)));
        } catch (final IOException e) {
            throw new UncheckedIOException("failed to read " + path, e);
        }
    }

    public void write(final ReportStoreState state) {
        Objects.requireNonNull(state, "state");
        final String json = codec.toJson(state);
        try {
            Files.createDirectories(path.getParent());
            final Path temporary = Files.createTempFile(path.getParent(), FILE_NAME, ".tmp");
            try {
                Files.writeString(temporary, json, StandardCharsets.UTF_8);
                try {
                    Files.move(temporary, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (final AtomicMoveNotSupportedException unsupported) {
                    Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temporary);
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("failed to write " + path, e);
        }
    }
}
