package org.resultvault.engine;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read view of a stored run and its commit log, oldest generation first.
 */
public record Run(
        String name, long generation, Instant createdAt, Map<String, String> metadata, List<RunGeneration> history) {
    public Run {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(createdAt, "createdAt");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        history = history == null ? List.of() : List.copyOf(history);
    }

    public RunGeneration latest() {
        return history.get(history.size() - 1);
    }

    /**
     * The most recent generation carrying {@code tag}.
     */
    public Optional<RunGeneration> tagged(final String tag) {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (tag.equals(history.get(i).tag())) {
                return Optional.of(history.get(i));
            }
        }
        return Optional.empty();
    }
}
