package org.resultvault.engine;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable committed state of one run: its commit log and the report row of every fingerprint it ever saw.
 */
public record RunState(
        String name,
        Instant createdAt,
        Map<String, String> metadata,
        List<RunGeneration> history,
        Map<String, Report> reports) {
    public RunState {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(createdAt, "createdAt");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        history = history == null ? List.of() : List.copyOf(history);
        if (history.isEmpty()) {
            throw new IllegalArgumentException("run state needs at least one generation");
        }
        reports = Collections.unmodifiableMap(new TreeMap<>(reports == null ? Map.of() : reports));
    }

    public long generation() {
        return history.get(history.size() - 1).generation();
    }

    public Run view() {
        return new Run(name, generation(), createdAt, metadata, history);
    }
}
