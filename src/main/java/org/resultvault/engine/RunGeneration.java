package org.resultvault.engine;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Commit log entry of a run. {@code openFingerprints} holds the fingerprints active once this generation was
 * committed.
 */
public record RunGeneration(
        long generation,
        String tag,
        Instant committedAt,
        Map<DetectionStatus, Integer> statusCounts,
        Set<String> enabledCheckers,
        Set<String> disabledCheckers,
        int submissions,
        Set<String> openFingerprints) {
    public RunGeneration {
        if (generation < 1) {
            throw new IllegalArgumentException("generation must be positive: " + generation);
        }
        Objects.requireNonNull(committedAt, "committedAt");
        final Map<DetectionStatus, Integer> counts = new EnumMap<>(DetectionStatus.class);
        if (statusCounts != null) {
            counts.putAll(statusCounts);
        }
        statusCounts = Map.copyOf(counts);
        enabledCheckers = enabledCheckers == null ? null : Set.copyOf(enabledCheckers);
        disabledCheckers = disabledCheckers == null ? Set.of() : Set.copyOf(disabledCheckers);
        openFingerprints = openFingerprints == null ? Set.of() : Set.copyOf(openFingerprints);
    }

    public int count(final DetectionStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }
}
