package org.resultvault.engine;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a commit: the new generation and how many fingerprints it moved into each detection status.
 */
public record CommitResult(
        String runName, long generation, String tag, int reportCount, Map<DetectionStatus, Integer> transitions) {
    public CommitResult {
        Objects.requireNonNull(runName, "runName");
        transitions = transitions == null ? Map.of() : Map.copyOf(transitions);
    }

    public int transitionsTo(final DetectionStatus status) {
        return transitions.getOrDefault(status, 0);
    }
}
