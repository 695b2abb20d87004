package org.resultvault.engine;

import java.util.Map;
import java.util.Set;

/**
 * Settings of one generation. {@code enabledCheckers} is {@code null} when the producer did not report the
 * checker configuration.
 */
public record GenerationOptions(
        String tag, Set<String> enabledCheckers, Set<String> disabledCheckers, Map<String, String> metadata) {
    public static final GenerationOptions DEFAULT = new GenerationOptions(null, null, Set.of(), Map.of());

    public GenerationOptions {
        tag = tag == null || tag.isBlank() ? null : tag.trim();
        enabledCheckers = enabledCheckers == null ? null : Set.copyOf(enabledCheckers);
        disabledCheckers = disabledCheckers == null ? Set.of() : Set.copyOf(disabledCheckers);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static GenerationOptions tagged(final String tag) {
        return new GenerationOptions(tag, null, Set.of(), Map.of());
    }

    public DetectionStatus.CheckerState checkerState(final String checkerId) {
        if (disabledCheckers.contains(checkerId)) {
            return DetectionStatus.CheckerState.DISABLED;
        }
        if (enabledCheckers == null) {
            return DetectionStatus.CheckerState.UNKNOWN;
        }
        return enabledCheckers.contains(checkerId)
                ? DetectionStatus.CheckerState.ENABLED
                : DetectionStatus.CheckerState.NOT_ENABLED;
    }
}
