package org.resultvault.ingest;

import java.util.Objects;
import org.resultvault.engine.GenerationOptions;

/**
 * @param expectedSubmissions number of submissions the orchestrating caller will send, or {@code null} when
 *     only the explicit finalize signal counts
 */
public record IngestionOptions(GenerationOptions generation, Integer expectedSubmissions, SkipList skipList) {
    public static final IngestionOptions DEFAULT = new IngestionOptions(GenerationOptions.DEFAULT, null, null);

    public IngestionOptions {
        Objects.requireNonNull(generation, "generation");
        if (expectedSubmissions != null && expectedSubmissions < 0) {
            throw new IllegalArgumentException("expectedSubmissions must not be negative: " + expectedSubmissions);
        }
        skipList = skipList == null ? SkipList.empty() : skipList;
    }

    public static IngestionOptions expecting(final int expectedSubmissions) {
        return new IngestionOptions(GenerationOptions.DEFAULT, expectedSubmissions, null);
    }
}
