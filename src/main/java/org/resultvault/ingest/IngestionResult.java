package org.resultvault.ingest;

import java.util.Objects;
import org.resultvault.engine.CommitResult;

/**
 * Outcome of a finalized ingestion.
 *
 * @param skippedUnknownSource findings dropped because no content was ever stored for their file
 * @param skippedByList findings dropped by the skip list
 */
public record IngestionResult(
        CommitResult commit, int submissions, int staged, int skippedUnknownSource, int skippedByList) {
    public IngestionResult {
        Objects.requireNonNull(commit, "commit");
    }
}
