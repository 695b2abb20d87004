package org.resultvault.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.resultvault.identity.Finding;

/**
 * Part of one submission: findings and the content of the files they point into. A submission takes effect
 * only once its chunk with {@code last} set arrives.
 */
public record SubmissionChunk(List<Finding> findings, Map<String, byte[]> sources, boolean last) {
    public SubmissionChunk {
        findings = findings == null ? List.of() : List.copyOf(findings);
        sources = sources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    public static SubmissionChunk complete(final List<Finding> findings, final Map<String, byte[]> sources) {
        return new SubmissionChunk(findings, sources, true);
    }
}
