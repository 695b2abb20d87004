package org.resultvault.ingest;

/**
 * Acknowledgement of one chunk. {@code staged} counts findings staged into the generation when the chunk
 * completed its submission and is zero otherwise.
 */
public record SubmissionReceipt(String submissionId, boolean complete, int bufferedFindings, int staged) {}
