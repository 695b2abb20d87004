package org.resultvault.command;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.resultvault.identity.Finding;
import org.resultvault.ingest.IngestionCoordinator;
import org.resultvault.ingest.SubmissionChunk;
import org.resultvault.ingest.SubmissionReceipt;

/**
 * {@code {submitResults: <sessionId>, submissionId, last, findings: [...], sources: [{path, content}]}}.
 *
 * <p>A submission may be split over several commands sharing a {@code submissionId}; only the one sent with
 * {@code last: true} (the default) makes it visible to the generation.
 */
final class SubmitResultsCommandHandler implements CommandHandler {
    private final IngestionCoordinator coordinator;
    private final Supplier<String> connectionId;

    SubmitResultsCommandHandler(final IngestionCoordinator coordinator, final Supplier<String> connectionId) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        final String sessionId = CommandArguments.commandValueText(command);
        final String submissionId = CommandArguments.requireString(command, "submissionId");
        final boolean last = CommandArguments.optionalBoolean(command, "last", true);

        final List<Finding> findings = new ArrayList<>();
        for (final BsonDocument finding : CommandArguments.documentList(command, "findings")) {
            findings.add(ReportDocuments.finding(finding));
        }
        final Map<String, byte[]> sources = new LinkedHashMap<>();
        for (final BsonDocument source : CommandArguments.documentList(command, "sources")) {
            sources.put(CommandArguments.requireString(source, "path"), CommandArguments.content(source, "content"));
        }

        final SubmissionReceipt receipt = coordinator.submit(
                sessionId, submissionId, connectionId.get(), new SubmissionChunk(findings, sources, last));
        return new BsonDocument()
                .append("submissionId", new BsonString(receipt.submissionId()))
                .append("complete", BsonBoolean.valueOf(receipt.complete()))
                .append("bufferedFindings", new BsonInt32(receipt.bufferedFindings()))
                .append("staged", new BsonInt32(receipt.staged()))
                .append("ok", new BsonDouble(1.0));
    }
}
