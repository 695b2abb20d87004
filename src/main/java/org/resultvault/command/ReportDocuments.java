package org.resultvault.command;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.bson.BsonArray;
import org.bson.BsonDateTime;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.resultvault.engine.CommitResult;
import org.resultvault.engine.DetectionStatus;
import org.resultvault.engine.ReviewDecision;
import org.resultvault.engine.Run;
import org.resultvault.engine.RunGeneration;
import org.resultvault.identity.BugPathStep;
import org.resultvault.identity.Finding;
import org.resultvault.identity.Severity;
import org.resultvault.query.ReportEntry;

/**
 * BSON shapes of the documents exchanged by the query and ingestion commands.
 */
final class ReportDocuments {
    private ReportDocuments() {}

    static Finding finding(final BsonDocument document) {
        final List<BugPathStep> bugPath = new ArrayList<>();
        for (final BsonDocument step : CommandArguments.documentList(document, "bugPath")) {
            bugPath.add(new BugPathStep(
                    CommandArguments.requireString(step, "file"),
                    CommandArguments.intOrDefault(step, "line", 0),
                    CommandArguments.intOrDefault(step, "column", 0),
                    CommandArguments.optionalString(step, "message")));
        }
        final Integer line = CommandArguments.optionalInt(document, "line");
        if (line == null) {
            throw new CommandArgumentException("finding line must be an integer");
        }
        return new Finding(
                CommandArguments.requireString(document, "checkerId"),
                CommandArguments.requireString(document, "file"),
                line,
                CommandArguments.intOrDefault(document, "column", 0),
                Severity.parse(CommandArguments.optionalString(document, "severity")),
                CommandArguments.optionalString(document, "message"),
                bugPath,
                CommandArguments.optionalString(document, "enclosingScope"),
                CommandArguments.optionalString(document, "compilationUnit"));
    }

    static BsonArray entries(final List<ReportEntry> entries) {
        final BsonArray array = new BsonArray();
        for (final ReportEntry entry : entries) {
            array.add(entry(entry));
        }
        return array;
    }

    static BsonDocument entry(final ReportEntry entry) {
        final BsonDocument document = new BsonDocument()
                .append("fingerprint", new BsonString(entry.fingerprint()))
                .append("checkerId", new BsonString(entry.checkerId()))
                .append("file", new BsonString(entry.filePath()))
                .append("line", new BsonInt32(entry.line()))
                .append("column", new BsonInt32(entry.column()))
                .append("severity", new BsonString(entry.severity().name()))
                .append("message", new BsonString(entry.message()))
                .append("compilationUnit", new BsonString(entry.compilationUnit()))
                .append("reviewStatus", new BsonString(entry.reviewStatus().wireName()))
                .append("occurrences", new BsonInt32(entry.occurrences()));
        if (entry.detectionStatus() != null) {
            document.append(
                    "detectionStatus", new BsonString(entry.detectionStatus().name().toLowerCase(Locale.ROOT)));
        }
        if (entry.runName() != null) {
            document.append("runName", new BsonString(entry.runName()));
        }
        return document;
    }

    static BsonDocument run(final Run run) {
        final BsonDocument metadata = new BsonDocument();
        new TreeMap<>(run.metadata()).forEach((key, value) -> metadata.append(key, new BsonString(value)));
        final BsonArray history = new BsonArray();
        for (final RunGeneration generation : run.history()) {
            history.add(generation(generation));
        }
        return new BsonDocument()
                .append("name", new BsonString(run.name()))
                .append("generation", new BsonInt64(run.generation()))
                .append("createdAt", dateTime(run.createdAt()))
                .append("metadata", metadata)
                .append("history", history);
    }

    static BsonDocument generation(final RunGeneration generation) {
        final BsonDocument document = new BsonDocument()
                .append("generation", new BsonInt64(generation.generation()))
                .append("tag", generation.tag() == null ? BsonNull.VALUE : new BsonString(generation.tag()))
                .append("committedAt", dateTime(generation.committedAt()))
                .append("statusCounts", statusCounts(generation.statusCounts()))
                .append("submissions", new BsonInt32(generation.submissions()))
                .append("openReports", new BsonInt32(generation.openFingerprints().size()));
        if (generation.enabledCheckers() != null) {
            document.append("enabledCheckers", sortedStrings(generation.enabledCheckers()));
        }
        return document.append("disabledCheckers", sortedStrings(generation.disabledCheckers()));
    }

    static BsonDocument commit(final CommitResult commit) {
        return new BsonDocument()
                .append("runName", new BsonString(commit.runName()))
                .append("generation", new BsonInt64(commit.generation()))
                .append("tag", commit.tag() == null ? BsonNull.VALUE : new BsonString(commit.tag()))
                .append("reportCount", new BsonInt32(commit.reportCount()))
                .append("transitions", statusCounts(commit.transitions()));
    }

    static BsonDocument review(final String fingerprint, final ReviewDecision review) {
        return new BsonDocument()
                .append("fingerprint", new BsonString(fingerprint))
                .append("status", new BsonString(review.status().wireName()))
                .append("author", new BsonString(review.author()))
                .append("message", new BsonString(review.message()))
                .append("date", dateTime(review.date()))
                .append("origin", new BsonString(review.origin().name().toLowerCase(Locale.ROOT)));
    }

    private static BsonDocument statusCounts(final Map<DetectionStatus, Integer> counts) {
        final BsonDocument document = new BsonDocument();
        for (final DetectionStatus status : DetectionStatus.values()) {
            final Integer count = counts.get(status);
            if (count != null && count > 0) {
                document.append(status.name().toLowerCase(Locale.ROOT), new BsonInt32(count));
            }
        }
        return document;
    }

    private static BsonArray sortedStrings(final Iterable<String> values) {
        final List<String> sorted = new ArrayList<>();
        values.forEach(sorted::add);
        sorted.sort(null);
        final BsonArray array = new BsonArray();
        for (final String value : sorted) {
            array.add(new BsonString(value));
        }
        return array;
    }

    private static BsonDateTime dateTime(final Instant instant) {
        return new BsonDateTime(instant.toEpochMilli());
    }
}
