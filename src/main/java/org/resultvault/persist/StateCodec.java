package org.resultvault.persist;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.bson.BsonArray;
import org.bson.BsonDateTime;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.resultvault.blob.BlobId;
import org.resultvault.blob.SourceFile;
import org.resultvault.engine.DetectionStatus;
import org.resultvault.engine.Occurrence;
import org.resultvault.engine.Report;
import org.resultvault.engine.ReportStoreState;
import org.resultvault.engine.ReviewDecision;
import org.resultvault.engine.ReviewStatus;
import org.resultvault.engine.RunGeneration;
import org.resultvault.engine.RunState;
import org.resultvault.identity.BugPathStep;
import org.resultvault.identity.IdentityConfidence;
import org.resultvault.identity.Severity;

/**
 * Converts report store state to and from the extended-JSON document kept in {@code state.json}.
 *
 * <p>Older documents are upgraded through {@link StateMigrations} on read; documents from a newer schema are
 * refused.
 */
public final class StateCodec {
    public static final int CURRENT_SCHEMA_VERSION = 3;
    static final String SCHEMA_VERSION = "schemaVersion";

    private static final JsonWriterSettings JSON_SETTINGS =
            JsonWriterSettings.builder().outputMode(JsonMode.EXTENDED).indent(true).build();

    public String toJson(final ReportStoreState state) {
        return encode(state).toJson(JSON_SETTINGS);
    }

    public ReportStoreState fromJson(final String json) {
        return decode(BsonDocument.parse(json));
    }

    public BsonDocument encode(final ReportStoreState state) {
        final BsonArray runs = new BsonArray();
        for (final RunState run : state.runs()) {
            runs.add(encodeRun(run));
        }
        return new BsonDocument()
                .append(SCHEMA_VERSION, new BsonInt32(CURRENT_SCHEMA_VERSION))
                .append("runs", runs)
                .append("reviews", encodeReviews(state.reviews()))
                .append("shadowedReviews", encodeReviews(state.shadowedReviews()));
    }

    /**
     * @throws SchemaVersionMismatchException when the document was written by a newer schema
     * @throws IllegalArgumentException when the document is not a report store state
     */
    public ReportStoreState decode(final BsonDocument document) {
        final BsonValue versionValue = document.get(SCHEMA_VERSION);
        if (versionValue == null || !versionValue.isNumber()) {
            throw new IllegalArgumentException("state document has no numeric " + SCHEMA_VERSION);
        }
        final int version = versionValue.asNumber().intValue();
        if (version > CURRENT_SCHEMA_VERSION) {
            throw new SchemaVersionMismatchException(version, CURRENT_SCHEMA_VERSION);
        }
        if (version < 1) {
            throw new IllegalArgumentException("invalid state schema version " + version);
        }
        final BsonDocument current = StateMigrations.upgrade(document, version, CURRENT_SCHEMA_VERSION);

        final Map<String, ReviewDecision> reviews = decodeReviews(current.getArray("reviews", new BsonArray()));
        final List<RunState> runs = new ArrayList<>();
        for (final BsonValue value : current.getArray("runs", new BsonArray())) {
            runs.add(decodeRun(value.asDocument(), reviews));
        }
        return new ReportStoreState(
                runs, reviews, decodeReviews(current.getArray("shadowedReviews", new BsonArray())));
    }

    private static BsonArray encodeReviews(final Map<String, ReviewDecision> reviews) {
        final BsonArray array = new BsonArray();
        for (final Map.Entry<String, ReviewDecision> review : new TreeMap<>(reviews).entrySet()) {
            array.add(encodeReview(review.getKey(), review.getValue()));
        }
        return array;
    }

    private static Map<String, ReviewDecision> decodeReviews(final BsonArray array) {
        final Map<String, ReviewDecision> reviews = new LinkedHashMap<>();
        for (final BsonValue value : array) {
            final BsonDocument review = value.asDocument();
            reviews.put(review.getString("fingerprint").getValue(), decodeReview(review));
        }
        return reviews;
    }

    private static BsonDocument encodeRun(final RunState run) {
        final BsonDocument metadata = new BsonDocument();
        new TreeMap<>(run.metadata()).forEach((key, value) -> metadata.append(key, new BsonString(value)));
        final BsonArray history = new BsonArray();
        for (final RunGeneration generation : run.history()) {
            history.add(encodeGeneration(generation));
        }
        final BsonArray reports = new BsonArray();
        for (final Report report : run.reports().values()) {
            reports.add(encodeReport(report));
        }
        return new BsonDocument()
                .append("name", new BsonString(run.name()))
                .append("createdAt", dateTime(run.createdAt()))
                .append("metadata", metadata)
                .append("history", history)
                .append("reports", reports);
    }

    private static RunState decodeRun(final BsonDocument run, final Map<String, ReviewDecision> reviews) {
        final Map<String, String> metadata = new LinkedHashMap<>();
        run.getDocument("metadata", new BsonDocument())
                .forEach((key, value) -> metadata.put(key, value.asString().getValue()));
        final List<RunGeneration> history = new ArrayList<>();
        for (final BsonValue value : run.getArray("history")) {
            history.add(decodeGeneration(value.asDocument()));
        }
        final Map<String, Report> reports = new TreeMap<>();
        for (final BsonValue value : run.getArray("reports", new BsonArray())) {
            final Report report = decodeReport(value.asDocument(), reviews);
            reports.put(report.fingerprint(), report);
        }
        return new RunState(
                run.getString("name").getValue(),
                instant(run.get("createdAt")),
                metadata,
                history,
                reports);
    }

    private static BsonDocument encodeGeneration(final RunGeneration generation) {
        final BsonDocument counts = new BsonDocument();
        for (final DetectionStatus status : DetectionStatus.values()) {
            final int count = generation.count(status);
            if (count > 0) {
                counts.append(status.name(), new BsonInt32(count));
            }
        }
        final BsonDocument document = new BsonDocument()
                .append("generation", new BsonInt64(generation.generation()))
                .append("tag", generation.tag() == null ? BsonNull.VALUE : new BsonString(generation.tag()))
                .append("committedAt", dateTime(generation.committedAt()))
                .append("statusCounts", counts);
        if (generation.enabledCheckers() != null) {
            document.append("enabledCheckers", strings(generation.enabledCheckers()));
        }
        return document
                .append("disabledCheckers", strings(generation.disabledCheckers()))
                .append("submissions", new BsonInt32(generation.submissions()))
                .append("openFingerprints", strings(generation.openFingerprints()));
    }

    private static RunGeneration decodeGeneration(final BsonDocument document) {
        final Map<DetectionStatus, Integer> counts = new EnumMap<>(DetectionStatus.class);
        document.getDocument("statusCounts", new BsonDocument())
                .forEach((key, value) -> counts.put(DetectionStatus.valueOf(key), value.asNumber().intValue()));
        return new RunGeneration(
                document.get("generation").asNumber().longValue(),
                optionalString(document, "tag"),
                instant(document.get("committedAt")),
                counts,
                document.containsKey("enabledCheckers") ? stringSet(document.getArray("enabledCheckers")) : null,
                stringSet(document.getArray("disabledCheckers", new BsonArray())),
                document.getInt32("submissions", new BsonInt32(0)).getValue(),
                stringSet(document.getArray("openFingerprints", new BsonArray())));
    }

    private static BsonDocument encodeReport(final Report report) {
        final BsonArray bugPath = new BsonArray();
        for (final BugPathStep step : report.bugPath()) {
            bugPath.add(new BsonDocument()
                    .append("file", new BsonString(step.filePath()))
                    .append("line", new BsonInt32(step.line()))
                    .append("column", new BsonInt32(step.column()))
                    .append("message", new BsonString(step.message())));
        }
        final BsonArray occurrences = new BsonArray();
        for (final Occurrence occurrence : report.occurrences()) {
            occurrences.add(new BsonDocument()
                    .append("compilationUnit", new BsonString(occurrence.compilationUnit()))
                    .append("file", new BsonString(occurrence.filePath()))
                    .append("line", new BsonInt32(occurrence.line()))
                    .append("column", new BsonInt32(occurrence.column())));
        }
        return new BsonDocument()
                .append("fingerprint", new BsonString(report.fingerprint()))
                .append("confidence", new BsonString(report.confidence().name()))
                .append("checkerId", new BsonString(report.checkerId()))
                .append("severity", new BsonString(report.severity().name()))
                .append("message", new BsonString(report.message()))
                .append("file", new BsonDocument()
                        .append("path", new BsonString(report.file().path()))
                        .append("blobId", new BsonString(report.file().blobId().value())))
                .append("line", new BsonInt32(report.line()))
                .append("column", new BsonInt32(report.column()))
                .append("bugPath", bugPath)
                .append("occurrences", occurrences)
                .append("detectionStatus", new BsonString(report.detectionStatus().name()))
                .append("detectedAtGeneration", new BsonInt64(report.detectedAtGeneration()))
                .append("detectedAt", dateTime(report.detectedAt()))
                .append("fixedAtGeneration", report.fixedAtGeneration() == null
                        ? BsonNull.VALUE
                        : new BsonInt64(report.fixedAtGeneration()))
                .append("fixedAt", report.fixedAt() == null ? BsonNull.VALUE : dateTime(report.fixedAt()));
    }

    private static Report decodeReport(final BsonDocument document, final Map<String, ReviewDecision> reviews) {
        final String fingerprint = document.getString("fingerprint").getValue();
        final BsonDocument file = document.getDocument("file");
        final List<BugPathStep> bugPath = new ArrayList<>();
        for (final BsonValue value : document.getArray("bugPath", new BsonArray())) {
            final BsonDocument step = value.asDocument();
            bugPath.add(new BugPathStep(
                    step.getString("file").getValue(),
                    step.get("line").asNumber().intValue(),
                    step.get("column").asNumber().intValue(),
                    optionalString(step, "message")));
        }
        final List<Occurrence> occurrences = new ArrayList<>();
        for (final BsonValue value : document.getArray("occurrences", new BsonArray())) {
            final BsonDocument occurrence = value.asDocument();
            occurrences.add(new Occurrence(
                    occurrence.getString("compilationUnit").getValue(),
                    occurrence.getString("file").getValue(),
                    occurrence.get("line").asNumber().intValue(),
                    occurrence.get("column").asNumber().intValue()));
        }
        final BsonValue fixedAtGeneration = document.get("fixedAtGeneration");
        final BsonValue fixedAt = document.get("fixedAt");
        return new Report(
                fingerprint,
                IdentityConfidence.valueOf(document.getString("confidence").getValue()),
                document.getString("checkerId").getValue(),
                Severity.parse(optionalString(document, "severity")),
                optionalString(document, "message"),
                new SourceFile(file.getString("path").getValue(), new BlobId(file.getString("blobId").getValue())),
                document.get("line").asNumber().intValue(),
                document.get("column").asNumber().intValue(),
                bugPath,
                occurrences,
                DetectionStatus.valueOf(document.getString("detectionStatus").getValue()),
                reviews.get(fingerprint),
                document.get("detectedAtGeneration").asNumber().longValue(),
                instant(document.get("detectedAt")),
                fixedAtGeneration == null || fixedAtGeneration.isNull()
                        ? null
                        : fixedAtGeneration.asNumber().longValue(),
                fixedAt == null || fixedAt.isNull() ? null : instant(fixedAt));
    }

    private static BsonDocument encodeReview(final String fingerprint, final ReviewDecision review) {
        return new BsonDocument()
                .append("fingerprint", new BsonString(fingerprint))
                .append("status", new BsonString(review.status().name()))
                .append("author", new BsonString(review.author()))
                .append("message", new BsonString(review.message()))
                .append("date", dateTime(review.date()))
                .append("origin", new BsonString(review.origin().name()));
    }

    private static ReviewDecision decodeReview(final BsonDocument document) {
        return new ReviewDecision(
                ReviewStatus.parse(document.getString("status").getValue()),
                optionalString(document, "author"),
                optionalString(document, "message"),
                instant(document.get("date")),
                ReviewDecision.Origin.valueOf(document.getString("origin", new BsonString("USER")).getValue()));
    }

    private static BsonArray strings(final Set<String> values) {
        final BsonArray array = new BsonArray();
        values.stream().sorted().forEach(value -> array.add(new BsonString(value)));
        return array;
    }

    private static Set<String> stringSet(final BsonArray array) {
        final Set<String> values = new LinkedHashSet<>();
        for (final BsonValue value : array) {
            values.add(value.asString().getValue());
        }
        return values;
    }

    private static String optionalString(final BsonDocument document, final String key) {
        final BsonValue value = document.get(key);
        return value == null || value.isNull() ? null : value.asString().getValue();
    }

    private static BsonDateTime dateTime(final Instant instant) {
        return new BsonDateTime(instant.toEpochMilli());
    }

    private static Instant instant(final BsonValue value) {
        if (value == null || !value.isDateTime()) {
            throw new IllegalArgumentException("expected a date value but found " + value);
        }
        return Instant.ofEpochMilli(value.asDateTime().getValue());
    }
}
