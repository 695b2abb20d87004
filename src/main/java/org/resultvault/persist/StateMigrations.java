package org.resultvault.persist;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDateTime;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.bson.BsonValue;

/**
 * Ordered chain of state schema upgrades.
 *
 * <ul>
 *   <li>v1 kept the review status on every report row of every run.</li>
 *   <li>v2 moved review decisions into one table keyed by fingerprint and added identity confidence and run
 *       metadata.</li>
 *   <li>v3 added the per-run commit log and per-report occurrences.</li>
 * </ul>
 */
final class StateMigrations {
    private static final List<SchemaMigration> CHAIN = List.of(new ReviewTable(), new CommitLog());

    private StateMigrations() {}

    static BsonDocument upgrade(final BsonDocument state, final int fromVersion, final int toVersion) {
        Objects.requireNonNull(state, "state");
        BsonDocument current = state;
        for (int version = fromVersion; version < toVersion; version++) {
            current = migrationFrom(version).apply(current.clone());
            current.put(StateCodec.SCHEMA_VERSION, new BsonInt32(version + 1));
        }
        return current;
    }

    private static SchemaMigration migrationFrom(final int version) {
        for (final SchemaMigration migration : CHAIN) {
            if (migration.fromVersion() == version) {
                return migration;
            }
        }
        throw new IllegalStateException("no migration from state schema version " + version);
    }

    /** v1 to v2. */
    private static final class ReviewTable implements SchemaMigration {
        @Override
        public int fromVersion() {
            return 1;
        }

        @Override
        public BsonDocument apply(final BsonDocument state) {
            final Map<String, BsonDocument> reviews = new LinkedHashMap<>();
            for (final BsonValue runValue : state.getArray("runs", new BsonArray())) {
                final BsonDocument run = runValue.asDocument();
                final BsonDateTime createdAt = run.getDateTime("createdAt");
                for (final BsonValue reportValue : run.getArray("reports", new BsonArray())) {
                    final BsonDocument report = reportValue.asDocument();
                    final BsonValue status = report.remove("reviewStatus");
                    final BsonValue author = report.remove("reviewAuthor");
                    final BsonValue message = report.remove("reviewMessage");
                    if (!report.containsKey("confidence")) {
                        report.put("confidence", new BsonString("SCOPED"));
                    }
                    if (status == null || !status.isString() || "UNREVIEWED".equals(status.asString().getValue())) {
                        continue;
                    }
                    final String fingerprint = report.getString("fingerprint").getValue();
                    reviews.putIfAbsent(fingerprint, new BsonDocument()
                            .append("fingerprint", new BsonString(fingerprint))
                            .append("status", status)
                            .append("author", author == null ? new BsonString("") : author)
                            .append("message", message == null ? new BsonString("") : message)
                            .append("date", createdAt)
                            .append("origin", new BsonString("USER")));
                }
                if (!run.containsKey("metadata")) {
                    run.put("metadata", new BsonDocument());
                }
            }
            state.put("reviews", new BsonArray(List.copyOf(reviews.values())));
            return state;
        }
    }

    /** v2 to v3. */
    private static final class CommitLog implements SchemaMigration {
        @Override
        public int fromVersion() {
            return 2;
        }

        @Override
        public BsonDocument apply(final BsonDocument state) {
            for (final BsonValue runValue : state.getArray("runs", new BsonArray())) {
                final BsonDocument run = runValue.asDocument();
                final BsonValue generation = run.remove("generation");
                final BsonDocument statusCounts = new BsonDocument();
                final BsonArray open = new BsonArray();
                for (final BsonValue reportValue : run.getArray("reports", new BsonArray())) {
                    final BsonDocument report = reportValue.asDocument();
                    final String status = report.getString("detectionStatus").getValue();
                    final int count = statusCounts.getInt32(status, new BsonInt32(0)).getValue();
                    statusCounts.put(status, new BsonInt32(count + 1));
                    if ("NEW".equals(status) || "UNRESOLVED".equals(status) || "REOPENED".equals(status)) {
                        open.add(report.get("fingerprint"));
                    }
                    if (!report.containsKey("occurrences")) {
                        final BsonDocument file = report.getDocument("file");
                        report.put("occurrences", new BsonArray(List.of(new BsonDocument()
                                .append("compilationUnit", file.get("path"))
                                .append("file", file.get("path"))
                                .append("line", report.get("line"))
                                .append("column", report.get("column")))));
                    }
                }
                if (run.containsKey("history")) {
                    continue;
                }
                final long number = generation == null || !generation.isNumber()
                        ? 1L
                        : Math.max(1L, generation.asNumber().longValue());
                run.put("history", new BsonArray(List.of(new BsonDocument()
                        .append("generation", new BsonInt64(number))
                        .append("committedAt", run.get("createdAt"))
                        .append("statusCounts", statusCounts)
                        .append("disabledCheckers", new BsonArray())
                        .append("submissions", new BsonInt32(0))
                        .append("openFingerprints", open))));
            }
            return state;
        }
    }
}
