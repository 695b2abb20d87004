package org.resultvault.command;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.resultvault.blob.SourceBlobStore;
import org.resultvault.identity.Finding;
import org.resultvault.identity.Fingerprint;
import org.resultvault.identity.FingerprintCalculator;
import org.resultvault.identity.SourceText;
import org.resultvault.query.DiffEngine;
import org.resultvault.query.DiffMode;
import org.resultvault.query.DiffOptions;
import org.resultvault.query.ReportCollection;
import org.resultvault.query.ReportEntry;

/**
 * {@code {diff: "new"|"resolved"|"unresolved", baseline: <side>, newSet: <side>, unique, stableOrder}}.
 *
 * <p>A side is either a stored run, {@code {run: <name>, tag: <tag>}}, or a transient collection,
 * {@code {reports: [...], sources: [{path, content}]}}. Transient reports carrying a {@code fingerprint} are
 * used as given; the others are fingerprinted against the sources sent along or the latest stored content of
 * their file.
 */
final class DiffCommandHandler implements CommandHandler {
    private final DiffEngine diffEngine;
    private final FingerprintCalculator calculator;
    private final SourceBlobStore blobs;

    DiffCommandHandler(
            final DiffEngine diffEngine, final FingerprintCalculator calculator, final SourceBlobStore blobs) {
        this.diffEngine = Objects.requireNonNull(diffEngine, "diffEngine");
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.blobs = Objects.requireNonNull(blobs, "blobs");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        final DiffMode mode = DiffMode.parse(CommandArguments.commandValueText(command));
        final ReportCollection baseline = side(command, "baseline");
        final ReportCollection newSet = side(command, "newSet");
        final DiffOptions options = new DiffOptions(
                CommandArguments.optionalBoolean(command, "unique", false),
                CommandArguments.optionalBoolean(command, "stableOrder", false));

        final List<ReportEntry> entries = diffEngine.diff(baseline, newSet, mode, options);
        return new BsonDocument()
                .append("mode", new BsonString(mode.name().toLowerCase(Locale.ROOT)))
                .append("reports", ReportDocuments.entries(entries))
                .append("count", new BsonInt32(entries.size()))
                .append("ok", new BsonDouble(1.0));
    }

    private ReportCollection side(final BsonDocument command, final String field) {
        final BsonDocument side = CommandArguments.optionalDocument(command, field);
        if (side == null) {
            throw new CommandArgumentException(field + " must be a document");
        }
        final String runName = CommandArguments.optionalString(side, "run");
        if (runName != null) {
            final String tag = CommandArguments.optionalString(side, "tag");
            return tag == null ? ReportCollection.stored(runName) : ReportCollection.stored(runName, tag);
        }
        if (!side.containsKey("reports")) {
            throw new IllegalArgumentException(field + " must name a run or carry reports");
        }

        final Map<String, byte[]> sources = new HashMap<>();
        for (final BsonDocument source : CommandArguments.documentList(side, "sources")) {
            sources.put(CommandArguments.requireString(source, "path"), CommandArguments.content(source, "content"));
        }
        final Map<String, SourceText> decoded = new HashMap<>();
        final List<ReportEntry> entries = new ArrayList<>();
        for (final BsonDocument report : CommandArguments.documentList(side, "reports")) {
            final Finding finding = ReportDocuments.finding(report);
            final String given = CommandArguments.optionalString(report, "fingerprint");
            if (given != null && !Fingerprint.isWellFormed(given)) {
                throw new IllegalArgumentException("malformed fingerprint: " + given);
            }
            final String fingerprint = given != null
                    ? given
                    : fingerprint(finding, decoded.computeIfAbsent(finding.filePath(), path -> source(path, sources)));
            entries.add(ReportEntry.transientEntry(
                    fingerprint,
                    finding.checkerId(),
                    finding.filePath(),
                    finding.line(),
                    finding.column(),
                    finding.severity(),
                    finding.message(),
                    finding.compilationUnit()));
        }
        return ReportCollection.transientOf(entries);
    }

    private String fingerprint(final Finding finding, final SourceText source) {
        final Fingerprint fingerprint = calculator.compute(finding, source);
        return fingerprint.value();
    }

    private SourceText source(final String path, final Map<String, byte[]> sources) {
        final byte[] sent = sources.get(path);
        if (sent != null) {
            return SourceText.decode(sent);
        }
        return blobs.latest(path)
                .map(blobId -> SourceText.decode(blobs.get(blobId)))
                .orElseThrow(() -> new IllegalArgumentException("no source content known for " + path));
    }
}
