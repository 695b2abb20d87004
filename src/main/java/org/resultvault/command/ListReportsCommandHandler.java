package org.resultvault.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonValue;
import org.resultvault.engine.Report;
import org.resultvault.engine.ReportStore;
import org.resultvault.query.Deduplicator;
import org.resultvault.query.ReportEntry;

/**
 * {@code {listReports: <run> | [<run>, ...], tag, unique, activeOnly, stableOrder}}.
 *
 * <p>Entries are always deduplicated per compilation unit; {@code unique} collapses them per fingerprint across
 * every listed run.
 */
final class ListReportsCommandHandler implements CommandHandler {
    private final ReportStore store;
    private final Deduplicator deduplicator;

    ListReportsCommandHandler(final ReportStore store, final Deduplicator deduplicator) {
        this.store = Objects.requireNonNull(store, "store");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        final List<String> runNames = runNames(command);
        final String tag = CommandArguments.optionalString(command, "tag");
        final boolean unique = CommandArguments.optionalBoolean(command, "unique", false);
        final boolean activeOnly = CommandArguments.optionalBoolean(command, "activeOnly", false);
        final boolean stableOrder = CommandArguments.optionalBoolean(command, "stableOrder", false);

        List<ReportEntry> entries = new ArrayList<>();
        for (final String runName : runNames) {
            final List<Report> reports = tag == null ? store.reports(runName) : store.openReportsAt(runName, tag);
            final List<Report> listed = new ArrayList<>();
            for (final Report report : reports) {
                if (!activeOnly || report.isActive()) {
                    listed.add(report);
                }
            }
            entries.addAll(deduplicator.deduplicate(runName, listed));
        }
        if (unique) {
            entries = deduplicator.unique(entries);
        }
        if (stableOrder) {
            entries.sort(ReportEntry.BY_LOCATION);
        }
        return new BsonDocument()
                .append("reports", ReportDocuments.entries(entries))
                .append("count", new BsonInt32(entries.size()))
                .append("ok", new BsonDouble(1.0));
    }

    private static List<String> runNames(final BsonDocument command) {
        final BsonValue value = command.get(command.getFirstKey());
        if (value.isString()) {
            return List.of(CommandArguments.commandValueText(command));
        }
        if (!value.isArray()) {
            throw new CommandArgumentException("listReports must be a run name or an array of run names");
        }
        final List<String> names = new ArrayList<>();
        for (final BsonValue item : value.asArray()) {
            if (!item.isString()) {
                throw new CommandArgumentException("listReports must be a run name or an array of run names");
            }
            names.add(item.asString().getValue());
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("listReports needs at least one run name");
        }
        return names;
    }
}
