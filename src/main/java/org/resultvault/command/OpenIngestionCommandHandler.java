package org.resultvault.command;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.resultvault.engine.GenerationOptions;
import org.resultvault.ingest.IngestionCoordinator;
import org.resultvault.ingest.IngestionOptions;
import org.resultvault.ingest.IngestionSession;
import org.resultvault.ingest.SkipList;

/**
 * {@code {openIngestion: <run>, tag, expectedSubmissions, enabledCheckers, disabledCheckers, skipList, metadata}}.
 */
final class OpenIngestionCommandHandler implements CommandHandler {
    private final IngestionCoordinator coordinator;
    private final Supplier<String> connectionId;

    OpenIngestionCommandHandler(final IngestionCoordinator coordinator, final Supplier<String> connectionId) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        final String runName = CommandArguments.commandValueText(command);
        final Set<String> enabled = CommandArguments.optionalStringSet(command, "enabledCheckers");
        final Set<String> disabled = CommandArguments.optionalStringSet(command, "disabledCheckers");
        final GenerationOptions generation = new GenerationOptions(
                CommandArguments.optionalString(command, "tag"),
                enabled,
                disabled,
                CommandArguments.stringMap(command, "metadata"));
        final IngestionOptions options = new IngestionOptions(
                generation,
                CommandArguments.optionalInt(command, "expectedSubmissions"),
                skipList(command));

        final IngestionSession session = coordinator.open(runName, options, connectionId.get());
        return new BsonDocument()
                .append("sessionId", new BsonString(session.id()))
                .append("runName", new BsonString(session.runName()))
                .append("baseGeneration", new BsonInt64(session.baseGeneration()))
                .append("ok", new BsonDouble(1.0));
    }

    private static SkipList skipList(final BsonDocument command) {
        final BsonValue value = command.get("skipList");
        if (value == null || value.isNull()) {
            return SkipList.empty();
        }
        if (value.isString()) {
            return SkipList.parse(value.asString().getValue());
        }
        final List<String> lines = CommandArguments.optionalStringList(command, "skipList");
        return SkipList.parse(lines);
    }
}
