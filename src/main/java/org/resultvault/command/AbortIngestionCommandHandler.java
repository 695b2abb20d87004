package org.resultvault.command;

import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.resultvault.ingest.IngestionCoordinator;

final class AbortIngestionCommandHandler implements CommandHandler {
    private final IngestionCoordinator coordinator;

    AbortIngestionCommandHandler(final IngestionCoordinator coordinator) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        coordinator.abort(CommandArguments.commandValueText(command));
        return new BsonDocument("ok", new BsonDouble(1.0));
    }
}
