package org.resultvault.command;

import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.resultvault.ingest.IngestionCoordinator;
import org.resultvault.ingest.IngestionResult;

final class FinalizeIngestionCommandHandler implements CommandHandler {
    private final IngestionCoordinator coordinator;

    FinalizeIngestionCommandHandler(final IngestionCoordinator coordinator) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        final IngestionResult result = coordinator.finalize(CommandArguments.commandValueText(command));
        return ReportDocuments.commit(result.commit())
                .append("submissions", new BsonInt32(result.submissions()))
                .append("staged", new BsonInt32(result.staged()))
                .append("skippedUnknownSource", new BsonInt32(result.skippedUnknownSource()))
                .append("skippedByList", new BsonInt32(result.skippedByList()))
                .append("ok", new BsonDouble(1.0));
    }
}
