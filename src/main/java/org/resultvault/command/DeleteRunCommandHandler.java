package org.resultvault.command;

import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonString;
import org.resultvault.engine.ReportStore;

final class DeleteRunCommandHandler implements CommandHandler {
    private final ReportStore store;

    DeleteRunCommandHandler(final ReportStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        final String runName = CommandArguments.commandValueText(command);
        store.deleteRun(runName);
        return new BsonDocument()
                .append("deleted", new BsonString(runName))
                .append("ok", new BsonDouble(1.0));
    }
}
