package org.resultvault.command;

import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.resultvault.engine.ReportStore;
import org.resultvault.engine.Run;
import org.resultvault.engine.RunNotFoundException;

final class GetRunCommandHandler implements CommandHandler {
    private final ReportStore store;

    GetRunCommandHandler(final ReportStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        final String runName = CommandArguments.commandValueText(command);
        final Run run = store.run(runName).orElseThrow(() -> new RunNotFoundException(runName));
        return new BsonDocument()
                .append("run", ReportDocuments.run(run))
                .append("ok", new BsonDouble(1.0));
    }
}
