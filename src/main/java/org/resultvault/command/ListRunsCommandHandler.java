package org.resultvault.command;

import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.resultvault.engine.ReportStore;
import org.resultvault.engine.Run;

final class ListRunsCommandHandler implements CommandHandler {
    private final ReportStore store;

    ListRunsCommandHandler(final ReportStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        final BsonArray runs = new BsonArray();
        for (final Run run : store.runs()) {
            runs.add(ReportDocuments.run(run));
        }
        return new BsonDocument()
                .append("runs", runs)
                .append("ok", new BsonDouble(1.0));
    }
}
