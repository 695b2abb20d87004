package org.resultvault.command;

import java.time.Clock;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.resultvault.engine.ReportStore;
import org.resultvault.engine.ReviewDecision;
import org.resultvault.engine.ReviewStatus;
import org.resultvault.identity.Fingerprint;

/**
 * {@code {setReviewStatus: <fingerprint>, status, author, message}}. The decision applies to the fingerprint in
 * every run and overrides any decision read from a source comment.
 */
final class SetReviewStatusCommandHandler implements CommandHandler {
    private final ReportStore store;
    private final Clock clock;

    SetReviewStatusCommandHandler(final ReportStore store, final Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public BsonDocument handle(final BsonDocument command) {
        final String fingerprint = CommandArguments.commandValueText(command);
        if (!Fingerprint.isWellFormed(fingerprint)) {
            return CommandErrors.badValue("malformed fingerprint: " + fingerprint);
        }
        final ReviewStatus status = ReviewStatus.parse(CommandArguments.requireString(command, "status"));
        final ReviewDecision decision = ReviewDecision.byUser(
                status,
                CommandArguments.optionalString(command, "author"),
                CommandArguments.optionalString(command, "message"),
                clock.instant());
        store.setReviewStatus(fingerprint, decision);
        return new BsonDocument()
                .append("review", ReportDocuments.review(fingerprint, decision))
                .append("ok", new BsonDouble(1.0));
    }
}
