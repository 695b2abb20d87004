package org.resultvault.engine;

/**
 * Receives the complete store state a change is about to publish.
 *
 * <p>Called before the change becomes visible, with changes serialized. A journal that throws vetoes the change:
 * the store stays as it was and the exception reaches the caller.
 */
@FunctionalInterface
public interface StateJournal {
    StateJournal NONE = state -> { };

    void write(ReportStoreState state);
}
