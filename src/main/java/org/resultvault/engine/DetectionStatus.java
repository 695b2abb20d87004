package org.resultvault.engine;

/**
 * Lifecycle state of a fingerprint within a run.
 */
public enum DetectionStatus {
    NEW,
    UNRESOLVED,
    RESOLVED,
    REOPENED,
    OFF,
    UNAVAILABLE;

    public boolean isActive() {
        return this == NEW || this == UNRESOLVED || this == REOPENED;
    }

    /**
     * Status of a fingerprint present in the new generation, given its status in the previous one
     * ({@code null} when the run never saw it). Only a resolved fingerprint reopens; one that was switched off
     * or unavailable comes back as unresolved.
     */
    public static DetectionStatus present(final DetectionStatus previous) {
        if (previous == null) {
            return NEW;
        }
        return switch (previous) {
            case RESOLVED -> REOPENED;
            case NEW, UNRESOLVED, REOPENED, OFF, UNAVAILABLE -> UNRESOLVED;
        };
    }

    /**
     * Status of a fingerprint missing from the new generation. Inactive fingerprints keep their status.
     */
    public static DetectionStatus absent(final DetectionStatus previous, final CheckerState checkerState) {
        if (!previous.isActive()) {
            return previous;
        }
        return switch (checkerState) {
            case DISABLED -> OFF;
            case NOT_ENABLED -> UNAVAILABLE;
            case ENABLED, UNKNOWN -> RESOLVED;
        };
    }

    /**
     * How the generation being committed configured the checker of a vanished fingerprint.
     */
    public enum CheckerState {
        ENABLED,
        DISABLED,
        NOT_ENABLED,
        UNKNOWN
    }
}
