package com.specforge.orchestrator.model;

/**
 * Execution state of a single FileResult inside the per-file pipeline.
 *
 * Declaration order is the precedence order: a file only ever moves forward.
 * FIXING and PUBLISHING are conditional and may be skipped; ERRORED can be
 * entered from any non-terminal state.
 *
 *   GENERATING → ANALYZING → [FIXING] → PERSISTING → [PUBLISHING] → DONE
 */
public enum FileState {
    GENERATING,
    ANALYZING,
    FIXING,
    PERSISTING,
    PUBLISHING,
    DONE,
    ERRORED;

    public boolean isTerminal() {
        return this == DONE || this == ERRORED;
    }

    public boolean canAdvanceTo(FileState next) {
        if (isTerminal()) return false;
        if (next == ERRORED) return true;
        return next.ordinal() > ordinal();
    }
}
