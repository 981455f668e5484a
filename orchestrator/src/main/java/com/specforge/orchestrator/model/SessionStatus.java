package com.specforge.orchestrator.model;

/**
 * States of one generation Session.
 *
 * Transitions (happy path):
 *   PENDING → ANALYZING → GENERATING → AGGREGATING → COMPLETED
 *
 * Any non-terminal state can transition to FAILED (unrecoverable error or
 * cancellation). FAILED and COMPLETED are terminal; nothing moves out of them.
 */
public enum SessionStatus {
    PENDING,
    ANALYZING,
    GENERATING,
    AGGREGATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * True if {@code next} is the single forward step from this state,
     * or FAILED from any non-terminal state.
     */
    public boolean canTransitionTo(SessionStatus next) {
        if (isTerminal()) return false;
        if (next == FAILED) return true;
        return next.ordinal() == ordinal() + 1;
    }
}
