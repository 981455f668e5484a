package com.specforge.orchestrator.events;

import com.specforge.orchestrator.model.SessionStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted after every persisted session status transition.
 *
 * @param summary short human-readable note (file counts, error message)
 */
public record SessionEvent(UUID sessionId, SessionStatus status, String summary, Instant at) {

    public static SessionEvent of(UUID sessionId, SessionStatus status, String summary) {
        return new SessionEvent(sessionId, status, summary, Instant.now());
    }
}
