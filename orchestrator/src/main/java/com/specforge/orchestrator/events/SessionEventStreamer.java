package com.specforge.orchestrator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Bridges {@link SessionEventBus} subscriptions to Server-Sent Events.
 *
 * One emitter per connected viewer. The first event is the session's
 * current status. The emitter completes itself when the session reaches a
 * terminal status, and unsubscribes on completion, timeout or error.
 */
@Service
public class SessionEventStreamer {

    private static final Logger log = LoggerFactory.getLogger(SessionEventStreamer.class);

    /** Long enough for a large manifest to finish generating. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private final SessionEventBus eventBus;
    private final long            timeoutMs;

    @Autowired
    public SessionEventStreamer(SessionEventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SessionEventStreamer(SessionEventBus eventBus, long timeoutMs) {
        this.eventBus  = eventBus;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Attach a viewer to a session.
     *
     * The current state is read after the bus subscription is in place and
     * sent as the first event, so a viewer never misses a transition that
     * happens while it connects. A session that is already terminal gets
     * that one event and an immediately completed stream.
     */
    public SseEmitter open(UUID sessionId, Supplier<SessionEvent> currentState) {
        SseEmitter    emitter  = newEmitter();
        AtomicBoolean finished = new AtomicBoolean();

        SessionEventBus.Subscription subscription =
                eventBus.subscribe(sessionId, event -> forward(emitter, finished, sessionId, event));
        emitter.onCompletion(subscription::cancel);
        emitter.onTimeout(subscription::cancel);
        emitter.onError(e -> subscription.cancel());

        SessionEvent current = currentState.get();
        if (current.status().isTerminal()) {
            subscription.cancel();
        }
        forward(emitter, finished, sessionId, current);
        log.debug("SSE viewer attached to session {} at {}", sessionId, current.status());
        return emitter;
    }

    SseEmitter newEmitter() {
        return new SseEmitter(timeoutMs);
    }

    /** Nothing is sent once a terminal status has gone out. */
    private void forward(SseEmitter emitter, AtomicBoolean finished, UUID sessionId, SessionEvent event) {
        if (finished.get()) return;
        try {
            emitter.send(SseEmitter.event()
                    .name("status")
                    .id(event.status().name())
                    .data(event));
            if (event.status().isTerminal() && finished.compareAndSet(false, true)) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping event for session {} (viewer gone): {}", sessionId, e.getMessage());
            if (finished.compareAndSet(false, true)) {
                emitter.completeWithError(e);
            }
        }
    }
}
