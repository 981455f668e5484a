package com.specforge.orchestrator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for session status notifications.
 *
 * Supports per-session and global subscriptions. Delivery is synchronous on
 * the publishing thread; a subscriber that throws is logged and skipped so
 * it can never break the pipeline that published the event.
 */
@Service
public class SessionEventBus {

    private static final Logger log = LoggerFactory.getLogger(SessionEventBus.class);

    private final ConcurrentHashMap<UUID, CopyOnWriteArrayList<Consumer<SessionEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<SessionEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /** Handle returned by subscribe; call to stop receiving events. */
    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }

    public void publish(SessionEvent event) {
        log.debug("Publishing {} for session {}", event.status(), event.sessionId());

        List<Consumer<SessionEvent>> subs = sessionSubscribers.get(event.sessionId());
        if (subs != null) {
            for (Consumer<SessionEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<SessionEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(UUID sessionId, Consumer<SessionEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> sessionSubscribers.computeIfPresent(sessionId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<SessionEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    int subscriberCount(UUID sessionId) {
        List<Consumer<SessionEvent>> subs = sessionSubscribers.get(sessionId);
        return subs == null ? 0 : subs.size();
    }

    private void deliverSafely(Consumer<SessionEvent> subscriber, SessionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed for session {} event {}: {}",
                    event.sessionId(), event.status(), e.getMessage());
        }
    }
}
