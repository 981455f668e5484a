package com.specforge.orchestrator.events;

import com.specforge.orchestrator.model.SessionStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SessionEventBusTest {

    private final SessionEventBus bus = new SessionEventBus();

    @Test
    void publish_reachesOnlySubscribersOfThatSession() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        List<SessionEvent> forA = new ArrayList<>();
        bus.subscribe(a, forA::add);

        bus.publish(SessionEvent.of(a, SessionStatus.ANALYZING, "x"));
        bus.publish(SessionEvent.of(b, SessionStatus.ANALYZING, "y"));

        assertThat(forA).extracting(SessionEvent::summary).containsExactly("x");
    }

    @Test
    void subscribeAll_seesEverySession() {
        List<SessionEvent> all = new ArrayList<>();
        bus.subscribeAll(all::add);

        bus.publish(SessionEvent.of(UUID.randomUUID(), SessionStatus.PENDING, "1"));
        bus.publish(SessionEvent.of(UUID.randomUUID(), SessionStatus.PENDING, "2"));

        assertThat(all).hasSize(2);
    }

    @Test
    void cancel_removesSubscriber() {
        UUID id = UUID.randomUUID();
        List<SessionEvent> got = new ArrayList<>();
        SessionEventBus.Subscription sub = bus.subscribe(id, got::add);

        sub.cancel();
        bus.publish(SessionEvent.of(id, SessionStatus.FAILED, "cancelled"));

        assertThat(got).isEmpty();
        assertThat(bus.subscriberCount(id)).isZero();
    }

    @Test
    void throwingSubscriber_doesNotBlockOthers() {
        UUID id = UUID.randomUUID();
        List<SessionEvent> got = new ArrayList<>();
        bus.subscribe(id, e -> { throw new IllegalStateException("viewer gone"); });
        bus.subscribe(id, got::add);

        bus.publish(SessionEvent.of(id, SessionStatus.COMPLETED, "done"));

        assertThat(got).hasSize(1);
    }
}
