package com.specforge.orchestrator.events;

import com.specforge.orchestrator.model.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class SessionEventStreamerTest {

    /** Captures what the streamer sends instead of writing to a servlet response. */
    static class RecordingEmitter extends SseEmitter {
        final List<SessionStatus> sent = new CopyOnWriteArrayList<>();
        volatile boolean completed;

        RecordingEmitter() {
            super(1_000L);
        }

        @Override
        public void send(SseEventBuilder builder) {
            if (completed) throw new IllegalStateException("already completed");
            builder.build().stream()
                    .map(DataWithMediaType::getData)
                    .filter(SessionEvent.class::isInstance)
                    .map(d -> ((SessionEvent) d).status())
                    .forEach(sent::add);
        }

        @Override
        public synchronized void complete() {
            completed = true;
        }
    }

    SessionEventBus      bus;
    RecordingEmitter     emitter;
    SessionEventStreamer streamer;
    UUID                 id;

    @BeforeEach
    void setUp() {
        bus      = new SessionEventBus();
        emitter  = new RecordingEmitter();
        streamer = new SessionEventStreamer(bus, 1_000L) {
            @Override
            SseEmitter newEmitter() {
                return emitter;
            }
        };
        id = UUID.randomUUID();
    }

    @Test
    void open_runningSession_sendsCurrentStatusAndStaysSubscribed() {
        SseEmitter opened = streamer.open(id, () -> SessionEvent.of(id, SessionStatus.GENERATING, "now"));

        assertThat(opened).isSameAs(emitter);
        assertThat(emitter.sent).containsExactly(SessionStatus.GENERATING);
        assertThat(emitter.completed).isFalse();
        assertThat(bus.subscriberCount(id)).isEqualTo(1);

        bus.publish(SessionEvent.of(id, SessionStatus.AGGREGATING, "aggregating"));
        bus.publish(SessionEvent.of(id, SessionStatus.COMPLETED, "done"));

        assertThat(emitter.sent).containsExactly(
                SessionStatus.GENERATING, SessionStatus.AGGREGATING, SessionStatus.COMPLETED);
        assertThat(emitter.completed).isTrue();
    }

    @Test
    void open_finishedSession_sendsFinalStatusAndCompletesAtOnce() {
        streamer.open(id, () -> SessionEvent.of(id, SessionStatus.COMPLETED, "done"));

        assertThat(emitter.sent).containsExactly(SessionStatus.COMPLETED);
        assertThat(emitter.completed).isTrue();
        assertThat(bus.subscriberCount(id)).isZero();
    }

    @Test
    void terminalEventDuringAttach_sentOnlyOnce() {
        // The session finishes between subscribing and reading the current state.
        streamer.open(id, () -> {
            bus.publish(SessionEvent.of(id, SessionStatus.FAILED, "Cancelled by caller"));
            return SessionEvent.of(id, SessionStatus.FAILED, "Cancelled by caller");
        });

        assertThat(emitter.sent).containsExactly(SessionStatus.FAILED);
        assertThat(emitter.completed).isTrue();
        assertThat(bus.subscriberCount(id)).isZero();
    }

    @Test
    void open_usesConfiguredTimeout() {
        SessionEventStreamer plain = new SessionEventStreamer(bus, 1_000L);

        SseEmitter opened = plain.open(id, () -> SessionEvent.of(id, SessionStatus.PENDING, "created"));

        assertThat(opened.getTimeout()).isEqualTo(1_000L);
        assertThat(bus.subscriberCount(id)).isEqualTo(1);
    }
}
