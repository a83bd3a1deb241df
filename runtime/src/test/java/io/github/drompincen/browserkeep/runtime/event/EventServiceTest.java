package io.github.drompincen.browserkeep.runtime.event;

import io.github.drompincen.browserkeep.protocol.api.SessionStatus;
import io.github.drompincen.browserkeep.protocol.event.Event;
import io.github.drompincen.browserkeep.protocol.event.EventType;
import io.github.drompincen.browserkeep.runtime.support.RecordingListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

@ExtendWith(MockitoExtension.class)
class EventServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    @Mock
    private SessionEventListener failingListener;

    @Test
    void emitAssignsIncreasingSeqPerSession() {
        RecordingListener recorder = new RecordingListener();
        EventService eventService = new EventService(List.of(recorder), Clock.fixed(NOW, ZoneOffset.UTC));

        Event first = eventService.emit("s1", "u1", EventType.SESSION_CREATED, null, SessionStatus.ACTIVE);
        Event second = eventService.emit("s1", "u1", EventType.SESSION_HEARTBEAT, SessionStatus.ACTIVE, SessionStatus.ACTIVE);
        Event other = eventService.emit("s2", "u1", EventType.SESSION_CREATED, null, SessionStatus.ACTIVE);

        assertThat(first.seq()).isEqualTo(1);
        assertThat(second.seq()).isEqualTo(2);
        assertThat(other.seq()).isEqualTo(1);
        assertThat(first.timestamp()).isEqualTo(NOW);
        assertThat(first.eventId()).isNotEqualTo(second.eventId());
        assertThat(recorder.events).containsExactly(first, second, other);
    }

    @Test
    void counterIsDroppedOnTerminalEventOrWhenForgotten() {
        EventService eventService = new EventService(List.of(), Clock.fixed(NOW, ZoneOffset.UTC));

        eventService.emit("s1", "u1", EventType.SESSION_CREATED, null, SessionStatus.ACTIVE);
        eventService.emit("s2", "u1", EventType.SESSION_CREATED, null, SessionStatus.ACTIVE);
        eventService.emit("s1", "u1", EventType.SESSION_COMPLETED, SessionStatus.ACTIVE, SessionStatus.COMPLETED);
        assertThat(eventService.isTracking("s1")).isFalse();
        assertThat(eventService.isTracking("s2")).isTrue();

        eventService.forget("s2");

        assertThat(eventService.isTracking("s2")).isFalse();
        assertThat(eventService.emit("s2", "u1", EventType.SESSION_RESUMED,
                SessionStatus.RESUMING, SessionStatus.ACTIVE).seq()).isEqualTo(1);
    }

    @Test
    void failingListenerDoesNotStopDelivery() {
        RecordingListener recorder = new RecordingListener();
        doThrow(new IllegalStateException("socket closed")).when(failingListener).onEvent(any());
        EventService eventService = new EventService(List.of(failingListener, recorder), Clock.systemUTC());

        eventService.emit("s1", "u1", EventType.SESSION_ABANDONED, SessionStatus.ACTIVE, SessionStatus.ABANDONED);

        assertThat(recorder.types()).containsExactly(EventType.SESSION_ABANDONED);
    }
}
