package io.github.drompincen.browserkeep.runtime.event;

import io.github.drompincen.browserkeep.protocol.api.SessionStatus;
import io.github.drompincen.browserkeep.protocol.event.Event;
import io.github.drompincen.browserkeep.protocol.event.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class EventService {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final List<SessionEventListener> listeners;
    private final Clock clock;
    private final ConcurrentHashMap<String, AtomicLong> seqCounters = new ConcurrentHashMap<>();

    public EventService(List<SessionEventListener> listeners, Clock clock) {
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    public Event emit(String sessionId, String owner, EventType type, SessionStatus from, SessionStatus to) {
        long seq = seqCounters.computeIfAbsent(sessionId, k -> new AtomicLong()).incrementAndGet();
        Event event = new Event(UUID.randomUUID().toString(), sessionId, owner, seq, type, from, to, clock.instant());
        if (to != null && to.isTerminal()) {
            seqCounters.remove(sessionId);
        }
        for (SessionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} for session {}: {}",
                        listener.getClass().getSimpleName(), type.wireName(), sessionId, e.getMessage());
            }
        }
        return event;
    }

    /**
     * Drops the sequence counter of a session this process let go of without a terminal event.
     */
    public void forget(String sessionId) {
        seqCounters.remove(sessionId);
    }

    public boolean isTracking(String sessionId) {
        return seqCounters.containsKey(sessionId);
    }
}
