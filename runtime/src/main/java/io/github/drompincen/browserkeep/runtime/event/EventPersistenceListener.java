package io.github.drompincen.browserkeep.runtime.event;

import io.github.drompincen.browserkeep.persistence.document.EventDocument;
import io.github.drompincen.browserkeep.persistence.repository.EventRepository;
import io.github.drompincen.browserkeep.protocol.event.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes every transition to the {@code session_events} collection. Best-effort: a failed write
 * is logged and the event is lost.
 */
@Component
@ConditionalOnProperty(name = "browserkeep.events.persist", havingValue = "true", matchIfMissing = true)
public class EventPersistenceListener implements SessionEventListener {

    private static final Logger log = LoggerFactory.getLogger(EventPersistenceListener.class);

    private final EventRepository eventRepository;

    public EventPersistenceListener(EventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    @Override
    public void onEvent(Event event) {
        try {
            eventRepository.save(EventDocument.from(event));
        } catch (RuntimeException e) {
            log.warn("Could not persist {} event for session {}: {}",
                    event.type().wireName(), event.sessionId(), e.getMessage());
        }
    }

    public List<Event> history(String sessionId) {
        return eventRepository.findBySessionIdOrderByTimestampAscSeqAsc(sessionId).stream()
                .map(EventDocument::toEvent)
                .toList();
    }
}
