package io.github.drompincen.browserkeep.persistence.document;

import io.github.drompincen.browserkeep.protocol.api.SessionStatus;
import io.github.drompincen.browserkeep.protocol.event.Event;
import io.github.drompincen.browserkeep.protocol.event.EventType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "session_events")
@CompoundIndex(name = "session_ts", def = "{'sessionId': 1, 'timestamp': 1, 'seq': 1}")
public class EventDocument {

    @Id
    private String eventId;
    private String sessionId;
    private String owner;
    private long seq;
    private EventType type;
    private SessionStatus fromStatus;
    private SessionStatus toStatus;
    private Instant timestamp;

    public EventDocument() {}

    public static EventDocument from(Event event) {
        EventDocument doc = new EventDocument();
        doc.setEventId(event.eventId());
        doc.setSessionId(event.sessionId());
        doc.setOwner(event.owner());
        doc.setSeq(event.seq());
        doc.setType(event.type());
        doc.setFromStatus(event.fromStatus());
        doc.setToStatus(event.toStatus());
        doc.setTimestamp(event.timestamp());
        return doc;
    }

    public Event toEvent() {
        return new Event(eventId, sessionId, owner, seq, type, fromStatus, toStatus, timestamp);
    }

    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public EventType getType() { return type; }
    public void setType(EventType type) { this.type = type; }

    public SessionStatus getFromStatus() { return fromStatus; }
    public void setFromStatus(SessionStatus fromStatus) { this.fromStatus = fromStatus; }

    public SessionStatus getToStatus() { return toStatus; }
    public void setToStatus(SessionStatus toStatus) { this.toStatus = toStatus; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
