package io.github.drompincen.browserkeep.runtime.support;

import io.github.drompincen.browserkeep.protocol.event.Event;
import io.github.drompincen.browserkeep.protocol.event.EventType;
import io.github.drompincen.browserkeep.runtime.event.SessionEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingListener implements SessionEventListener {

    public final List<Event> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(Event event) {
        events.add(event);
    }

    public List<EventType> types() {
        return events.stream().map(Event::type).toList();
    }

    public List<EventType> typesFor(String sessionId) {
        return events.stream().filter(e -> e.sessionId().equals(sessionId)).map(Event::type).toList();
    }
}
