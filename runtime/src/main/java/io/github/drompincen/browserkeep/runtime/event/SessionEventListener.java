package io.github.drompincen.browserkeep.runtime.event;

import io.github.drompincen.browserkeep.protocol.event.Event;

/**
 * Receives every session transition, synchronously on the thread that made it.
 * Exceptions are logged by {@link EventService} and do not affect the transition.
 */
public interface SessionEventListener {
    void onEvent(Event event);
}
