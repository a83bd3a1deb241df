package io.github.drompincen.browserkeep.protocol.event;

import io.github.drompincen.browserkeep.protocol.api.SessionStatus;

import java.time.Instant;

/**
 * One session transition. {@code fromStatus} is null for {@link EventType#SESSION_CREATED}.
 */
public record Event(
        String eventId,
        String sessionId,
        String owner,
        long seq,
        EventType type,
        SessionStatus fromStatus,
        SessionStatus toStatus,
        Instant timestamp
) {}
