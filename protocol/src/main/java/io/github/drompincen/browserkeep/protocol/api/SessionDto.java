package io.github.drompincen.browserkeep.protocol.api;

import java.time.Instant;

public record SessionDto(
        String sessionId,
        String owner,
        String targetUrl,
        SessionStatus status,
        boolean resumable,
        boolean live,
        Instant createdAt,
        Instant lastActiveAt
) {}
