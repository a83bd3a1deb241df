package io.github.drompincen.browserkeep.protocol.api;

public record SessionStatusResponse(
        String sessionId,
        SessionStatus status
) {}
