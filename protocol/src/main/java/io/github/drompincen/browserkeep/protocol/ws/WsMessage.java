package io.github.drompincen.browserkeep.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String sessionId,
        String owner,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String sessionId, JsonNode payload) {
        return new WsMessage(type, sessionId, null, payload, Instant.now());
    }

    public static WsMessage forOwner(WsMessageType type, String owner) {
        return new WsMessage(type, null, owner, null, Instant.now());
    }

    public static WsMessage error(String sessionId, JsonNode payload) {
        return of(WsMessageType.ERROR, sessionId, payload);
    }
}
