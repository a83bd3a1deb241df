package io.github.drompincen.browserkeep.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.browserkeep.protocol.event.Event;
import io.github.drompincen.browserkeep.protocol.ws.WsMessage;
import io.github.drompincen.browserkeep.protocol.ws.WsMessageType;
import io.github.drompincen.browserkeep.runtime.event.SessionEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes session transitions to WebSocket clients subscribed by session id or by owner.
 */
@Component
public class SessionEventWebSocketHandler extends TextWebSocketHandler implements SessionEventListener {

    private static final Logger log = LoggerFactory.getLogger(SessionEventWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final Map<String, Set<WebSocketSession>> sessionSubscriptions = new ConcurrentHashMap<>();
    private final Map<String, Set<WebSocketSession>> ownerSubscriptions = new ConcurrentHashMap<>();

    public SessionEventWebSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionSubscriptions.values().forEach(set -> set.remove(session));
        ownerSubscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node = objectMapper.readTree(message.getPayload());
        String type = node.path("type").asText();
        String sessionId = node.path("sessionId").asText(null);
        String owner = node.path("owner").asText(null);

        switch (type) {
            case "SUBSCRIBE_SESSION" -> {
                if (sessionId == null) {
                    sendError(session, null, "sessionId is required");
                    return;
                }
                sessionSubscriptions.computeIfAbsent(sessionId, k -> new CopyOnWriteArraySet<>()).add(session);
                send(session, WsMessage.of(WsMessageType.SUBSCRIBED, sessionId, null));
            }
            case "SUBSCRIBE_OWNER" -> {
                if (owner == null) {
                    sendError(session, null, "owner is required");
                    return;
                }
                ownerSubscriptions.computeIfAbsent(owner, k -> new CopyOnWriteArraySet<>()).add(session);
                send(session, WsMessage.forOwner(WsMessageType.SUBSCRIBED, owner));
            }
            case "UNSUBSCRIBE" -> {
                if (sessionId != null) removeFrom(sessionSubscriptions, sessionId, session);
                if (owner != null) removeFrom(ownerSubscriptions, owner, session);
                send(session, new WsMessage(WsMessageType.UNSUBSCRIBED, sessionId, owner, null, Instant.now()));
            }
            default -> sendError(session, sessionId, "Unknown message type: " + type);
        }
    }

    @Override
    public void onEvent(Event event) {
        Set<WebSocketSession> targets = new LinkedHashSet<>();
        targets.addAll(sessionSubscriptions.getOrDefault(event.sessionId(), Set.of()));
        if (event.owner() != null) {
            targets.addAll(ownerSubscriptions.getOrDefault(event.owner(), Set.of()));
        }
        if (targets.isEmpty()) return;

        WsMessage message = WsMessage.of(WsMessageType.EVENT, event.sessionId(), toPayload(event));
        for (WebSocketSession ws : targets) {
            send(ws, message);
        }
    }

    private ObjectNode toPayload(Event event) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("eventId", event.eventId());
        payload.put("seq", event.seq());
        payload.put("type", event.type().wireName());
        payload.put("owner", event.owner());
        payload.put("fromStatus", event.fromStatus() != null ? event.fromStatus().name() : null);
        payload.put("toStatus", event.toStatus() != null ? event.toStatus().name() : null);
        payload.put("timestamp", event.timestamp().toString());
        return payload;
    }

    private void sendError(WebSocketSession session, String sessionId, String reason) {
        ObjectNode payload = objectMapper.createObjectNode().put("message", reason);
        send(session, WsMessage.error(sessionId, payload));
    }

    private void send(WebSocketSession ws, WsMessage message) {
        if (!ws.isOpen()) return;
        try {
            TextMessage text = new TextMessage(objectMapper.writeValueAsString(message));
            // events arrive from request, sweep and recovery threads; a session must not be written concurrently
            synchronized (ws) {
                ws.sendMessage(text);
            }
        } catch (IOException e) {
            log.debug("Dropping message to WebSocket {}: {}", ws.getId(), e.getMessage());
        }
    }

    private static void removeFrom(Map<String, Set<WebSocketSession>> subscriptions, String key,
                                   WebSocketSession session) {
        Set<WebSocketSession> set = subscriptions.get(key);
        if (set != null) set.remove(session);
    }
}
