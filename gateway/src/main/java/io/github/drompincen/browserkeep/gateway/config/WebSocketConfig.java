package io.github.drompincen.browserkeep.gateway.config;

import io.github.drompincen.browserkeep.gateway.websocket.SessionEventWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes the session transition stream at {@value #EVENT_STREAM_PATH}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String EVENT_STREAM_PATH = "/ws/sessions";

    private final SessionEventWebSocketHandler sessionEvents;

    public WebSocketConfig(SessionEventWebSocketHandler sessionEvents) {
        this.sessionEvents = sessionEvents;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(sessionEvents, EVENT_STREAM_PATH).setAllowedOrigins("*");
    }
}
