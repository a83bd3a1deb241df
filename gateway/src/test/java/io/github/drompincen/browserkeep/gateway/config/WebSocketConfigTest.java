package io.github.drompincen.browserkeep.gateway.config;

import io.github.drompincen.browserkeep.gateway.websocket.SessionEventWebSocketHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebSocketConfigTest {

    @Mock private SessionEventWebSocketHandler handler;
    @Mock private WebSocketHandlerRegistry registry;
    @Mock private WebSocketHandlerRegistration registration;

    @Test
    void sessionEventStreamIsRegistered() {
        when(registry.addHandler(handler, "/ws/sessions")).thenReturn(registration);

        new WebSocketConfig(handler).registerWebSocketHandlers(registry);

        verify(registration).setAllowedOrigins("*");
    }
}
