package io.github.drompincen.browserkeep.protocol.ws;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WsMessageTest {

    @Test
    void ofFactoryCreatesMessage() {
        WsMessage msg = WsMessage.of(WsMessageType.SUBSCRIBED, "sess-1", new TextNode("payload"));

        assertThat(msg.type()).isEqualTo(WsMessageType.SUBSCRIBED);
        assertThat(msg.sessionId()).isEqualTo("sess-1");
        assertThat(msg.owner()).isNull();
        assertThat(msg.payload().asText()).isEqualTo("payload");
        assertThat(msg.ts()).isNotNull();
    }

    @Test
    void forOwnerCarriesOwnerOnly() {
        WsMessage msg = WsMessage.forOwner(WsMessageType.SUBSCRIBED, "u1");

        assertThat(msg.owner()).isEqualTo("u1");
        assertThat(msg.sessionId()).isNull();
        assertThat(msg.payload()).isNull();
    }

    @Test
    void errorFactoryCreatesErrorMessage() {
        WsMessage msg = WsMessage.error("sess-1", new TextNode("something went wrong"));

        assertThat(msg.type()).isEqualTo(WsMessageType.ERROR);
        assertThat(msg.sessionId()).isEqualTo("sess-1");
    }
}
