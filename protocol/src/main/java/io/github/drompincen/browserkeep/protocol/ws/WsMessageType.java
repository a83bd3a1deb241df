package io.github.drompincen.browserkeep.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_SESSION,
    SUBSCRIBE_OWNER,
    UNSUBSCRIBE,

    // Server -> Client
    EVENT,
    SUBSCRIBED,
    UNSUBSCRIBED,
    ERROR
}
