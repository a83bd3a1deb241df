package io.github.drompincen.browserkeep.protocol.api;

public record StartSessionRequest(
        String owner,
        String targetUrl
) {}
