package io.github.drompincen.browserkeep.protocol.api;

public record UpdateResumeTokenRequest(
        String resumeToken
) {}
