package io.github.drompincen.browserkeep.protocol.api;

public record TerminateSessionRequest(
        TerminationOutcome outcome
) {}
