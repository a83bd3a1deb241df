package io.github.drompincen.browserkeep.protocol.api;

public record TerminationResponse(
        String sessionId,
        TerminateResult result,
        SessionStatus status
) {
    public static TerminationResponse terminated(String sessionId, SessionStatus status) {
        return new TerminationResponse(sessionId, TerminateResult.TERMINATED, status);
    }

    public static TerminationResponse alreadyTerminated(String sessionId, SessionStatus status) {
        return new TerminationResponse(sessionId, TerminateResult.ALREADY_TERMINATED, status);
    }

    public static TerminationResponse superseded(String sessionId, SessionStatus status) {
        return new TerminationResponse(sessionId, TerminateResult.SUPERSEDED, status);
    }
}
