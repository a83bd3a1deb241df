package io.github.drompincen.browserkeep.runtime.error;

public class SessionNotFoundException extends SessionException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("session_not_found", "Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
