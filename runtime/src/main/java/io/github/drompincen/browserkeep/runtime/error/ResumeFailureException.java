package io.github.drompincen.browserkeep.runtime.error;

public class ResumeFailureException extends SessionException {

    private final String sessionId;

    public ResumeFailureException(String sessionId, String reason) {
        super("resume_failed", reason);
        this.sessionId = sessionId;
    }

    public ResumeFailureException(String sessionId, String reason, Throwable cause) {
        super("resume_failed", reason, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
