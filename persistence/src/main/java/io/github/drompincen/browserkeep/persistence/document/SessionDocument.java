package io.github.drompincen.browserkeep.persistence.document;

import io.github.drompincen.browserkeep.protocol.api.SessionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "sessions")
@CompoundIndex(name = "status_changed", def = "{'status': 1, 'statusChangedAt': 1}")
public class SessionDocument {

    @Id
    private String sessionId;

    @Indexed
    private String owner;

    private String targetUrl;
    private String resumeToken;
    private SessionStatus status;
    private Instant createdAt;
    private Instant lastActiveAt;
    private Instant statusChangedAt;

    public SessionDocument() {}

    public SessionDocument copy() {
        SessionDocument c = new SessionDocument();
        c.sessionId = sessionId;
        c.owner = owner;
        c.targetUrl = targetUrl;
        c.resumeToken = resumeToken;
        c.status = status;
        c.createdAt = createdAt;
        c.lastActiveAt = lastActiveAt;
        c.statusChangedAt = statusChangedAt;
        return c;
    }

    public boolean hasResumeToken() {
        return resumeToken != null && !resumeToken.isBlank();
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    public String getTargetUrl() { return targetUrl; }
    public void setTargetUrl(String targetUrl) { this.targetUrl = targetUrl; }

    public String getResumeToken() { return resumeToken; }
    public void setResumeToken(String resumeToken) { this.resumeToken = resumeToken; }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getLastActiveAt() { return lastActiveAt; }
    public void setLastActiveAt(Instant lastActiveAt) { this.lastActiveAt = lastActiveAt; }

    public Instant getStatusChangedAt() { return statusChangedAt; }
    public void setStatusChangedAt(Instant statusChangedAt) { this.statusChangedAt = statusChangedAt; }
}
