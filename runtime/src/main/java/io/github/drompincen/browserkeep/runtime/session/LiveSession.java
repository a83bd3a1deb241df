package io.github.drompincen.browserkeep.runtime.session;

import io.github.drompincen.browserkeep.runtime.driver.DriverHandle;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A session backed by a driver handle in this process. Only {@code ACTIVE} sessions are live.
 */
public class LiveSession {

    private final String sessionId;
    private final String owner;
    private final String targetUrl;
    private final Instant createdAt;
    private final DriverHandle handle;
    private final AtomicReference<Instant> lastActiveAt;
    private volatile String resumeToken;

    public LiveSession(String sessionId, String owner, String targetUrl, Instant createdAt,
                       Instant lastActiveAt, DriverHandle handle, String resumeToken) {
        this.sessionId = sessionId;
        this.owner = owner;
        this.targetUrl = targetUrl;
        this.createdAt = createdAt;
        this.handle = handle;
        this.lastActiveAt = new AtomicReference<>(lastActiveAt);
        this.resumeToken = resumeToken;
    }

    /**
     * Moves {@code lastActiveAt} forward; an older timestamp is ignored.
     */
    public Instant touch(Instant timestamp) {
        return lastActiveAt.accumulateAndGet(timestamp, (current, next) -> next.isAfter(current) ? next : current);
    }

    public String getSessionId() { return sessionId; }
    public String getOwner() { return owner; }
    public String getTargetUrl() { return targetUrl; }
    public Instant getCreatedAt() { return createdAt; }
    public DriverHandle getHandle() { return handle; }
    public Instant getLastActiveAt() { return lastActiveAt.get(); }

    public String getResumeToken() { return resumeToken; }
    public void setResumeToken(String resumeToken) { this.resumeToken = resumeToken; }
}
