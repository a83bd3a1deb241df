package io.github.drompincen.browserkeep.runtime.session;

import io.github.drompincen.browserkeep.persistence.document.SessionDocument;
import io.github.drompincen.browserkeep.persistence.store.SessionStore;
import io.github.drompincen.browserkeep.protocol.api.SessionDto;
import io.github.drompincen.browserkeep.protocol.api.SessionStatus;
import io.github.drompincen.browserkeep.protocol.api.TerminationOutcome;
import io.github.drompincen.browserkeep.protocol.api.TerminationResponse;
import io.github.drompincen.browserkeep.protocol.event.EventType;
import io.github.drompincen.browserkeep.runtime.driver.DriverHandle;
import io.github.drompincen.browserkeep.runtime.driver.DriverInvoker;
import io.github.drompincen.browserkeep.runtime.error.SessionCapacityExceededException;
import io.github.drompincen.browserkeep.runtime.error.SessionNotFoundException;
import io.github.drompincen.browserkeep.runtime.event.EventService;
import io.github.drompincen.browserkeep.runtime.lock.SessionLockService;
import io.github.drompincen.browserkeep.runtime.support.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for every client-visible session operation. Keeps the live registry and the
 * durable record in step; all writes for one id happen inside that id's critical section.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionStore sessionStore;
    private final SessionRegistry registry;
    private final SessionLockService lockService;
    private final DriverInvoker driver;
    private final EventService eventService;
    private final StoreRetry storeRetry;
    private final Clock clock;

    public SessionManager(SessionStore sessionStore,
                          SessionRegistry registry,
                          SessionLockService lockService,
                          DriverInvoker driver,
                          EventService eventService,
                          StoreRetry storeRetry,
                          Clock clock) {
        this.sessionStore = sessionStore;
        this.registry = registry;
        this.lockService = lockService;
        this.driver = driver;
        this.eventService = eventService;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    public String startSession(String owner, String targetUrl) {
        requireOwner(owner);
        requireTarget(targetUrl);
        if (!registry.tryReserve()) {
            throw new SessionCapacityExceededException(registry.getMaxLive());
        }

        DriverHandle handle;
        try {
            handle = driver.spin(targetUrl);
        } catch (RuntimeException e) {
            registry.cancelReservation();
            throw e;
        }

        String sessionId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        try {
            lockService.runLocked(sessionId, () -> {
                sessionStore.create(newRecord(sessionId, owner, targetUrl, now));
                registry.register(new LiveSession(sessionId, owner, targetUrl, now, now, handle, null));
            });
        } catch (RuntimeException e) {
            registry.cancelReservation();
            driver.release(handle);
            throw e;
        }

        log.info("Started session {} for {} on {}", sessionId, owner, targetUrl);
        eventService.emit(sessionId, owner, EventType.SESSION_CREATED, null, SessionStatus.ACTIVE);
        return sessionId;
    }

    public void heartbeat(String sessionId) {
        lockService.runLocked(sessionId, () -> {
            LiveSession live = requireLive(sessionId);
            Instant now = clock.instant();
            live.touch(now);
            storeRetry.run("touch", sessionId, () -> sessionStore.touch(sessionId, now));
            log.debug("Heartbeat for session {}", sessionId);
            eventService.emit(sessionId, live.getOwner(), EventType.SESSION_HEARTBEAT,
                    SessionStatus.ACTIVE, SessionStatus.ACTIVE);
        });
    }

    /**
     * Records the job's latest checkpoint. The live copy always changes; the durable write is
     * opportunistic and a failure only costs recoverability until the next checkpoint.
     */
    public void updateResumeToken(String sessionId, String resumeToken) {
        if (resumeToken == null || resumeToken.isBlank()) {
            throw new IllegalArgumentException("resumeToken is required");
        }
        lockService.runLocked(sessionId, () -> {
            LiveSession live = requireLive(sessionId);
            live.setResumeToken(resumeToken);
            try {
                sessionStore.updateResumeToken(sessionId, resumeToken);
            } catch (RuntimeException e) {
                log.warn("Could not persist resume token for session {}: {}", sessionId, e.getMessage());
            }
        });
    }

    public SessionStatus getStatus(String sessionId) {
        if (registry.contains(sessionId)) {
            return SessionStatus.ACTIVE;
        }
        return sessionStore.get(sessionId)
                .map(SessionDocument::getStatus)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public TerminationResponse terminate(String sessionId, TerminationOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome is required");
        }
        SessionStatus target = outcome.toStatus();
        return lockService.withLock(sessionId, () -> {
            Optional<LiveSession> live = registry.get(sessionId);
            if (live.isPresent()) {
                boolean applied = sessionStore.updateStatus(sessionId, SessionStatus.ACTIVE, target);
                registry.remove(sessionId);
                driver.release(live.get().getHandle());
                if (applied) {
                    return terminated(sessionId, live.get().getOwner(), target);
                }
                log.info("Session {} changed state elsewhere; dropped local handle", sessionId);
                return unresolved(sessionId);
            }

            SessionDocument record = sessionStore.get(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            if (record.getStatus().isTerminal()) {
                return TerminationResponse.alreadyTerminated(sessionId, record.getStatus());
            }
            if (record.getStatus() == SessionStatus.RESUMING) {
                return TerminationResponse.superseded(sessionId, record.getStatus());
            }
            if (sessionStore.updateStatus(sessionId, SessionStatus.ACTIVE, target)) {
                return terminated(sessionId, record.getOwner(), target);
            }
            return unresolved(sessionId);
        });
    }

    public SessionDto describe(String sessionId) {
        Optional<LiveSession> live = registry.get(sessionId);
        if (live.isPresent()) {
            return toDto(live.get());
        }
        return sessionStore.get(sessionId)
                .map(this::toDto)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public List<SessionDto> listByOwner(String owner) {
        requireOwner(owner);
        return sessionStore.queryByOwner(owner).stream()
                .map(this::toDto)
                .toList();
    }

    public List<SessionDto> liveSessions() {
        return registry.snapshot().stream()
                .map(this::toDto)
                .toList();
    }

    private TerminationResponse terminated(String sessionId, String owner, SessionStatus target) {
        log.info("Session {} terminated as {}", sessionId, target);
        EventType type = target == SessionStatus.COMPLETED ? EventType.SESSION_COMPLETED : EventType.SESSION_FAILED;
        eventService.emit(sessionId, owner, type, SessionStatus.ACTIVE, target);
        return TerminationResponse.terminated(sessionId, target);
    }

    // The compare-and-set lost: report whatever the record became instead of retrying.
    private TerminationResponse unresolved(String sessionId) {
        eventService.forget(sessionId);
        SessionStatus current = sessionStore.get(sessionId)
                .map(SessionDocument::getStatus)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return current.isTerminal()
                ? TerminationResponse.alreadyTerminated(sessionId, current)
                : TerminationResponse.superseded(sessionId, current);
    }

    private LiveSession requireLive(String sessionId) {
        return registry.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private SessionDto toDto(LiveSession live) {
        String token = live.getResumeToken();
        return new SessionDto(live.getSessionId(), live.getOwner(), live.getTargetUrl(), SessionStatus.ACTIVE,
                token != null && !token.isBlank(), true, live.getCreatedAt(), live.getLastActiveAt());
    }

    private SessionDto toDto(SessionDocument record) {
        return new SessionDto(record.getSessionId(), record.getOwner(), record.getTargetUrl(), record.getStatus(),
                record.hasResumeToken(), registry.contains(record.getSessionId()),
                record.getCreatedAt(), record.getLastActiveAt());
    }

    private static SessionDocument newRecord(String sessionId, String owner, String targetUrl, Instant now) {
        SessionDocument record = new SessionDocument();
        record.setSessionId(sessionId);
        record.setOwner(owner);
        record.setTargetUrl(targetUrl);
        record.setStatus(SessionStatus.ACTIVE);
        record.setCreatedAt(now);
        record.setLastActiveAt(now);
        record.setStatusChangedAt(now);
        return record;
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner is required");
        }
    }

    private static void requireTarget(String targetUrl) {
        if (targetUrl == null || targetUrl.isBlank()) {
            throw new IllegalArgumentException("targetUrl is required");
        }
        try {
            URI uri = new URI(targetUrl);
            String scheme = uri.getScheme();
            if (!("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
                throw new IllegalArgumentException("targetUrl must be an absolute http(s) URL: " + targetUrl);
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("targetUrl is not a valid URL: " + targetUrl, e);
        }
    }
}
