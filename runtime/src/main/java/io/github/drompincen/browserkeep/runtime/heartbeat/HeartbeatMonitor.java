package io.github.drompincen.browserkeep.runtime.heartbeat;

import io.github.drompincen.browserkeep.persistence.store.SessionStore;
import io.github.drompincen.browserkeep.persistence.store.StoreUnavailableException;
import io.github.drompincen.browserkeep.protocol.api.SessionStatus;
import io.github.drompincen.browserkeep.protocol.event.EventType;
import io.github.drompincen.browserkeep.runtime.driver.DriverInvoker;
import io.github.drompincen.browserkeep.runtime.event.EventService;
import io.github.drompincen.browserkeep.runtime.lock.SessionLockService;
import io.github.drompincen.browserkeep.runtime.session.LiveSession;
import io.github.drompincen.browserkeep.runtime.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Reclaims live sessions whose owner stopped sending heartbeats, or that outlived the maximum
 * session age. Only looks at sessions held by this process.
 */
@Component
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final SessionRegistry registry;
    private final SessionStore sessionStore;
    private final SessionLockService lockService;
    private final DriverInvoker driver;
    private final EventService eventService;
    private final HeartbeatPolicy policy;
    private final Clock clock;

    public HeartbeatMonitor(SessionRegistry registry,
                            SessionStore sessionStore,
                            SessionLockService lockService,
                            DriverInvoker driver,
                            EventService eventService,
                            HeartbeatPolicy policy,
                            Clock clock) {
        this.registry = registry;
        this.sessionStore = sessionStore;
        this.lockService = lockService;
        this.driver = driver;
        this.eventService = eventService;
        this.policy = policy;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${browserkeep.heartbeat.sweep-interval:PT15S}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * @return number of sessions removed from this process
     */
    public int sweep() {
        Instant now = clock.instant();
        int reclaimed = 0;
        for (LiveSession session : registry.snapshot()) {
            if (!isExpired(session, now)) continue;
            try {
                if (abandon(session.getSessionId())) reclaimed++;
            } catch (StoreUnavailableException e) {
                log.warn("Store unavailable while abandoning session {}; retrying next sweep",
                        session.getSessionId());
            }
        }
        if (reclaimed > 0) {
            log.info("Heartbeat sweep reclaimed {} session(s)", reclaimed);
        }
        return reclaimed;
    }

    private boolean abandon(String sessionId) {
        return lockService.withLock(sessionId, () -> {
            Optional<LiveSession> entry = registry.get(sessionId);
            if (entry.isEmpty()) return false;
            LiveSession live = entry.get();
            // a heartbeat may have landed between the scan and the lock
            if (!isExpired(live, clock.instant())) return false;

            boolean applied = sessionStore.updateStatus(sessionId, SessionStatus.ACTIVE, SessionStatus.ABANDONED);
            registry.remove(sessionId);
            driver.release(live.getHandle());
            if (applied) {
                log.info("Abandoned session {} of {} (last active {})",
                        sessionId, live.getOwner(), live.getLastActiveAt());
                eventService.emit(sessionId, live.getOwner(), EventType.SESSION_ABANDONED,
                        SessionStatus.ACTIVE, SessionStatus.ABANDONED);
            } else {
                log.info("Session {} is no longer ACTIVE in the store; dropped local handle", sessionId);
                eventService.forget(sessionId);
            }
            return true;
        });
    }

    private boolean isExpired(LiveSession session, Instant now) {
        if (session.getLastActiveAt().plus(policy.timeout()).isBefore(now)) return true;
        return policy.maxSessionAge() != null && session.getCreatedAt().plus(policy.maxSessionAge()).isBefore(now);
    }
}
