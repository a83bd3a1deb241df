package io.github.drompincen.browserkeep.runtime.recovery;

import io.github.drompincen.browserkeep.persistence.document.SessionDocument;
import io.github.drompincen.browserkeep.persistence.store.SessionStore;
import io.github.drompincen.browserkeep.persistence.store.StoreUnavailableException;
import io.github.drompincen.browserkeep.protocol.api.RecoveryReportDto;
import io.github.drompincen.browserkeep.protocol.api.SessionStatus;
import io.github.drompincen.browserkeep.protocol.event.EventType;
import io.github.drompincen.browserkeep.runtime.driver.DriverException;
import io.github.drompincen.browserkeep.runtime.driver.DriverHandle;
import io.github.drompincen.browserkeep.runtime.driver.DriverInvoker;
import io.github.drompincen.browserkeep.runtime.error.ConcurrentClaimLostException;
import io.github.drompincen.browserkeep.runtime.error.ResumeFailureException;
import io.github.drompincen.browserkeep.runtime.event.EventService;
import io.github.drompincen.browserkeep.runtime.lock.SessionLockService;
import io.github.drompincen.browserkeep.runtime.notify.OwnerNotifier;
import io.github.drompincen.browserkeep.runtime.session.LiveSession;
import io.github.drompincen.browserkeep.runtime.session.SessionRegistry;
import io.github.drompincen.browserkeep.runtime.support.StoreRetry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reconciles durable {@code ACTIVE} records that no process holds a browser for. Each one is
 * claimed with {@code ACTIVE -> RESUMING}, resumed from its checkpoint and resolved to either
 * {@code ACTIVE} or {@code FAILED}. The compare-and-set claim makes concurrent coordinators, in
 * this process or in peers, safe: only the winner ever calls the driver.
 */
@Service
public class RecoveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    enum Outcome { SKIPPED, RESUMED, FAILED, DISCARDED, UNRESOLVED }

    private final SessionStore sessionStore;
    private final SessionRegistry registry;
    private final SessionLockService lockService;
    private final DriverInvoker driver;
    private final EventService eventService;
    private final OwnerNotifier ownerNotifier;
    private final StoreRetry storeRetry;
    private final RecoveryPolicy policy;
    private final Clock clock;
    private final ExecutorService workers;
    private final AtomicReference<RecoveryReportDto> lastReport = new AtomicReference<>();

    public RecoveryCoordinator(SessionStore sessionStore,
                               SessionRegistry registry,
                               SessionLockService lockService,
                               DriverInvoker driver,
                               EventService eventService,
                               OwnerNotifier ownerNotifier,
                               StoreRetry storeRetry,
                               RecoveryPolicy policy,
                               Clock clock) {
        this.sessionStore = sessionStore;
        this.registry = registry;
        this.lockService = lockService;
        this.driver = driver;
        this.eventService = eventService;
        this.ownerNotifier = ownerNotifier;
        this.storeRetry = storeRetry;
        this.policy = policy;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(policy.parallelism(), r -> {
            Thread t = new Thread(r, "recovery-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!policy.onStartup()) {
            log.info("Startup recovery disabled");
            return;
        }
        runSafely("startup");
    }

    @Scheduled(fixedDelayString = "${browserkeep.recovery.interval:PT60S}",
            initialDelayString = "${browserkeep.recovery.interval:PT60S}")
    public void scheduledRun() {
        if (policy.periodic()) {
            runSafely("periodic");
        }
    }

    public Optional<RecoveryReportDto> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    /**
     * Runs one reconciliation pass and blocks until every claimed record is resolved.
     *
     * @throws StoreUnavailableException when the candidate query itself fails
     */
    public synchronized RecoveryReportDto runOnce() {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Instant startedAt = clock.instant();

        int staleReclaimed = reclaimStaleClaims();

        List<SessionDocument> candidates = new ArrayList<>();
        int skipped = 0;
        for (SessionDocument record : sessionStore.queryByStatus(SessionStatus.ACTIVE)) {
            if (registry.contains(record.getSessionId()) || withinOrphanGrace(record, startedAt)) {
                skipped++;
            } else {
                candidates.add(record);
            }
        }

        Map<Outcome, Integer> outcomes = new EnumMap<>(Outcome.class);
        for (Outcome outcome : resolveAll(candidates)) {
            outcomes.merge(outcome, 1, Integer::sum);
        }
        int lost = outcomes.getOrDefault(Outcome.SKIPPED, 0);
        int claimed = candidates.size() - lost;

        RecoveryReportDto report = new RecoveryReportDto(runId, startedAt, clock.instant(),
                candidates.size(), claimed,
                outcomes.getOrDefault(Outcome.RESUMED, 0),
                outcomes.getOrDefault(Outcome.FAILED, 0),
                skipped + lost,
                staleReclaimed);
        lastReport.set(report);
        log.info("Recovery run {}: {} candidate(s), {} claimed, {} resumed, {} failed, {} skipped, {} stale reclaimed",
                runId, report.candidates(), report.claimed(), report.resumed(), report.failed(),
                report.skipped(), report.staleReclaimed());
        return report;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    private void runSafely(String trigger) {
        try {
            runOnce();
        } catch (StoreUnavailableException e) {
            log.error("{} recovery run aborted: {}", trigger, e.getMessage());
        }
    }

    private boolean withinOrphanGrace(SessionDocument record, Instant now) {
        if (policy.orphanGrace().isZero()) return false;
        return record.getLastActiveAt() != null && record.getLastActiveAt().isAfter(now.minus(policy.orphanGrace()));
    }

    private List<Outcome> resolveAll(List<SessionDocument> candidates) {
        List<Callable<Outcome>> tasks = new ArrayList<>();
        for (SessionDocument record : candidates) {
            tasks.add(() -> recover(record));
        }
        List<Outcome> results = new ArrayList<>();
        try {
            for (Future<Outcome> future : workers.invokeAll(tasks)) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    log.error("Recovery task failed unexpectedly", e.getCause());
                    results.add(Outcome.UNRESOLVED);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Recovery run interrupted with {} of {} record(s) resolved", results.size(), candidates.size());
        }
        return results;
    }

    private Outcome recover(SessionDocument record) {
        String sessionId = record.getSessionId();
        try {
            claim(sessionId);
        } catch (ConcurrentClaimLostException e) {
            log.debug(e.getMessage());
            return Outcome.SKIPPED;
        } catch (StoreUnavailableException e) {
            log.warn("Store unavailable while claiming session {}: {}", sessionId, e.getMessage());
            return Outcome.SKIPPED;
        }

        DriverHandle handle;
        try {
            handle = resume(record);
        } catch (ResumeFailureException e) {
            return markFailed(record, e.getMessage());
        }
        return activate(record, handle);
    }

    private void claim(String sessionId) {
        lockService.runLocked(sessionId, () -> {
            if (registry.contains(sessionId)) {
                throw new ConcurrentClaimLostException(sessionId, "live in this process");
            }
            if (!sessionStore.updateStatus(sessionId, SessionStatus.ACTIVE, SessionStatus.RESUMING)) {
                throw new ConcurrentClaimLostException(sessionId, "record is no longer ACTIVE");
            }
        });
    }

    private DriverHandle resume(SessionDocument record) {
        String sessionId = record.getSessionId();
        if (!record.hasResumeToken()) {
            throw new ResumeFailureException(sessionId, "no resume token");
        }
        if (policy.maxRecordAge() != null
                && record.getCreatedAt().plus(policy.maxRecordAge()).isBefore(clock.instant())) {
            throw new ResumeFailureException(sessionId, "record older than " + policy.maxRecordAge());
        }
        try {
            return driver.resume(record.getResumeToken());
        } catch (DriverException e) {
            throw new ResumeFailureException(sessionId, e.getMessage(), e);
        }
    }

    private Outcome activate(SessionDocument record, DriverHandle handle) {
        String sessionId = record.getSessionId();
        boolean activated;
        try {
            activated = lockService.withLock(sessionId, () -> {
                if (!storeRetry.call("finishResume", sessionId,
                        () -> sessionStore.updateStatus(sessionId, SessionStatus.RESUMING, SessionStatus.ACTIVE))) {
                    return false;
                }
                Instant now = clock.instant();
                registry.registerRecovered(new LiveSession(sessionId, record.getOwner(), record.getTargetUrl(),
                        record.getCreatedAt(), now, handle, record.getResumeToken()));
                try {
                    storeRetry.run("touch", sessionId, () -> sessionStore.touch(sessionId, now));
                } catch (StoreUnavailableException e) {
                    log.warn("Resumed session {} but could not record its activity: {}", sessionId, e.getMessage());
                }
                return true;
            });
        } catch (StoreUnavailableException e) {
            driver.release(handle);
            log.error("Could not finish resume of session {}; left RESUMING: {}", sessionId, e.getMessage());
            return Outcome.UNRESOLVED;
        }

        if (!activated) {
            driver.release(handle);
            log.info("Discarded resume of session {}: record changed while the resume was in flight", sessionId);
            return Outcome.DISCARDED;
        }
        log.info("Resumed session {} of {}", sessionId, record.getOwner());
        eventService.emit(sessionId, record.getOwner(), EventType.SESSION_RESUMED,
                SessionStatus.RESUMING, SessionStatus.ACTIVE);
        return Outcome.RESUMED;
    }

    private Outcome markFailed(SessionDocument record, String reason) {
        String sessionId = record.getSessionId();
        boolean applied;
        try {
            applied = lockService.withLock(sessionId, () -> storeRetry.call("markResumeFailed", sessionId,
                    () -> sessionStore.updateStatus(sessionId, SessionStatus.RESUMING, SessionStatus.FAILED)));
        } catch (StoreUnavailableException e) {
            log.error("Could not record resume failure of session {}; left RESUMING: {}", sessionId, e.getMessage());
            return Outcome.UNRESOLVED;
        }
        if (!applied) {
            log.info("Session {} was resolved elsewhere before its resume failure was recorded", sessionId);
            return Outcome.DISCARDED;
        }
        log.info("Session {} could not be resumed: {}", sessionId, reason);
        eventService.emit(sessionId, record.getOwner(), EventType.SESSION_RESUME_FAILED,
                SessionStatus.RESUMING, SessionStatus.FAILED);
        notifyOwner(record, reason);
        return Outcome.FAILED;
    }

    private int reclaimStaleClaims() {
        if (policy.resumingStaleAfter() == null) return 0;
        Instant cutoff = clock.instant().minus(policy.resumingStaleAfter());
        int reclaimed = 0;
        try {
            for (SessionDocument record : sessionStore.queryStaleResuming(cutoff)) {
                String sessionId = record.getSessionId();
                boolean applied = lockService.withLock(sessionId,
                        () -> sessionStore.updateStatus(sessionId, SessionStatus.RESUMING, SessionStatus.FAILED));
                if (!applied) continue;
                reclaimed++;
                log.warn("Failed session {} stuck in RESUMING since {}", sessionId, record.getStatusChangedAt());
                eventService.emit(sessionId, record.getOwner(), EventType.SESSION_RESUME_FAILED,
                        SessionStatus.RESUMING, SessionStatus.FAILED);
                notifyOwner(record, "recovery did not complete");
            }
        } catch (StoreUnavailableException e) {
            log.warn("Stale RESUMING sweep interrupted: {}", e.getMessage());
        }
        return reclaimed;
    }

    private void notifyOwner(SessionDocument record, String reason) {
        try {
            ownerNotifier.notifyResumeFailed(record.getSessionId(), record.getOwner(), reason);
        } catch (RuntimeException e) {
            log.warn("Could not notify owner of session {}: {}", record.getSessionId(), e.getMessage());
        }
    }
}
