package io.github.drompincen.browserkeep.runtime.session;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live sessions owned by this process, plus the slot accounting behind the live-session limit.
 * <p>
 * A slot is reserved before a new session spins its browser and is either turned into an entry by
 * {@link #register} or returned by {@link #cancelReservation}. Recovered sessions bypass the limit
 * but occupy a slot once registered.
 */
public class SessionRegistry {

    private final ConcurrentHashMap<String, LiveSession> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger slotsInUse = new AtomicInteger();
    private final int maxLive;

    public SessionRegistry(int maxLive) {
        if (maxLive < 1) throw new IllegalArgumentException("maxLive must be >= 1");
        this.maxLive = maxLive;
    }

    public boolean tryReserve() {
        while (true) {
            int current = slotsInUse.get();
            if (current >= maxLive) return false;
            if (slotsInUse.compareAndSet(current, current + 1)) return true;
        }
    }

    public void cancelReservation() {
        slotsInUse.decrementAndGet();
    }

    /**
     * Adds a session started here. The caller must hold a reservation.
     */
    public void register(LiveSession session) {
        if (sessions.putIfAbsent(session.getSessionId(), session) != null) {
            throw new IllegalStateException("Session already live: " + session.getSessionId());
        }
    }

    public void registerRecovered(LiveSession session) {
        if (sessions.putIfAbsent(session.getSessionId(), session) != null) {
            throw new IllegalStateException("Session already live: " + session.getSessionId());
        }
        slotsInUse.incrementAndGet();
    }

    public Optional<LiveSession> remove(String sessionId) {
        LiveSession removed = sessions.remove(sessionId);
        if (removed != null) {
            slotsInUse.decrementAndGet();
        }
        return Optional.ofNullable(removed);
    }

    public Optional<LiveSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public List<LiveSession> snapshot() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(LiveSession::getCreatedAt))
                .toList();
    }

    public int size() {
        return sessions.size();
    }

    public int slotsInUse() {
        return slotsInUse.get();
    }

    public int getMaxLive() {
        return maxLive;
    }
}
