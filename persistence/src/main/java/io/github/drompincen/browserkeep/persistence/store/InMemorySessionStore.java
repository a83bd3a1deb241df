package io.github.drompincen.browserkeep.persistence.store;

import io.github.drompincen.browserkeep.persistence.document.SessionDocument;
import io.github.drompincen.browserkeep.protocol.api.SessionStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-durable {@link SessionStore} with the same single-record atomicity as the MongoDB store.
 * Used for local runs ({@code browserkeep.store.type=memory}) and engine tests.
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, SessionDocument> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void create(SessionDocument record) {
        SessionDocument stored = record.copy();
        if (stored.getStatusChangedAt() == null) {
            stored.setStatusChangedAt(stored.getCreatedAt());
        }
        if (records.putIfAbsent(stored.getSessionId(), stored) != null) {
            throw new IllegalStateException("Session id already exists: " + record.getSessionId());
        }
    }

    @Override
    public boolean updateStatus(String sessionId, SessionStatus from, SessionStatus to) {
        SessionStore.requireEdge(from, to);
        AtomicBoolean applied = new AtomicBoolean(false);
        records.computeIfPresent(sessionId, (id, current) -> {
            if (current.getStatus() != from) return current;
            SessionDocument next = current.copy();
            next.setStatus(to);
            next.setStatusChangedAt(clock.instant());
            applied.set(true);
            return next;
        });
        return applied.get();
    }

    @Override
    public void touch(String sessionId, Instant timestamp) {
        records.computeIfPresent(sessionId, (id, current) -> {
            if (current.getLastActiveAt() != null && !timestamp.isAfter(current.getLastActiveAt())) {
                return current;
            }
            SessionDocument next = current.copy();
            next.setLastActiveAt(timestamp);
            return next;
        });
    }

    @Override
    public void updateResumeToken(String sessionId, String resumeToken) {
        records.computeIfPresent(sessionId, (id, current) -> {
            SessionDocument next = current.copy();
            next.setResumeToken(resumeToken);
            return next;
        });
    }

    @Override
    public List<SessionDocument> queryByStatus(SessionStatus status) {
        return records.values().stream()
                .filter(r -> r.getStatus() == status)
                .sorted(Comparator.comparing(SessionDocument::getCreatedAt))
                .map(SessionDocument::copy)
                .toList();
    }

    @Override
    public List<SessionDocument> queryByOwner(String owner) {
        return records.values().stream()
                .filter(r -> owner.equals(r.getOwner()))
                .sorted(Comparator.comparing(SessionDocument::getCreatedAt).reversed())
                .map(SessionDocument::copy)
                .toList();
    }

    @Override
    public List<SessionDocument> queryStaleResuming(Instant olderThan) {
        return records.values().stream()
                .filter(r -> r.getStatus() == SessionStatus.RESUMING)
                .filter(r -> r.getStatusChangedAt() != null && r.getStatusChangedAt().isBefore(olderThan))
                .map(SessionDocument::copy)
                .toList();
    }

    @Override
    public Optional<SessionDocument> get(String sessionId) {
        return Optional.ofNullable(records.get(sessionId)).map(SessionDocument::copy);
    }
}
