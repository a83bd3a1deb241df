package io.github.drompincen.browserkeep.persistence.store;

import io.github.drompincen.browserkeep.persistence.document.SessionDocument;
import io.github.drompincen.browserkeep.protocol.api.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of session records, keyed by session id.
 * <p>
 * Every operation touches a single record and either applies fully or not at all. When the
 * backing store cannot be reached, implementations throw {@link StoreUnavailableException}.
 * Returned documents are detached copies; mutating them has no effect on the store.
 */
public interface SessionStore {

    /**
     * Inserts a new record. Fails with {@link IllegalStateException} if the id already exists.
     */
    void create(SessionDocument record);

    /**
     * Compare-and-set on the status: applies {@code from -> to} only when the stored status
     * equals {@code from}. This is the only coordination primitive between engine components
     * and between process instances.
     *
     * @return true when the transition was applied, false when the record is missing or its
     *         status no longer matches {@code from}
     * @throws IllegalArgumentException when {@code from -> to} is not an edge of the state graph
     */
    boolean updateStatus(String sessionId, SessionStatus from, SessionStatus to);

    /**
     * Advances {@code lastActiveAt} to {@code max(current, timestamp)}. No-op for unknown ids.
     */
    void touch(String sessionId, Instant timestamp);

    void updateResumeToken(String sessionId, String resumeToken);

    List<SessionDocument> queryByStatus(SessionStatus status);

    List<SessionDocument> queryByOwner(String owner);

    /**
     * Records in {@code RESUMING} whose last status change happened before {@code olderThan}.
     */
    List<SessionDocument> queryStaleResuming(Instant olderThan);

    Optional<SessionDocument> get(String sessionId);

    static void requireEdge(SessionStatus from, SessionStatus to) {
        if (from == null || !from.canTransitionTo(to)) {
            throw new IllegalArgumentException("Illegal session transition " + from + " -> " + to);
        }
    }
}
