package io.github.drompincen.browserkeep.persistence.store;

import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.browserkeep.persistence.document.SessionDocument;
import io.github.drompincen.browserkeep.persistence.repository.SessionRepository;
import io.github.drompincen.browserkeep.protocol.api.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.springframework.data.mongodb.core.query.Criteria.where;

public class MongoSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(MongoSessionStore.class);

    private final MongoTemplate mongoTemplate;
    private final SessionRepository sessionRepository;
    private final Clock clock;

    public MongoSessionStore(MongoTemplate mongoTemplate, SessionRepository sessionRepository, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.sessionRepository = sessionRepository;
        this.clock = clock;
    }

    @Override
    public void create(SessionDocument record) {
        if (record.getStatusChangedAt() == null) {
            record.setStatusChangedAt(record.getCreatedAt());
        }
        execute("create", () -> {
            try {
                return sessionRepository.insert(record);
            } catch (DuplicateKeyException e) {
                throw new IllegalStateException("Session id already exists: " + record.getSessionId(), e);
            }
        });
    }

    @Override
    public boolean updateStatus(String sessionId, SessionStatus from, SessionStatus to) {
        SessionStore.requireEdge(from, to);
        Query query = Query.query(where("_id").is(sessionId).and("status").is(from));
        Update update = new Update()
                .set("status", to)
                .set("statusChangedAt", clock.instant());
        UpdateResult result = execute("updateStatus",
                () -> mongoTemplate.updateFirst(query, update, SessionDocument.class));
        boolean applied = result.getModifiedCount() == 1;
        if (!applied) {
            log.debug("Status CAS {} -> {} not applied for session {}", from, to, sessionId);
        }
        return applied;
    }

    @Override
    public void touch(String sessionId, Instant timestamp) {
        Query query = Query.query(where("_id").is(sessionId));
        Update update = new Update().max("lastActiveAt", timestamp);
        execute("touch", () -> mongoTemplate.updateFirst(query, update, SessionDocument.class));
    }

    @Override
    public void updateResumeToken(String sessionId, String resumeToken) {
        Query query = Query.query(where("_id").is(sessionId));
        Update update = Update.update("resumeToken", resumeToken);
        execute("updateResumeToken", () -> mongoTemplate.updateFirst(query, update, SessionDocument.class));
    }

    @Override
    public List<SessionDocument> queryByStatus(SessionStatus status) {
        return execute("queryByStatus", () -> sessionRepository.findByStatus(status));
    }

    @Override
    public List<SessionDocument> queryByOwner(String owner) {
        return execute("queryByOwner", () -> sessionRepository.findByOwnerOrderByCreatedAtDesc(owner));
    }

    @Override
    public List<SessionDocument> queryStaleResuming(Instant olderThan) {
        return execute("queryStaleResuming",
                () -> sessionRepository.findByStatusAndStatusChangedAtLessThan(SessionStatus.RESUMING, olderThan));
    }

    @Override
    public Optional<SessionDocument> get(String sessionId) {
        return execute("get", () -> sessionRepository.findById(sessionId));
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException
                 | MongoSocketException | MongoTimeoutException e) {
            throw new StoreUnavailableException("Session store unavailable during " + operation, e);
        }
    }
}
