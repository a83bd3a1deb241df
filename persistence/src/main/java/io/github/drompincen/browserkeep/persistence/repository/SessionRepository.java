package io.github.drompincen.browserkeep.persistence.repository;

import io.github.drompincen.browserkeep.persistence.document.SessionDocument;
import io.github.drompincen.browserkeep.protocol.api.SessionStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface SessionRepository extends MongoRepository<SessionDocument, String> {
    List<SessionDocument> findByStatus(SessionStatus status);
    List<SessionDocument> findByOwnerOrderByCreatedAtDesc(String owner);
    List<SessionDocument> findByStatusAndStatusChangedAtLessThan(SessionStatus status, Instant before);
}
