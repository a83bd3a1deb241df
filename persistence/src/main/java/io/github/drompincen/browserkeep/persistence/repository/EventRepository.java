package io.github.drompincen.browserkeep.persistence.repository;

import io.github.drompincen.browserkeep.persistence.document.EventDocument;
import io.github.drompincen.browserkeep.protocol.event.EventType;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface EventRepository extends MongoRepository<EventDocument, String> {
    List<EventDocument> findBySessionIdOrderByTimestampAscSeqAsc(String sessionId);
    List<EventDocument> findBySessionIdAndType(String sessionId, EventType type);
}
