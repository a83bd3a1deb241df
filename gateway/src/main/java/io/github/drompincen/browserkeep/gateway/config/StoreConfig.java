package io.github.drompincen.browserkeep.gateway.config;

import io.github.drompincen.browserkeep.persistence.repository.SessionRepository;
import io.github.drompincen.browserkeep.persistence.store.InMemorySessionStore;
import io.github.drompincen.browserkeep.persistence.store.MongoSessionStore;
import io.github.drompincen.browserkeep.persistence.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "browserkeep.store.type", havingValue = "mongo", matchIfMissing = true)
    SessionStore mongoSessionStore(MongoTemplate mongoTemplate, SessionRepository sessionRepository, Clock clock) {
        log.info("Session records stored in MongoDB collection 'sessions'");
        return new MongoSessionStore(mongoTemplate, sessionRepository, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "browserkeep.store.type", havingValue = "memory")
    SessionStore inMemorySessionStore(Clock clock) {
        log.warn("Session records kept in memory only; they will not survive a restart");
        return new InMemorySessionStore(clock);
    }
}
