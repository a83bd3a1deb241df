package io.github.drompincen.browserkeep.persistence.store;

import io.github.drompincen.browserkeep.persistence.document.SessionDocument;
import io.github.drompincen.browserkeep.protocol.api.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySessionStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore(Clock.fixed(T0.plusSeconds(5), ZoneOffset.UTC));
    }

    @Test
    void createRejectsDuplicateIds() {
        store.create(record("s1", SessionStatus.ACTIVE));

        assertThatThrownBy(() -> store.create(record("s1", SessionStatus.ACTIVE)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void updateStatusAppliesOnlyWhenFromStatusMatches() {
        store.create(record("s1", SessionStatus.ACTIVE));

        assertThat(store.updateStatus("s1", SessionStatus.ACTIVE, SessionStatus.RESUMING)).isTrue();
        assertThat(store.updateStatus("s1", SessionStatus.ACTIVE, SessionStatus.COMPLETED)).isFalse();

        SessionDocument stored = store.get("s1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SessionStatus.RESUMING);
        assertThat(stored.getStatusChangedAt()).isEqualTo(T0.plusSeconds(5));
    }

    @Test
    void updateStatusOnMissingRecordReturnsFalse() {
        assertThat(store.updateStatus("nope", SessionStatus.ACTIVE, SessionStatus.FAILED)).isFalse();
    }

    @Test
    void updateStatusRejectsEdgesOutsideTheStateGraph() {
        store.create(record("s1", SessionStatus.COMPLETED));

        assertThatThrownBy(() -> store.updateStatus("s1", SessionStatus.COMPLETED, SessionStatus.ACTIVE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.updateStatus("s1", SessionStatus.RESUMING, SessionStatus.ABANDONED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void touchNeverMovesLastActiveAtBackwards() {
        store.create(record("s1", SessionStatus.ACTIVE));

        store.touch("s1", T0.plusSeconds(30));
        store.touch("s1", T0.plusSeconds(10));

        assertThat(store.get("s1").orElseThrow().getLastActiveAt()).isEqualTo(T0.plusSeconds(30));
    }

    @Test
    void touchOfUnknownIdIsNoOp() {
        store.touch("ghost", T0);

        assertThat(store.get("ghost")).isEmpty();
    }

    @Test
    void returnedRecordsAreDetachedCopies() {
        store.create(record("s1", SessionStatus.ACTIVE));

        store.get("s1").orElseThrow().setStatus(SessionStatus.FAILED);

        assertThat(store.get("s1").orElseThrow().getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void queriesFilterByStatusOwnerAndStaleness() {
        store.create(record("s1", SessionStatus.ACTIVE));
        SessionDocument other = record("s2", SessionStatus.ACTIVE);
        other.setOwner("u2");
        store.create(other);
        store.updateStatus("s2", SessionStatus.ACTIVE, SessionStatus.RESUMING);

        assertThat(store.queryByStatus(SessionStatus.ACTIVE)).extracting(SessionDocument::getSessionId)
                .containsExactly("s1");
        assertThat(store.queryByOwner("u2")).extracting(SessionDocument::getSessionId)
                .containsExactly("s2");
        assertThat(store.queryStaleResuming(T0.plusSeconds(6))).extracting(SessionDocument::getSessionId)
                .containsExactly("s2");
        assertThat(store.queryStaleResuming(T0.plusSeconds(5))).isEmpty();
    }

    @Test
    void updateResumeTokenKeepsOtherFields() {
        store.create(record("s1", SessionStatus.ACTIVE));

        store.updateResumeToken("s1", "ckpt-42");

        SessionDocument stored = store.get("s1").orElseThrow();
        assertThat(stored.getResumeToken()).isEqualTo("ckpt-42");
        assertThat(stored.getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        store.create(record("s1", SessionStatus.ACTIVE));
        int contenders = 16;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                Callable<Boolean> claim = () -> {
                    start.await();
                    return store.updateStatus("s1", SessionStatus.ACTIVE, SessionStatus.RESUMING);
                };
                results.add(pool.submit(claim));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> f : results) {
                if (f.get()) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    private SessionDocument record(String id, SessionStatus status) {
        SessionDocument doc = new SessionDocument();
        doc.setSessionId(id);
        doc.setOwner("u1");
        doc.setTargetUrl("https://x");
        doc.setStatus(status);
        doc.setCreatedAt(T0);
        doc.setLastActiveAt(T0);
        return doc;
    }
}
