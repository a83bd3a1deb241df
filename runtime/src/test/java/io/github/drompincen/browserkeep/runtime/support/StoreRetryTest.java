package io.github.drompincen.browserkeep.runtime.support;

import io.github.drompincen.browserkeep.persistence.store.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoreRetryTest {

    private final StoreRetry retry = new StoreRetry(3, Duration.ofMillis(1));

    @Test
    void retriesUntilStoreComesBack() {
        AtomicInteger calls = new AtomicInteger();

        String result = retry.call("touch", "s1", () -> {
            if (calls.incrementAndGet() < 3) throw new StoreUnavailableException("down", null);
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void rethrowsAfterLastAttempt() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.run("touch", "s1", () -> {
            calls.incrementAndGet();
            throw new StoreUnavailableException("down", null);
        })).isInstanceOf(StoreUnavailableException.class);

        assertThat(calls).hasValue(3);
    }

    @Test
    void otherFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.run("touch", "s1", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void rejectsNonPositiveAttempts() {
        assertThatThrownBy(() -> new StoreRetry(0, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
