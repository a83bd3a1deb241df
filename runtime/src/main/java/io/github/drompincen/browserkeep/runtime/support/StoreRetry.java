package io.github.drompincen.browserkeep.runtime.support;

import io.github.drompincen.browserkeep.persistence.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry of store calls that failed with {@link StoreUnavailableException}. The backoff
 * doubles after every attempt; the last failure is rethrown unchanged.
 */
public class StoreRetry {

    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);

    private final int attempts;
    private final Duration backoff;

    public StoreRetry(int attempts, Duration backoff) {
        if (attempts < 1) throw new IllegalArgumentException("attempts must be >= 1");
        if (backoff == null || backoff.isNegative()) throw new IllegalArgumentException("backoff must not be negative");
        this.attempts = attempts;
        this.backoff = backoff;
    }

    public <T> T call(String operation, String sessionId, Supplier<T> action) {
        long delayMs = backoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (StoreUnavailableException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.warn("Store unavailable during {} for session {} (attempt {}/{}), retrying in {} ms",
                        operation, sessionId, attempt, attempts, delayMs);
                sleep(delayMs, e);
                delayMs *= 2;
            }
        }
    }

    public void run(String operation, String sessionId, Runnable action) {
        call(operation, sessionId, () -> {
            action.run();
            return null;
        });
    }

    public int getAttempts() {
        return attempts;
    }

    private static void sleep(long millis, StoreUnavailableException pending) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw pending;
        }
    }
}
