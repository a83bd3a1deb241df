package io.github.drompincen.browserkeep.runtime.driver;

import java.time.Duration;

/**
 * Deadlines and retry settings for driver calls. The spin backoff doubles after every failed attempt.
 */
public record DriverPolicy(
        int callThreads,
        Duration spinDeadline,
        Duration resumeDeadline,
        Duration releaseDeadline,
        int spinAttempts,
        Duration spinBackoff
) {
    public DriverPolicy {
        if (callThreads < 1) throw new IllegalArgumentException("callThreads must be >= 1");
        if (spinAttempts < 1) throw new IllegalArgumentException("spinAttempts must be >= 1");
        requirePositive("spinDeadline", spinDeadline);
        requirePositive("resumeDeadline", resumeDeadline);
        requirePositive("releaseDeadline", releaseDeadline);
        if (spinBackoff == null || spinBackoff.isNegative()) {
            throw new IllegalArgumentException("spinBackoff must not be negative");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
