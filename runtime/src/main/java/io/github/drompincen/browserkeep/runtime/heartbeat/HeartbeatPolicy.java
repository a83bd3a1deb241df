package io.github.drompincen.browserkeep.runtime.heartbeat;

import java.time.Duration;

/**
 * @param maxSessionAge hard cap on a live session's age regardless of heartbeats; null disables it
 */
public record HeartbeatPolicy(Duration timeout, Duration sweepInterval, Duration maxSessionAge) {

    public HeartbeatPolicy {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("heartbeat timeout must be positive");
        }
        if (sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeat sweep interval must be positive");
        }
        if (sweepInterval.multipliedBy(2).compareTo(timeout) > 0) {
            throw new IllegalArgumentException("heartbeat sweep interval " + sweepInterval
                    + " must be at most half the timeout " + timeout);
        }
        if (maxSessionAge != null && (maxSessionAge.isZero() || maxSessionAge.isNegative())) {
            throw new IllegalArgumentException("max session age must be positive when set");
        }
    }
}
