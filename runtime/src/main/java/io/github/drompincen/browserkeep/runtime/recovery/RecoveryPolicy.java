package io.github.drompincen.browserkeep.runtime.recovery;

import java.time.Duration;

/**
 * @param maxRecordAge       records created longer ago are failed instead of resumed; null disables
 * @param resumingStaleAfter RESUMING records untouched for longer are failed; null disables the sweep
 * @param orphanGrace        ACTIVE records touched more recently than this are left to their owner
 */
public record RecoveryPolicy(
        boolean onStartup,
        boolean periodic,
        int parallelism,
        Duration maxRecordAge,
        Duration resumingStaleAfter,
        Duration orphanGrace
) {
    public RecoveryPolicy {
        if (parallelism < 1) throw new IllegalArgumentException("recovery parallelism must be >= 1");
        if (orphanGrace == null) orphanGrace = Duration.ZERO;
        if (orphanGrace.isNegative()) throw new IllegalArgumentException("orphan grace must not be negative");
        if (resumingStaleAfter != null && (resumingStaleAfter.isZero() || resumingStaleAfter.isNegative())) {
            throw new IllegalArgumentException("resuming-stale-after must be positive when set");
        }
    }
}
