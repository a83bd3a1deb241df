package io.github.drompincen.browserkeep.gateway.config;

import io.github.drompincen.browserkeep.runtime.heartbeat.HeartbeatPolicy;
import io.github.drompincen.browserkeep.runtime.recovery.RecoveryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    private final EngineConfig config = new EngineConfig();

    @Test
    void zeroAgeLimitsDisableTheChecks() {
        HeartbeatPolicy heartbeat = config.heartbeatPolicy(Duration.ofSeconds(120), Duration.ofSeconds(15), Duration.ZERO);
        RecoveryPolicy recovery = config.recoveryPolicy(true, false, 4, Duration.ZERO, null, Duration.ZERO);

        assertThat(heartbeat.maxSessionAge()).isNull();
        assertThat(recovery.maxRecordAge()).isNull();
        assertThat(recovery.resumingStaleAfter()).isNull();
    }

    @Test
    void sweepSlowerThanHalfTheTimeoutFailsStartup() {
        assertThatThrownBy(() -> config.heartbeatPolicy(Duration.ofSeconds(30), Duration.ofSeconds(20), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recoveryNeedsAtLeastOneWorker() {
        assertThatThrownBy(() -> config.recoveryPolicy(true, false, 0, null, null, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
