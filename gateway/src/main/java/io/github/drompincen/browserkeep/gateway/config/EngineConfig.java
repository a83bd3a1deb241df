package io.github.drompincen.browserkeep.gateway.config;

import io.github.drompincen.browserkeep.runtime.driver.DriverPolicy;
import io.github.drompincen.browserkeep.runtime.heartbeat.HeartbeatPolicy;
import io.github.drompincen.browserkeep.runtime.recovery.RecoveryPolicy;
import io.github.drompincen.browserkeep.runtime.session.SessionRegistry;
import io.github.drompincen.browserkeep.runtime.support.StoreRetry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Engine settings under {@code browserkeep.*}. Invalid combinations fail startup.
 */
@Configuration
public class EngineConfig {

    @Bean
    SessionRegistry sessionRegistry(@Value("${browserkeep.sessions.max-live:10}") int maxLive) {
        return new SessionRegistry(maxLive);
    }

    @Bean
    DriverPolicy driverPolicy(@Value("${browserkeep.driver.call-threads:16}") int callThreads,
                              @Value("${browserkeep.driver.spin-deadline:PT60S}") Duration spinDeadline,
                              @Value("${browserkeep.driver.resume-deadline:PT60S}") Duration resumeDeadline,
                              @Value("${browserkeep.driver.release-deadline:PT10S}") Duration releaseDeadline,
                              @Value("${browserkeep.driver.spin-attempts:3}") int spinAttempts,
                              @Value("${browserkeep.driver.spin-backoff:PT2S}") Duration spinBackoff) {
        return new DriverPolicy(callThreads, spinDeadline, resumeDeadline, releaseDeadline, spinAttempts, spinBackoff);
    }

    @Bean
    HeartbeatPolicy heartbeatPolicy(@Value("${browserkeep.heartbeat.timeout:PT120S}") Duration timeout,
                                    @Value("${browserkeep.heartbeat.sweep-interval:PT15S}") Duration sweepInterval,
                                    @Value("${browserkeep.heartbeat.max-session-age:PT24H}") Duration maxSessionAge) {
        return new HeartbeatPolicy(timeout, sweepInterval, disabledWhenZero(maxSessionAge));
    }

    @Bean
    RecoveryPolicy recoveryPolicy(@Value("${browserkeep.recovery.on-startup:true}") boolean onStartup,
                                  @Value("${browserkeep.recovery.periodic:false}") boolean periodic,
                                  @Value("${browserkeep.recovery.parallelism:4}") int parallelism,
                                  @Value("${browserkeep.recovery.max-record-age:PT24H}") Duration maxRecordAge,
                                  @Value("${browserkeep.recovery.resuming-stale-after:#{null}}") Duration staleAfter,
                                  @Value("${browserkeep.recovery.orphan-grace:PT0S}") Duration orphanGrace) {
        return new RecoveryPolicy(onStartup, periodic, parallelism,
                disabledWhenZero(maxRecordAge), disabledWhenZero(staleAfter), orphanGrace);
    }

    @Bean
    StoreRetry storeRetry(@Value("${browserkeep.store.retry-attempts:3}") int attempts,
                          @Value("${browserkeep.store.retry-backoff:PT0.2S}") Duration backoff) {
        return new StoreRetry(attempts, backoff);
    }

    // age limits are switched off with 0
    private static Duration disabledWhenZero(Duration value) {
        return value == null || value.isZero() ? null : value;
    }
}
