package io.github.drompincen.browserkeep.protocol.api;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class SessionStatusTest {

    @Test
    void allStatusValuesExist() {
        assertThat(SessionStatus.values()).containsExactly(
                SessionStatus.ACTIVE,
                SessionStatus.RESUMING,
                SessionStatus.COMPLETED,
                SessionStatus.FAILED,
                SessionStatus.ABANDONED);
    }

    @Test
    void terminalStatesAreCompletedFailedAndAbandoned() {
        assertThat(EnumSet.allOf(SessionStatus.class).stream().filter(SessionStatus::isTerminal))
                .containsExactlyInAnyOrder(SessionStatus.COMPLETED, SessionStatus.FAILED, SessionStatus.ABANDONED);
    }

    @Test
    void activeMayMoveToEveryTerminalStateAndToResuming() {
        assertThat(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.COMPLETED)).isTrue();
        assertThat(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.FAILED)).isTrue();
        assertThat(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.ABANDONED)).isTrue();
        assertThat(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.RESUMING)).isTrue();
        assertThat(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.ACTIVE)).isFalse();
    }

    @Test
    void resumingOnlyResolvesToActiveOrFailed() {
        assertThat(SessionStatus.RESUMING.canTransitionTo(SessionStatus.ACTIVE)).isTrue();
        assertThat(SessionStatus.RESUMING.canTransitionTo(SessionStatus.FAILED)).isTrue();
        assertThat(SessionStatus.RESUMING.canTransitionTo(SessionStatus.COMPLETED)).isFalse();
        assertThat(SessionStatus.RESUMING.canTransitionTo(SessionStatus.ABANDONED)).isFalse();
    }

    @Test
    void terminalStatesHaveNoOutgoingEdges() {
        for (SessionStatus from : EnumSet.of(SessionStatus.COMPLETED, SessionStatus.FAILED, SessionStatus.ABANDONED)) {
            for (SessionStatus to : SessionStatus.values()) {
                assertThat(from.canTransitionTo(to)).as("%s -> %s", from, to).isFalse();
            }
        }
    }

    @Test
    void nullTargetIsRejected() {
        assertThat(SessionStatus.ACTIVE.canTransitionTo(null)).isFalse();
    }

    @Test
    void terminationOutcomeMapsToTerminalStatus() {
        assertThat(TerminationOutcome.COMPLETED.toStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(TerminationOutcome.FAILED.toStatus()).isEqualTo(SessionStatus.FAILED);
    }
}
