package io.github.drompincen.browserkeep.gateway.controller;

import io.github.drompincen.browserkeep.protocol.api.RecoveryReportDto;
import io.github.drompincen.browserkeep.runtime.recovery.RecoveryCoordinator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecoveryControllerTest {

    @Mock
    private RecoveryCoordinator recoveryCoordinator;

    @InjectMocks
    private RecoveryController controller;

    private final RecoveryReportDto report = new RecoveryReportDto("r1", Instant.parse("2025-01-15T10:00:00Z"),
            Instant.parse("2025-01-15T10:00:01Z"), 3, 2, 1, 1, 1, 0);

    @Test
    void runTriggersOnePass() {
        when(recoveryCoordinator.runOnce()).thenReturn(report);

        assertThat(controller.run()).isEqualTo(report);
    }

    @Test
    void lastReturns404BeforeAnyRun() {
        when(recoveryCoordinator.lastReport()).thenReturn(Optional.empty());

        ResponseEntity<RecoveryReportDto> response = controller.last();

        assertThat(response.getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void lastReturnsMostRecentReport() {
        when(recoveryCoordinator.lastReport()).thenReturn(Optional.of(report));

        assertThat(controller.last().getBody()).isEqualTo(report);
    }
}
