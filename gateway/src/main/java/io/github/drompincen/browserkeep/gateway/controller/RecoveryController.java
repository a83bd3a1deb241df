package io.github.drompincen.browserkeep.gateway.controller;

import io.github.drompincen.browserkeep.protocol.api.RecoveryReportDto;
import io.github.drompincen.browserkeep.runtime.recovery.RecoveryCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/recovery")
public class RecoveryController {

    private final RecoveryCoordinator recoveryCoordinator;

    public RecoveryController(RecoveryCoordinator recoveryCoordinator) {
        this.recoveryCoordinator = recoveryCoordinator;
    }

    @PostMapping("/runs")
    public RecoveryReportDto run() {
        return recoveryCoordinator.runOnce();
    }

    @GetMapping("/runs/last")
    public ResponseEntity<RecoveryReportDto> last() {
        return recoveryCoordinator.lastReport()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
