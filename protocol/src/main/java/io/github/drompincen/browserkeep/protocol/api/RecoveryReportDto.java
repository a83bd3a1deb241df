package io.github.drompincen.browserkeep.protocol.api;

import java.time.Instant;

public record RecoveryReportDto(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        int candidates,
        int claimed,
        int resumed,
        int failed,
        int skipped,
        int staleReclaimed
) {}
