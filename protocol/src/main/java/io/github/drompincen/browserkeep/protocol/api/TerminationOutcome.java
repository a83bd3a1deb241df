package io.github.drompincen.browserkeep.protocol.api;

public enum TerminationOutcome {
    COMPLETED,
    FAILED;

    public SessionStatus toStatus() {
        return this == COMPLETED ? SessionStatus.COMPLETED : SessionStatus.FAILED;
    }
}
