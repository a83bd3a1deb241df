package io.github.drompincen.browserkeep.protocol.api;

public enum TerminateResult {
    // the call moved the session to the requested outcome
    TERMINATED,
    // the session was already terminal, nothing changed
    ALREADY_TERMINATED,
    // a recovery claim owns the record, the terminate was discarded
    SUPERSEDED
}
