package io.github.drompincen.browserkeep.protocol.api;

/**
 * Lifecycle of a browser session record.
 * <p>
 * {@code ACTIVE} is the only started state, {@code RESUMING} is held while a recovery
 * coordinator owns the claim, and the remaining states are terminal.
 */
public enum SessionStatus {
    ACTIVE,
    RESUMING,
    COMPLETED,
    FAILED,
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABANDONED;
    }

    /**
     * Whether {@code this -> next} is an edge of the session state graph.
     */
    public boolean canTransitionTo(SessionStatus next) {
        if (next == null) return false;
        return switch (this) {
            case ACTIVE -> next == COMPLETED || next == FAILED || next == ABANDONED || next == RESUMING;
            case RESUMING -> next == ACTIVE || next == FAILED;
            case COMPLETED, FAILED, ABANDONED -> false;
        };
    }
}
