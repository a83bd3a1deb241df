package io.github.drompincen.browserkeep.runtime.error;

/**
 * Another party changed the record first. The loser drops its work; this never reaches a client.
 */
public class ConcurrentClaimLostException extends SessionException {

    public ConcurrentClaimLostException(String sessionId, String reason) {
        super("claim_lost", "Claim on session " + sessionId + " lost: " + reason);
    }
}
