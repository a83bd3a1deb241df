package io.github.drompincen.browserkeep.persistence.store;

/**
 * The session store could not be reached. The operation did not apply and may be retried.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
