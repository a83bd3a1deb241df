package io.github.drompincen.browserkeep.runtime.error;

/**
 * The driver could not spin a handle for the target after every attempt. No session record exists.
 */
public class DriverSpinFailureException extends SessionException {

    public DriverSpinFailureException(String targetUrl, int attempts, Throwable cause) {
        super("driver_spin_failed",
                "Could not start browser for " + targetUrl + " after " + attempts + " attempt(s)", cause);
    }
}
