package io.github.drompincen.browserkeep.runtime.error;

/**
 * Base of the engine's failures. {@link #getCode()} is stable and safe to expose to API clients.
 */
public abstract class SessionException extends RuntimeException {

    private final String code;

    protected SessionException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected SessionException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
