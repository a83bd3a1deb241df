package io.github.drompincen.browserkeep.gateway.error;

import io.github.drompincen.browserkeep.persistence.store.StoreUnavailableException;
import io.github.drompincen.browserkeep.runtime.error.DriverSpinFailureException;
import io.github.drompincen.browserkeep.runtime.error.SessionCapacityExceededException;
import io.github.drompincen.browserkeep.runtime.error.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine failures to problem responses. Retryable conditions carry {@code Retry-After}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final long retryAfterSeconds;

    public ApiExceptionHandler(@Value("${browserkeep.api.retry-after-seconds:5}") long retryAfterSeconds) {
        this.retryAfterSeconds = retryAfterSeconds;
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ProblemResponse> handleNotFound(SessionNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(SessionCapacityExceededException.class)
    public ResponseEntity<ProblemResponse> handleCapacity(SessionCapacityExceededException ex) {
        return retryable(HttpStatus.TOO_MANY_REQUESTS, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(DriverSpinFailureException.class)
    public ResponseEntity<ProblemResponse> handleSpinFailure(DriverSpinFailureException ex) {
        log.warn("{}", ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ProblemResponse> handleStoreUnavailable(StoreUnavailableException ex) {
        log.warn("{}", ex.getMessage());
        return retryable(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable", "Session store temporarily unavailable");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemResponse> handleBadRequest(IllegalArgumentException ex) {
        return problem(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return problem(HttpStatus.BAD_REQUEST, "invalid_request", "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatus status = HttpStatus.valueOf(errorResponse.getStatusCode().value());
            return problem(status, null, errorResponse.getBody().getDetail());
        }
        log.error("Unhandled error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex.getMessage());
    }

    private ResponseEntity<ProblemResponse> retryable(HttpStatus status, String code, String detail) {
        return ResponseEntity.status(status)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(ProblemResponse.of(status, code, detail));
    }

    private static ResponseEntity<ProblemResponse> problem(HttpStatus status, String code, String detail) {
        return ResponseEntity.status(status).body(ProblemResponse.of(status, code, detail));
    }
}
