package pretium.reporting.exceptions;

/**
 * Exception thrown when a job request is rejected before anything is persisted (unknown job type, missing or malformed
 * payload).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
