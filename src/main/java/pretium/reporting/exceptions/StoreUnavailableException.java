package pretium.reporting.exceptions;

/**
 * Exception thrown when the job store cannot be read or written (connection loss, transaction failure).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 503 Service Unavailable on the enqueue boundary; stops
 * a drain loop when raised while fetching the next job.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
