package pretium.reporting.exceptions;

/**
 * Thrown by handlers registered for job types whose processing does not exist yet.
 */
public class JobNotImplementedException extends RuntimeException {

    public JobNotImplementedException(String message) {
        super(message);
    }
}
