package pretium.reporting.exceptions;

/**
 * Exception thrown when the worker trigger is invoked without a usable worker URL configured.
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 500 by the trigger endpoint.
 */
public class TriggerConfigurationException extends RuntimeException {

    public TriggerConfigurationException(String message) {
        super(message);
    }

    public TriggerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
