package pretium.reporting.exceptions;

/**
 * Exception thrown when a report draft cannot be produced (a photo batch failed at the model).
 *
 * <p>
 * Extends RuntimeException per project standards. Fails the {@code generate_report} job with its message.
 */
public class ReportGenerationException extends RuntimeException {

    public ReportGenerationException(String message) {
        super(message);
    }

    public ReportGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
