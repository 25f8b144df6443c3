package pretium.reporting.exceptions;

import java.util.UUID;

/**
 * Exception thrown by the job processor after a job has been marked failed, so the caller can record the failure.
 *
 * <p>
 * The original handler exception, if any, is kept as the cause.
 */
public class JobExecutionException extends RuntimeException {

    private final UUID jobId;

    public JobExecutionException(UUID jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public JobExecutionException(UUID jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
