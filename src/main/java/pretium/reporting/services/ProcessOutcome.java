package pretium.reporting.services;

/**
 * Result of {@link JobProcessor#process}. Failures are not an outcome: they are recorded on the job and rethrown as
 * {@link pretium.reporting.exceptions.JobExecutionException}.
 */
public enum ProcessOutcome {
    /** Handler returned and the result was stored. */
    COMPLETED,
    /** Another worker claimed the job first; nothing was done. */
    SKIPPED
}
