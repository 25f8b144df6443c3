package pretium.reporting.services;

import java.util.List;

/**
 * Summary of one {@link JobDrainService#drainAll()} run.
 *
 * @param processedCount
 *            jobs taken off the queue, successful or not
 * @param errors
 *            one message per job whose processing threw, plus {@code Error getting next job: ...} when fetching
 *            stopped the loop
 */
public record DrainResult(int processedCount, List<String> errors) {

    public DrainResult {
        errors = List.copyOf(errors);
    }
}
