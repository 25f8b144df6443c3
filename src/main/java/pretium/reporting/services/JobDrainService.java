package pretium.reporting.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import pretium.reporting.observability.JobMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pulls and processes jobs until the queue is empty.
 *
 * <p>
 * A job that fails is counted and its message collected; the loop moves on. A store error while fetching the next job
 * ends the loop, because nothing more can be claimed. Several drain loops may run at once (one per trigger); the claim
 * in {@link JobStore} keeps them from processing the same job.
 *
 * <p>
 * <b>Configuration:</b> {@code jobs.drain.pause-between-jobs} (ISO-8601 duration, default {@code PT0S}) spaces out
 * handler calls when downstream APIs need pacing.
 */
@ApplicationScoped
public class JobDrainService {

    private static final Logger LOG = Logger.getLogger(JobDrainService.class);

    @Inject
    QueueClient queueClient;

    @Inject
    JobProcessor jobProcessor;

    @Inject
    JobMetrics metrics;

    @ConfigProperty(
            name = "jobs.drain.pause-between-jobs",
            defaultValue = "PT0S")
    Duration pauseBetweenJobs;

    /**
     * Drains the queue.
     *
     * @return number of jobs taken and the errors collected on the way
     */
    public DrainResult drainAll() {
        int processed = 0;
        List<String> errors = new ArrayList<>();
        LOG.info("Starting queue drain");

        while (true) {
            Optional<ClaimedJob> next;
            try {
                next = queueClient.getNext();
            } catch (RuntimeException e) {
                LOG.errorf(e, "Error getting next job, stopping drain after %d jobs", processed);
                errors.add("Error getting next job: " + e.getMessage());
                break;
            }
            if (next.isEmpty()) {
                break;
            }

            ClaimedJob job = next.get();
            try {
                jobProcessor.process(job);
            } catch (RuntimeException e) {
                errors.add("Job " + job.id() + ": " + e.getMessage());
            }
            processed++;

            if (!pause()) {
                errors.add("Drain interrupted after " + processed + " jobs");
                break;
            }
        }

        metrics.recordDrained(processed);
        LOG.infof("Queue drain finished: %d processed, %d errors", processed, errors.size());
        return new DrainResult(processed, errors);
    }

    private boolean pause() {
        if (pauseBetweenJobs == null || pauseBetweenJobs.isZero() || pauseBetweenJobs.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(pauseBetweenJobs.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Drain interrupted while pausing between jobs");
            return false;
        }
    }
}
