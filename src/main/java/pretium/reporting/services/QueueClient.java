package pretium.reporting.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import pretium.reporting.data.models.Job;
import pretium.reporting.exceptions.ValidationException;
import pretium.reporting.jobs.JobHandler;
import pretium.reporting.jobs.JobType;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for request-serving code: validates and enqueues jobs, hands the next job to workers, and answers status
 * polls.
 *
 * <p>
 * Enqueueing never runs the job. Callers that want the job picked up promptly fire the
 * {@link TriggerGateway} afterwards.
 */
@ApplicationScoped
public class QueueClient {

    private static final Logger LOG = Logger.getLogger(QueueClient.class);

    @Inject
    JobStore jobStore;

    @Inject
    JobHandlerRegistry handlerRegistry;

    /**
     * Validates and persists a queued job.
     *
     * @param jobType
     *            wire tag such as {@code generate_report}
     * @param payload
     *            handler input
     * @return id of the queued job
     * @throws ValidationException
     *             if the type is unknown or the payload is rejected; nothing is persisted
     * @throws pretium.reporting.exceptions.StoreUnavailableException
     *             if the job could not be stored
     */
    public UUID enqueue(String jobType, Map<String, Object> payload) {
        JobType type = JobType.fromWireName(jobType)
                .orElseThrow(() -> new ValidationException("Unknown job type: " + jobType));
        if (payload == null) {
            throw new ValidationException("Job payload is required");
        }
        Optional<JobHandler> handler = handlerRegistry.find(type);
        handler.ifPresent(h -> h.validatePayload(payload));

        Job job = jobStore.create(type.getWireName(), payload);
        LOG.infof("Enqueued job %s (type: %s)", job.id, type.getWireName());
        return job.id;
    }

    /**
     * Claims the oldest queued job for this worker.
     *
     * @return the claimed job, empty when nothing is queued
     */
    public Optional<ClaimedJob> getNext() {
        return jobStore.claimNext();
    }

    public Optional<Job> getJob(UUID jobId) {
        return jobStore.findById(jobId);
    }
}
