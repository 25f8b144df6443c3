package pretium.reporting.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceException;
import org.jboss.logging.Logger;
import pretium.reporting.data.models.Job;
import pretium.reporting.data.models.Job.JobStatus;
import pretium.reporting.exceptions.StoreUnavailableException;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Persistence and state transitions for {@link Job} rows.
 *
 * <p>
 * Every operation runs in its own {@code REQUIRES_NEW} transaction and commits before returning, so no transaction or
 * row lock is ever held while a handler runs. Storage and transaction failures surface as
 * {@link StoreUnavailableException}.
 *
 * <p>
 * <b>Transitions:</b>
 * <ul>
 * <li>{@code queued -> processing}: a single conditional UPDATE ({@code WHERE status = 'QUEUED'}); the affected row
 * count decides the race, so exactly one concurrent caller wins</li>
 * <li>{@code processing -> completed}: row locked, refused unless currently processing</li>
 * <li>{@code queued|processing -> failed}: row locked, refused from a terminal state</li>
 * </ul>
 * A refused transition leaves the row untouched and is logged at ERROR; status never moves backwards.
 */
@ApplicationScoped
public class JobStore {

    private static final Logger LOG = Logger.getLogger(JobStore.class);

    /**
     * Upper bound on stored error messages; longer messages are cut and marked.
     */
    static final int MAX_ERROR_LENGTH = 10_000;

    static final String TRUNCATION_MARKER = "... [truncated]";

    private final String workerId = resolveWorkerId();

    /**
     * Inserts a queued job.
     *
     * @param jobType
     *            wire tag of the job type; not checked here
     * @param payload
     *            handler input
     * @return the persisted job
     */
    public Job create(String jobType, Map<String, Object> payload) {
        return inTransaction("create", () -> {
            Instant now = Instant.now();
            Job job = new Job();
            job.id = UUID.randomUUID();
            job.jobType = jobType;
            job.payload = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
            job.status = JobStatus.QUEUED;
            job.createdAt = now;
            job.updatedAt = now;
            job.persist();
            LOG.infof("Created job %s (type: %s)", job.id, jobType);
            return job;
        });
    }

    /**
     * Attempts the {@code queued -> processing} compare-and-set for one job.
     *
     * @param id
     *            job to claim
     * @return {@link ClaimResult#CLAIMED} if this call moved the row, {@link ClaimResult#ALREADY_TAKEN} if the row
     *         was not queued (claimed elsewhere, already terminal, or missing)
     */
    public ClaimResult transitionToProcessing(UUID id) {
        return claimRow(id).isPresent() ? ClaimResult.CLAIMED : ClaimResult.ALREADY_TAKEN;
    }

    /**
     * Claims a job read earlier and returns it as claimed by this worker. The claimed view is built from {@code job}
     * and the claim timestamp, so nothing is read back after the claim commits.
     *
     * @param job
     *            a job observed in {@code queued}
     * @return the claimed job, empty if the row was no longer queued
     */
    public Optional<ClaimedJob> claim(Job job) {
        return claimRow(job.id).map(
                startedAt -> new ClaimedJob(job.id, job.jobType, job.payload, job.createdAt, startedAt, workerId));
    }

    private Optional<Instant> claimRow(UUID id) {
        return inTransaction("claim", () -> {
            Instant now = Instant.now();
            int updated = Job.update(
                    "status = ?1, startedAt = ?2, updatedAt = ?2, claimedBy = ?3 where id = ?4 and status = ?5",
                    JobStatus.PROCESSING, now, workerId, id, JobStatus.QUEUED);
            if (updated == 1) {
                LOG.debugf("Claimed job %s for worker %s", id, workerId);
                return Optional.of(now);
            }
            LOG.debugf("Job %s was not queued, claim skipped", id);
            return Optional.<Instant> empty();
        });
    }

    /**
     * Records a successful run.
     *
     * @param id
     *            job to complete
     * @param result
     *            handler output; null is stored as an empty map
     * @return true if the job was processing and is now completed
     */
    public boolean transitionToCompleted(UUID id, Map<String, Object> result) {
        return inTransaction("complete", () -> {
            Job job = Job.findById(id, LockModeType.PESSIMISTIC_WRITE);
            if (job == null) {
                LOG.errorf("Cannot complete job %s: not found", id);
                return false;
            }
            if (job.status != JobStatus.PROCESSING) {
                LOG.errorf("Refusing to complete job %s from status %s", id, job.status);
                return false;
            }
            Instant now = Instant.now();
            job.status = JobStatus.COMPLETED;
            job.result = result == null ? new LinkedHashMap<>() : new LinkedHashMap<>(result);
            job.error = null;
            job.finishedAt = now;
            job.updatedAt = now;
            return true;
        });
    }

    /**
     * Records a failure. Allowed from {@code queued} (failed before claim) and {@code processing}.
     *
     * @param id
     *            job to fail
     * @param errorMessage
     *            message stored in {@code error}
     * @return true if the job is now failed by this call
     */
    public boolean transitionToFailed(UUID id, String errorMessage) {
        return inTransaction("fail", () -> {
            Job job = Job.findById(id, LockModeType.PESSIMISTIC_WRITE);
            if (job == null) {
                LOG.errorf("Cannot fail job %s: not found", id);
                return false;
            }
            if (job.status.isTerminal()) {
                LOG.errorf("Refusing to fail job %s from terminal status %s", id, job.status);
                return false;
            }
            Instant now = Instant.now();
            job.status = JobStatus.FAILED;
            job.error = truncateError(errorMessage);
            job.result = null;
            job.finishedAt = now;
            job.updatedAt = now;
            LOG.warnf("Job %s failed: %s", id, job.error);
            return true;
        });
    }

    /**
     * Returns the oldest queued job without changing it. Ties on {@code created_at} are broken by id.
     */
    public Optional<Job> nextQueued() {
        return inTransaction("next queued", Job::findOldestQueued);
    }

    /**
     * Claims the oldest queued job. A candidate lost to a concurrent worker is skipped and the next oldest one is
     * tried, until a claim is won or nothing is queued.
     *
     * @return the claimed job, empty when the queue is drained
     */
    public Optional<ClaimedJob> claimNext() {
        while (true) {
            Optional<Job> candidate = nextQueued();
            if (candidate.isEmpty()) {
                return Optional.empty();
            }
            Optional<ClaimedJob> claimed = claim(candidate.get());
            if (claimed.isPresent()) {
                return claimed;
            }
            LOG.debugf("Lost claim race for job %s, trying next candidate", candidate.get().id);
        }
    }

    public Optional<Job> findById(UUID id) {
        return inTransaction("find", () -> Job.<Job> findByIdOptional(id));
    }

    public long countByStatus(JobStatus status) {
        return inTransaction("count", () -> Job.countByStatus(status));
    }

    /**
     * Identifier recorded in {@code claimed_by} for jobs claimed by this process (hostname:pid).
     */
    public String getWorkerId() {
        return workerId;
    }

    private <T> T inTransaction(String operation, Callable<T> work) {
        try {
            return QuarkusTransaction.requiringNew().call(work);
        } catch (PersistenceException | QuarkusTransactionException e) {
            LOG.errorf(e, "Job store %s failed", operation);
            throw new StoreUnavailableException("Job store unavailable during " + operation + ": " + e.getMessage(),
                    e);
        }
    }

    static String truncateError(String errorMessage) {
        if (errorMessage == null) {
            return "Unknown error";
        }
        if (errorMessage.length() <= MAX_ERROR_LENGTH) {
            return errorMessage;
        }
        return errorMessage.substring(0, MAX_ERROR_LENGTH - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
    }

    private static String resolveWorkerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        return host + ":" + ProcessHandle.current().pid();
    }
}
