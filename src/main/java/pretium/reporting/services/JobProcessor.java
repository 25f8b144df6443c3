package pretium.reporting.services;

import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import pretium.reporting.data.models.Job;
import pretium.reporting.exceptions.JobExecutionException;
import pretium.reporting.jobs.JobHandler;
import pretium.reporting.jobs.JobType;
import pretium.reporting.observability.JobMetrics;
import pretium.reporting.observability.LoggingConfig;

import java.util.Map;
import java.util.Optional;

/**
 * Drives a single job from {@code queued} to a terminal state.
 *
 * <p>
 * <b>State machine:</b>
 * <ol>
 * <li>Claim via {@link JobStore#claim(Job)}; a lost claim returns {@link ProcessOutcome#SKIPPED}</li>
 * <li>Dispatch on {@code job_type} to the registered {@link JobHandler}</li>
 * <li>Handler returned: {@link JobStore#transitionToCompleted} with its result</li>
 * <li>Handler threw, type unknown, or no handler registered: {@link JobStore#transitionToFailed} with the message,
 * then {@link JobExecutionException} is thrown so the caller can record the failure</li>
 * </ol>
 *
 * <p>
 * There is no retry; a failed job stays failed. Each execution runs inside a {@code job.execute} span and with
 * {@code job_id}/{@code job_type} in MDC.
 */
@ApplicationScoped
public class JobProcessor {

    private static final Logger LOG = Logger.getLogger(JobProcessor.class);

    @Inject
    JobStore jobStore;

    @Inject
    JobHandlerRegistry handlerRegistry;

    @Inject
    JobMetrics metrics;

    @Inject
    Tracer tracer;

    /**
     * Claims and runs a job read from the store.
     *
     * @param job
     *            a job observed in {@code queued}
     * @return {@link ProcessOutcome#COMPLETED}, or {@link ProcessOutcome#SKIPPED} if another worker claimed it first
     * @throws JobExecutionException
     *             after the job has been marked failed
     */
    public ProcessOutcome process(Job job) {
        Optional<ClaimedJob> claimed = jobStore.claim(job);
        if (claimed.isEmpty()) {
            LOG.debugf("Job %s already taken, skipping", job.id);
            metrics.recordProcessed(String.valueOf(job.jobType), "skipped");
            return ProcessOutcome.SKIPPED;
        }
        return execute(claimed.get());
    }

    /**
     * Runs a job this worker has already claimed (for example from {@link QueueClient#getNext()}).
     *
     * @throws JobExecutionException
     *             after the job has been marked failed
     */
    public ProcessOutcome process(ClaimedJob job) {
        return execute(job);
    }

    private ProcessOutcome execute(ClaimedJob job) {
        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id().toString())
                .setAttribute("job.type", String.valueOf(job.jobType()))
                .setAttribute("job.worker", String.valueOf(job.claimedBy())).startSpan();
        Timer.Sample timer = metrics.startTimer();
        boolean ownsOrigin = LoggingConfig.setRequestOriginIfAbsent("JobType." + job.jobType());

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(job.id());
            LoggingConfig.setJobType(job.jobType());
            LoggingConfig.setWorkerId(job.claimedBy());

            JobHandler handler = resolveHandler(job, span);
            Map<String, Object> result;
            try {
                result = handler.execute(job.id(), job.payload());
            } catch (Exception e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                span.recordException(e);
                span.addEvent("job.failed");
                span.setStatus(StatusCode.ERROR, message);
                LOG.errorf(e, "Job %s (type: %s) failed", job.id(), job.jobType());
                fail(job, message);
                throw new JobExecutionException(job.id(), message, e);
            }

            if (!jobStore.transitionToCompleted(job.id(), result)) {
                metrics.recordProcessed(job.jobType(), "conflict");
                throw new JobExecutionException(job.id(),
                        "Job " + job.id() + " left processing before its result could be recorded");
            }
            span.addEvent("job.completed");
            metrics.recordProcessed(job.jobType(), "completed");
            LOG.infof("Job %s (type: %s) completed", job.id(), job.jobType());
            return ProcessOutcome.COMPLETED;

        } finally {
            metrics.stopTimer(timer, String.valueOf(job.jobType()));
            span.end();
            LoggingConfig.clearJobContext();
            if (ownsOrigin) {
                LoggingConfig.clearRequestOrigin();
            }
        }
    }

    private JobHandler resolveHandler(ClaimedJob job, Span span) {
        Optional<JobType> type = JobType.fromWireName(job.jobType());
        if (type.isEmpty()) {
            String message = "Unknown job type: " + job.jobType();
            span.setStatus(StatusCode.ERROR, message);
            LOG.errorf("Job %s has unknown type %s", job.id(), job.jobType());
            fail(job, message);
            throw new JobExecutionException(job.id(), message);
        }
        Optional<JobHandler> handler = handlerRegistry.find(type.get());
        if (handler.isEmpty()) {
            String message = "No handler registered for job type: " + job.jobType();
            span.setStatus(StatusCode.ERROR, message);
            LOG.errorf("Job %s has no registered handler for %s", job.id(), job.jobType());
            fail(job, message);
            throw new JobExecutionException(job.id(), message);
        }
        return handler.get();
    }

    private void fail(ClaimedJob job, String message) {
        metrics.recordProcessed(String.valueOf(job.jobType()), "failed");
        jobStore.transitionToFailed(job.id(), message);
    }
}
