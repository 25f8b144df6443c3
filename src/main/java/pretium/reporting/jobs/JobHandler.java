package pretium.reporting.jobs;

import java.util.Map;
import java.util.UUID;

/**
 * Contract for job handler implementations.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement this interface. The
 * {@link pretium.reporting.services.JobHandlerRegistry} discovers handlers at startup and the
 * {@link pretium.reporting.services.JobProcessor} routes claimed jobs to them by {@link JobType}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>A handler is a function of the payload: it returns a result map or throws with a message</li>
 * <li>Handlers never touch the job store; the processor records the terminal state</li>
 * <li>There is no retry. A thrown exception marks the job failed permanently</li>
 * <li>An OpenTelemetry span ({@code job.execute}) wraps every handler call</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class GenerateReportJobHandler implements JobHandler {
 *     @Override
 *     public JobType handlesType() {
 *         return JobType.GENERATE_REPORT;
 *     }
 *
 *     @Override
 *     public Map<String, Object> execute(UUID jobId, Map<String, Object> payload) throws Exception {
 *         return reportGenerationService.generate(jobId, payload);
 *     }
 * }
 * }</pre>
 *
 * @see pretium.reporting.services.JobProcessor for dispatcher implementation
 * @see JobType for supported job types
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Rejects a payload at enqueue time, before anything is persisted. The default accepts any payload.
     *
     * @param payload
     *            request payload, never null
     * @throws pretium.reporting.exceptions.ValidationException
     *             if the payload can never succeed
     */
    default void validatePayload(Map<String, Object> payload) {
    }

    /**
     * Executes the job with the given payload.
     *
     * <p>
     * <b>Thread Safety:</b> May be called concurrently by several drain loops. Implementations must be stateless or
     * thread-safe.
     *
     * @param jobId
     *            the job id from {@code jobs.id}
     * @param payload
     *            job parameters stored as JSON
     * @return result map stored on the job when it completes; {@code null} is stored as an empty map
     * @throws Exception
     *             any error during execution; the message becomes the job's {@code error}
     */
    Map<String, Object> execute(UUID jobId, Map<String, Object> payload) throws Exception;
}
