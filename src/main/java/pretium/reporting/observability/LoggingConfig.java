package pretium.reporting.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

import java.util.UUID;

/**
 * Standard MDC field names and helpers for enriching logs with job and trace context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - current span identifier within the trace</li>
 * <li>{@code job_id} - job primary key (only during job execution)</li>
 * <li>{@code job_type} - job type wire tag (only during job execution)</li>
 * <li>{@code worker_id} - hostname:pid of the worker that claimed the job</li>
 * <li>{@code request_origin} - HTTP path or {@code JobType.X} identifier</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the job processor:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(jobId);
 * boolean ownsOrigin = LoggingConfig.setRequestOriginIfAbsent("JobType." + jobType);
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearJobContext();
 *     if (ownsOrigin) {
 *         LoggingConfig.clearRequestOrigin();
 *     }
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Every job execution clears
 * its job fields at the end so a drain loop never logs one job's id against the next; the request that started the
 * drain clears the rest.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_JOB_TYPE = "job_type";

    public static final String MDC_WORKER_ID = "worker_id";

    /**
     * HTTP request path (e.g., "/api/jobs/trigger") or job type identifier (e.g., "JobType.generate_report").
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span. When no span is active the fields are set to
     * empty strings so the log format stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setJobId(UUID jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    public static void setJobType(String jobType) {
        if (jobType != null) {
            MDC.put(MDC_JOB_TYPE, jobType);
        }
    }

    public static void setWorkerId(String workerId) {
        if (workerId != null) {
            MDC.put(MDC_WORKER_ID, workerId);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Sets the origin only when none is set, so a job run inside a request keeps the request's origin.
     *
     * @return true if this call set the origin
     */
    public static boolean setRequestOriginIfAbsent(String requestOrigin) {
        if (requestOrigin != null && MDC.get(MDC_REQUEST_ORIGIN) == null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
            return true;
        }
        return false;
    }

    public static void clearRequestOrigin() {
        MDC.remove(MDC_REQUEST_ORIGIN);
    }

    /**
     * Removes the per-job fields and points trace_id/span_id back at the current span. The request origin is kept.
     */
    public static void clearJobContext() {
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_TYPE);
        MDC.remove(MDC_WORKER_ID);
        enrichWithTraceContext();
    }

    /**
     * Clears all fields set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_TYPE);
        MDC.remove(MDC_WORKER_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
