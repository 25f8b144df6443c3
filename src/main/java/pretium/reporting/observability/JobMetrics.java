package pretium.reporting.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import pretium.reporting.data.models.Job.JobStatus;
import pretium.reporting.services.JobStore;

import java.util.List;

/**
 * Custom Micrometer metrics for the job queue.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li><b>Gauge:</b> {@code report_jobs_depth{status}} - number of jobs per status, read from the store on scrape</li>
 * <li><b>Counter:</b> {@code report_jobs_processed_total{type,outcome}} - completed, failed and skipped jobs</li>
 * <li><b>Timer:</b> {@code report_jobs_duration{type}} - handler execution time</li>
 * <li><b>Counter:</b> {@code report_jobs_trigger_total{result}} - trigger calls (sent, delivered, undelivered,
 * unconfigured)</li>
 * <li><b>Counter:</b> {@code report_jobs_drained_total} - jobs taken off the queue by drain loops</li>
 * </ul>
 *
 * Scraped at {@code /q/metrics}.
 */
@ApplicationScoped
public class JobMetrics {

    private static final Logger LOG = Logger.getLogger(JobMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    JobStore jobStore;

    void registerGauges(@Observes StartupEvent event) {
        for (JobStatus status : List.of(JobStatus.QUEUED, JobStatus.PROCESSING)) {
            Gauge.builder("report_jobs_depth", this, m -> m.depth(status))
                    .description("Number of jobs currently " + status.wireName())
                    .tags(List.of(Tag.of("status", status.wireName()))).register(registry);
        }
        LOG.debug("Registered gauges: report_jobs_depth{status=queued|processing}");
    }

    private double depth(JobStatus status) {
        try {
            return jobStore.countByStatus(status);
        } catch (RuntimeException e) {
            LOG.debugf(e, "Unable to read job depth for status %s", status);
            return Double.NaN;
        }
    }

    public void recordProcessed(String jobType, String outcome) {
        Counter.builder("report_jobs_processed_total").description("Jobs processed by outcome")
                .tags("type", jobType, "outcome", outcome).register(registry).increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, String jobType) {
        sample.stop(Timer.builder("report_jobs_duration").description("Job handler execution time")
                .tags("type", jobType).register(registry));
    }

    public void recordTrigger(String result) {
        Counter.builder("report_jobs_trigger_total").description("Worker trigger calls by result")
                .tags("result", result).register(registry).increment();
    }

    public void recordDrained(int count) {
        Counter.builder("report_jobs_drained_total").description("Jobs taken off the queue by drain loops")
                .register(registry).increment(count);
    }
}
