package pretium.reporting.jobs;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import pretium.reporting.api.types.GenerateReportPayloadType;
import pretium.reporting.api.types.GeneratedReportType;
import pretium.reporting.exceptions.ValidationException;
import pretium.reporting.services.ReportGenerationService;

import java.util.Map;
import java.util.UUID;

/**
 * Handler for {@link JobType#GENERATE_REPORT}: drafts a report from the photos and notes in the payload.
 *
 * <p>
 * <b>Payload:</b>
 * <ul>
 * <li>{@code reportId} (String, required)</li>
 * <li>{@code images} (list of {@code {url, description, group, number, tag}}, at least one)</li>
 * <li>{@code projectId}, {@code bulletPoints}, {@code contractName}, {@code location} (optional)</li>
 * <li>{@code reportType} (optional, default {@code observation})</li>
 * </ul>
 *
 * <p>
 * <b>Result:</b> {@code {reportId, content, sections, metadata}} as produced by {@link ReportGenerationService}.
 */
@ApplicationScoped
public class GenerateReportJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(GenerateReportJobHandler.class);

    private static final TypeReference<Map<String, Object>> RESULT_TYPE = new TypeReference<>() {
    };

    @Inject
    ReportGenerationService reportGenerationService;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public JobType handlesType() {
        return JobType.GENERATE_REPORT;
    }

    @Override
    public void validatePayload(Map<String, Object> payload) {
        reportGenerationService.validate(readPayload(payload));
    }

    @Override
    public Map<String, Object> execute(UUID jobId, Map<String, Object> payload) {
        GenerateReportPayloadType request = readPayload(payload);
        LOG.infof("Starting report generation for report %s (job %s)", request.reportId(), jobId);

        GeneratedReportType report = reportGenerationService.generate(jobId, request);
        return objectMapper.convertValue(report, RESULT_TYPE);
    }

    private GenerateReportPayloadType readPayload(Map<String, Object> payload) {
        try {
            return objectMapper.convertValue(payload, GenerateReportPayloadType.class);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed generate_report payload: " + e.getMessage(), e);
        }
    }
}
