package pretium.reporting.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import pretium.reporting.exceptions.JobNotImplementedException;

import java.util.Map;
import java.util.UUID;

/**
 * Placeholder for report document export. Registered so the type is accepted; every execution fails.
 */
@ApplicationScoped
public class ExportDocumentJobHandler implements JobHandler {

    @Override
    public JobType handlesType() {
        return JobType.EXPORT_DOCUMENT;
    }

    @Override
    public Map<String, Object> execute(UUID jobId, Map<String, Object> payload) {
        throw new JobNotImplementedException("Document export job type not yet implemented");
    }
}
