package pretium.reporting.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import pretium.reporting.exceptions.JobNotImplementedException;

import java.util.Map;
import java.util.UUID;

/**
 * Placeholder for bulk image processing. Registered so the type is accepted; every execution fails.
 */
@ApplicationScoped
public class ProcessImagesJobHandler implements JobHandler {

    @Override
    public JobType handlesType() {
        return JobType.PROCESS_IMAGES;
    }

    @Override
    public Map<String, Object> execute(UUID jobId, Map<String, Object> payload) {
        throw new JobNotImplementedException("Image processing job type not yet implemented");
    }
}
