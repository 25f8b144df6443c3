package pretium.reporting.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import pretium.reporting.services.DrainResult;

import java.util.List;

/**
 * Body of {@code POST /api/jobs/process}.
 *
 * @param success
 *            always true when the drain ran; individual job failures are listed in {@code errors}
 * @param processed
 *            number of jobs taken off the queue
 * @param errors
 *            one entry per failed job, plus a fetch error if the loop stopped early
 */
@Schema(
        description = "Summary of one queue drain")
public record DrainResultType(boolean success, int processed, List<String> errors) {

    public static DrainResultType fromResult(DrainResult result) {
        return new DrainResultType(true, result.processedCount(), result.errors());
    }
}
