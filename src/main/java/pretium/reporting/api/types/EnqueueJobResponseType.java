package pretium.reporting.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.UUID;

/**
 * Response for an accepted job. Callers poll {@code GET /api/jobs/{jobId}} for the outcome.
 *
 * @param jobId
 *            id of the queued job
 */
@Schema(
        description = "Accepted job reference")
public record EnqueueJobResponseType(@Schema(
        description = "Queued job id",
        example = "550e8400-e29b-41d4-a716-446655440000") UUID jobId) {
}
