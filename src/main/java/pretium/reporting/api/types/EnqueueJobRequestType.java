package pretium.reporting.api.types;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * API type for {@code POST /api/jobs}.
 *
 * @param jobType
 *            wire tag of the job type ({@code generate_report}, {@code process_images}, {@code export_document})
 * @param payload
 *            handler input, stored as JSON
 */
@Schema(
        description = "Request to enqueue a job")
public record EnqueueJobRequestType(@Schema(
        description = "Job type tag",
        example = "generate_report",
        required = true) @NotBlank String jobType,

        @Schema(
                description = "Handler input",
                required = true) @NotNull Map<String, Object> payload) {
}
