package pretium.reporting.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import pretium.reporting.data.models.Job;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * API type representing a job for status polling. Converts from {@link Job} entity.
 *
 * @param id
 *            job id
 * @param jobType
 *            wire tag of the job type
 * @param status
 *            lowercase status ({@code queued}, {@code processing}, {@code completed}, {@code failed})
 * @param payload
 *            handler input
 * @param result
 *            handler output, only when completed
 * @param error
 *            failure message, only when failed
 * @param createdAt
 *            enqueue time
 * @param startedAt
 *            claim time
 * @param finishedAt
 *            completion or failure time
 */
@Schema(
        description = "Job state for polling callers")
public record JobRecordType(UUID id, String jobType, @Schema(
        enumeration = {"queued", "processing", "completed", "failed"}) String status, Map<String, Object> payload,
        Map<String, Object> result, String error, Instant createdAt, Instant startedAt, Instant finishedAt) {

    public static JobRecordType fromEntity(Job job) {
        return new JobRecordType(job.id, job.jobType, job.status.wireName(), job.payload, job.result, job.error,
                job.createdAt, job.startedAt, job.finishedAt);
    }
}
