package pretium.reporting.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Panache entity for the report job queue. One row per unit of asynchronous work.
 *
 * <p>
 * The table is the only coordination point between request handlers that enqueue work and worker invocations that
 * drain it. Workers never hold a transaction across handler execution; every state change is its own short write.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - assigned at creation, immutable</li>
 * <li>{@code job_type} (TEXT) - wire tag such as {@code generate_report}; kept as text so rows with a type this
 * build does not know can still be loaded and failed</li>
 * <li>{@code payload} (JSON) - handler input, opaque to the queue</li>
 * <li>{@code status} (TEXT) - QUEUED, PROCESSING, COMPLETED, FAILED</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - FIFO ordering key</li>
 * <li>{@code started_at} (TIMESTAMPTZ) - set when a worker claims the job</li>
 * <li>{@code finished_at} (TIMESTAMPTZ) - set on completion or failure</li>
 * <li>{@code result} (JSON) - handler output, only on COMPLETED</li>
 * <li>{@code error} (TEXT) - failure message, only on FAILED</li>
 * <li>{@code claimed_by} (TEXT) - worker identifier (hostname:pid)</li>
 * <li>{@code updated_at} (TIMESTAMPTZ) - last mutation</li>
 * </ul>
 *
 * <p>
 * Status transitions are performed by {@link pretium.reporting.services.JobStore}, never by mutating this entity
 * directly from handlers.
 *
 * @see pretium.reporting.services.JobStore
 */
@Entity
@Table(
        name = "jobs",
        indexes = @Index(
                name = "idx_jobs_status_created_at",
                columnList = "status, created_at"))
public class Job extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "job_type",
            nullable = false)
    public String jobType;

    @Column(
            name = "payload",
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> payload;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            name = "created_at",
            nullable = false,
            updatable = false)
    public Instant createdAt;

    @Column(
            name = "started_at")
    public Instant startedAt;

    @Column(
            name = "finished_at")
    public Instant finishedAt;

    @Column(
            name = "result")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> result;

    @Column(
            name = "error",
            columnDefinition = "text")
    public String error;

    @Column(
            name = "claimed_by")
    public String claimedBy;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Job lifecycle statuses. Transitions only move forward: QUEUED to PROCESSING to a terminal state, or QUEUED
     * straight to FAILED.
     */
    public enum JobStatus {
        QUEUED, PROCESSING, COMPLETED, FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }

        /**
         * Lowercase wire form used in API responses ({@code queued}, {@code processing}, ...).
         */
        public String wireName() {
            return name().toLowerCase();
        }
    }

    /**
     * Returns the oldest queued job, ties on {@code created_at} broken by id.
     *
     * @return oldest eligible job, empty when the queue is drained
     */
    public static Optional<Job> findOldestQueued() {
        return find("status", Sort.ascending("createdAt", "id"), JobStatus.QUEUED).firstResultOptional();
    }

    /**
     * Finds jobs by status in FIFO order.
     *
     * @param status
     *            job status to filter by
     * @return matching jobs, oldest first
     */
    public static List<Job> findByStatus(JobStatus status) {
        return find("status", Sort.ascending("createdAt", "id"), status).list();
    }

    public static long countByStatus(JobStatus status) {
        return count("status", status);
    }
}
