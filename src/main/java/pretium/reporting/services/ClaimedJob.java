package pretium.reporting.services;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A job this worker owns: its row is in {@code processing} and was moved there by this worker's compare-and-set.
 *
 * <p>
 * Only {@link JobStore} creates instances, so holding one is proof of a won claim.
 */
public final class ClaimedJob {

    private final UUID id;
    private final String jobType;
    private final Map<String, Object> payload;
    private final Instant createdAt;
    private final Instant startedAt;
    private final String claimedBy;

    ClaimedJob(UUID id, String jobType, Map<String, Object> payload, Instant createdAt, Instant startedAt,
            String claimedBy) {
        this.id = Objects.requireNonNull(id, "id");
        this.jobType = jobType;
        this.payload = payload == null ? Map.of() : payload;
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.claimedBy = claimedBy;
    }

    public UUID id() {
        return id;
    }

    public String jobType() {
        return jobType;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public String claimedBy() {
        return claimedBy;
    }

    @Override
    public String toString() {
        return "ClaimedJob{id=" + id + ", jobType=" + jobType + ", claimedBy=" + claimedBy + "}";
    }
}
