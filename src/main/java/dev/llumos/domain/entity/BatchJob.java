package dev.llumos.domain.entity;

import dev.llumos.domain.enums.JobStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One batch run for an organization: the (prompt x provider) fan-out and its progress.
 *
 * <p>Only creation goes through the entity. Every later change (status, counters, heartbeat,
 * cancellation flag) is a conditional single-statement update in {@code BatchJobRepository},
 * so concurrent invocations never overwrite each other with a stale copy.
 */
@Entity
@Table(name = "batch_jobs", indexes = {
        @Index(name = "idx_batch_jobs_org_created", columnList = "org_id, created_at"),
        @Index(name = "idx_batch_jobs_status_heartbeat", columnList = "status, last_heartbeat")
})
public class BatchJob {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "org_id", nullable = false, columnDefinition = "uuid")
    private UUID orgId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "total_tasks", nullable = false)
    private int totalTasks;

    @Column(name = "completed_tasks", nullable = false)
    private int completedTasks;

    @Column(name = "failed_tasks", nullable = false)
    private int failedTasks;

    @Column(name = "cancellation_requested", nullable = false)
    private boolean cancellationRequested;

    @Column(name = "runner_id", length = 100)
    private String runnerId;

    @Column(name = "last_heartbeat")
    private Instant lastHeartbeat;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected BatchJob() {
    }

    public static BatchJob create(UUID orgId, int totalTasks, Map<String, Object> metadata, Instant now) {
        if (orgId == null) throw new IllegalArgumentException("orgId required");
        if (totalTasks <= 0) throw new IllegalArgumentException("a job needs at least one task");
        BatchJob job = new BatchJob();
        job.id = UUID.randomUUID();
        job.orgId = orgId;
        job.status = JobStatus.PENDING;
        job.totalTasks = totalTasks;
        job.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        job.createdAt = now;
        job.lastHeartbeat = now;
        return job;
    }

    public UUID getId() {
        return id;
    }

    public UUID getOrgId() {
        return orgId;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getTotalTasks() {
        return totalTasks;
    }

    public int getCompletedTasks() {
        return completedTasks;
    }

    public int getFailedTasks() {
        return failedTasks;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }

    public String getRunnerId() {
        return runnerId;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public Map<String, Object> getMetadata() {
        return Map.copyOf(metadata);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
