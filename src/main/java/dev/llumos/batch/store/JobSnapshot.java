package dev.llumos.batch.store;

import dev.llumos.domain.entity.BatchJob;
import dev.llumos.domain.enums.JobStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Detached, immutable view of a batch job as the store last saw it.
 */
public record JobSnapshot(UUID id, UUID orgId, JobStatus status, int totalTasks, int completedTasks,
                          int failedTasks, boolean cancellationRequested, String runnerId,
                          Instant lastHeartbeat, Map<String, Object> metadata, Instant createdAt,
                          Instant startedAt, Instant completedAt) {

    public JobSnapshot {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static JobSnapshot from(BatchJob j) {
        return new JobSnapshot(j.getId(), j.getOrgId(), j.getStatus(), j.getTotalTasks(), j.getCompletedTasks(),
                j.getFailedTasks(), j.isCancellationRequested(), j.getRunnerId(), j.getLastHeartbeat(),
                j.getMetadata(), j.getCreatedAt(), j.getStartedAt(), j.getCompletedAt());
    }

    public int remainingTasks() {
        return Math.max(0, totalTasks - completedTasks - failedTasks);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Heartbeat, or creation time for a job that never beat. */
    public Instant lastSignOfLife() {
        return lastHeartbeat != null ? lastHeartbeat : createdAt;
    }

    public int progressPercent() {
        if (totalTasks == 0) return 100;
        return (int) Math.floor((completedTasks + failedTasks) * 100.0 / totalTasks);
    }
}
