package dev.llumos.batch.store;

import dev.llumos.domain.entity.BatchTask;
import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.enums.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Detached view of a task. Worker threads only ever see snapshots, never managed entities.
 */
public record TaskSnapshot(UUID id, UUID jobId, UUID promptId, LlmProvider provider, TaskStatus status,
                           int attempts, String errorMessage, Instant startedAt, Instant completedAt) {

    public static TaskSnapshot from(BatchTask t) {
        return new TaskSnapshot(t.getId(), t.getBatchJobId(), t.getPromptId(), t.getProvider(), t.getStatus(),
                t.getAttempts(), t.getErrorMessage(), t.getStartedAt(), t.getCompletedAt());
    }
}
