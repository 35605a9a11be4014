package dev.llumos.domain.entity;

import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.enums.TaskStatus;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One (prompt, provider) unit of work inside a {@link BatchJob}.
 * Claimed PENDING → PROCESSING by a conditional update; terminal states are final.
 */
@Entity
@Table(name = "batch_tasks",
        uniqueConstraints = @UniqueConstraint(name = "uq_batch_tasks_combination",
                columnNames = {"batch_job_id", "prompt_id", "provider"}),
        indexes = @Index(name = "idx_batch_tasks_job_status", columnList = "batch_job_id, status"))
public class BatchTask {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "batch_job_id", nullable = false, columnDefinition = "uuid")
    private UUID batchJobId;

    @Column(name = "prompt_id", nullable = false, columnDefinition = "uuid")
    private UUID promptId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private LlmProvider provider;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected BatchTask() {
    }

    public static BatchTask pending(UUID batchJobId, UUID promptId, LlmProvider provider, Instant now) {
        BatchTask t = new BatchTask();
        t.id = UUID.randomUUID();
        t.batchJobId = batchJobId;
        t.promptId = promptId;
        t.provider = provider;
        t.status = TaskStatus.PENDING;
        t.createdAt = now;
        return t;
    }

    public UUID getId() {
        return id;
    }

    public UUID getBatchJobId() {
        return batchJobId;
    }

    public UUID getPromptId() {
        return promptId;
    }

    public LlmProvider getProvider() {
        return provider;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getErrorMessage() {
        return errorMessage;
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
