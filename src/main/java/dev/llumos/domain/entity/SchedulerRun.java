package dev.llumos.domain.entity;

import dev.llumos.domain.enums.SchedulerRunStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Bookkeeping for one invocation of a scheduled function. The run key (local date for the
 * daily trigger) makes a second cron delivery on the same day a no-op.
 */
@Entity
@Table(name = "scheduler_runs", indexes = @Index(name = "idx_scheduler_runs_key",
        columnList = "function_name, run_key, status"))
public class SchedulerRun {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "run_key", nullable = false, length = 20)
    private String runKey;

    @Column(name = "function_name", nullable = false, length = 100)
    private String functionName;

    @Column(name = "trigger_source", nullable = false, length = 100)
    private String triggerSource;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SchedulerRunStatus status;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result", columnDefinition = "jsonb")
    private Map<String, Object> result;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected SchedulerRun() {
    }

    public static SchedulerRun start(String functionName, String runKey, String triggerSource, Instant now) {
        SchedulerRun r = new SchedulerRun();
        r.id = UUID.randomUUID();
        r.functionName = functionName;
        r.runKey = runKey;
        r.triggerSource = triggerSource == null ? "unknown" : triggerSource;
        r.status = SchedulerRunStatus.RUNNING;
        r.startedAt = now;
        return r;
    }

    public static SchedulerRun skipped(String functionName, String runKey, String triggerSource,
                                       String reason, Instant now) {
        SchedulerRun r = start(functionName, runKey, triggerSource, now);
        r.status = SchedulerRunStatus.SKIPPED;
        r.result = Map.of("reason", reason);
        r.completedAt = now;
        return r;
    }

    public void complete(Map<String, Object> summary, Instant now) {
        requireRunning();
        this.status = SchedulerRunStatus.COMPLETED;
        this.result = summary == null ? Map.of() : new HashMap<>(summary);
        this.completedAt = now;
    }

    public void fail(String error, Instant now) {
        requireRunning();
        this.status = SchedulerRunStatus.FAILED;
        this.errorMessage = error != null && error.length() > 2000 ? error.substring(0, 2000) : error;
        this.completedAt = now;
    }

    private void requireRunning() {
        if (status != SchedulerRunStatus.RUNNING)
            throw new IllegalStateException("Expected RUNNING but was %s".formatted(status));
    }

    public UUID getId() {
        return id;
    }

    public String getRunKey() {
        return runKey;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getTriggerSource() {
        return triggerSource;
    }

    public SchedulerRunStatus getStatus() {
        return status;
    }

    public Map<String, Object> getResult() {
        return result == null ? Map.of() : Map.copyOf(result);
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
