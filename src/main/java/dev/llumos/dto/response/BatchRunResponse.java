package dev.llumos.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.llumos.batch.executor.ExecutionResult;
import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.domain.enums.JobAction;
import dev.llumos.domain.enums.JobStatus;
import dev.llumos.service.JobCommandResult;

import java.time.Instant;
import java.util.UUID;

/**
 * Body of every {@code /batch-jobs} response, including failures ({@code success = false,
 * action = error}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchRunResponse(boolean success, JobAction action, UUID jobId, UUID orgId, JobStatus status,
                               Integer totalTasks, Integer completedTasks, Integer failedTasks,
                               Long remaining, Integer progress, Integer processed, String message,
                               String error, Instant createdAt, Instant completedAt) {

    public static BatchRunResponse of(JobAction action, JobSnapshot job, String message) {
        return new BatchRunResponse(true, action, job.id(), job.orgId(), job.status(), job.totalTasks(),
                job.completedTasks(), job.failedTasks(), (long) job.remainingTasks(), job.progressPercent(),
                null, message, null, job.createdAt(), job.completedAt());
    }

    public static BatchRunResponse of(JobCommandResult result) {
        return of(result.action(), result.job(), result.message());
    }

    /** One executor invocation; counters are read from the job after the invocation. */
    public static BatchRunResponse of(ExecutionResult result, JobSnapshot job) {
        return new BatchRunResponse(true, result.action(), job.id(), job.orgId(), job.status(), job.totalTasks(),
                job.completedTasks(), job.failedTasks(), result.remaining(), job.progressPercent(),
                result.processed(), result.message(), null, job.createdAt(), job.completedAt());
    }

    public static BatchRunResponse error(String error) {
        return new BatchRunResponse(false, JobAction.ERROR, null, null, null, null, null, null, null, null,
                null, null, error, null, null);
    }
}
