package dev.llumos.batch.store;

import dev.llumos.domain.enums.JobEvent;
import dev.llumos.domain.enums.JobStatus;
import dev.llumos.domain.valueobject.ProviderAnswer;
import dev.llumos.domain.valueobject.TaskKey;
import dev.llumos.domain.valueobject.VisibilityAnalysis;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable state for batch jobs and their tasks, and the only coordination point between
 * concurrent invocations.
 *
 * <p>Every mutation is safe under concurrent callers. Methods returning {@code boolean}
 * report whether this caller's conditional update took effect; {@code false} means another
 * invocation got there first (or the guard rejected the change) and is not an error.
 */
public interface JobStore {

    /**
     * Persists a PENDING job and one PENDING task per distinct key.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if the organization
     *         already has an active job
     */
    JobSnapshot create(UUID orgId, List<TaskKey> tasks, Map<String, Object> metadata);

    Optional<JobSnapshot> get(UUID jobId);

    /** Adds to the counters and refreshes the heartbeat, unless that would exceed the total. */
    boolean updateProgress(UUID jobId, int completedDelta, int failedDelta);

    boolean heartbeat(UUID jobId, String runnerId);

    /** Applies {@code event} only if the job is still in a state that accepts it. */
    boolean setStatus(UUID jobId, JobEvent event);

    boolean requestCancellation(UUID jobId);

    List<TaskSnapshot> pendingTasks(UUID jobId, int limit);

    /** PENDING → PROCESSING and attempts + 1, only if the task is still pending. */
    boolean claimTask(UUID taskId);

    /** PROCESSING → PENDING for a claimed task this invocation could not start in time. */
    boolean releaseTask(UUID taskId);

    /**
     * In one transaction: task → COMPLETED, SUCCESS response record, completed counter + 1.
     * Returns false without side effects if the task was no longer PROCESSING.
     */
    boolean recordSuccess(TaskSnapshot task, ProviderAnswer answer, VisibilityAnalysis analysis);

    /**
     * In one transaction: task → FAILED, ERROR response record (unless one exists), failed counter + 1.
     */
    boolean recordFailure(TaskSnapshot task, String error);

    TaskCounts taskCounts(UUID jobId);

    /** COMPLETED and FAILED tasks, oldest completion first. */
    List<TaskSnapshot> finishedTasks(UUID jobId);

    int cancelOpenTasks(UUID jobId);

    /** Cancels every active job of the organization and their open tasks. Returns the cancelled ids. */
    List<UUID> cancelActiveJobs(UUID orgId, String reason);

    /** Returns PROCESSING tasks started before {@code olderThan} to PENDING. */
    int resetStuckTasks(UUID jobId, Instant olderThan);

    /** Recomputes the job counters from task rows. */
    void syncCounters(UUID jobId);

    /** Active jobs whose heartbeat (or creation time) is older than {@code before}. */
    List<JobSnapshot> findStale(Instant before);

    /**
     * Claims a stale job by moving its heartbeat forward, only if the heartbeat is still the one
     * the caller observed. Exactly one of several concurrent callers wins.
     */
    boolean tryTakeOver(UUID jobId, Instant observedHeartbeat, String runnerId);

    Optional<JobSnapshot> findActiveJob(UUID orgId);

    /** Most recent non-cancelled job created at or after {@code since}. */
    Optional<JobSnapshot> findJobSince(UUID orgId, Instant since);

    List<JobSnapshot> recentJobs(UUID orgId, int limit);

    Map<JobStatus, Long> countByStatus();
}
