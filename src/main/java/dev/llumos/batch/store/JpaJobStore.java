package dev.llumos.batch.store;

import dev.llumos.domain.entity.BatchJob;
import dev.llumos.domain.entity.BatchTask;
import dev.llumos.domain.entity.ResponseRecord;
import dev.llumos.domain.enums.JobEvent;
import dev.llumos.domain.enums.JobStatus;
import dev.llumos.domain.enums.TaskStatus;
import dev.llumos.domain.lifecycle.JobStateMachine;
import dev.llumos.domain.valueobject.ProviderAnswer;
import dev.llumos.domain.valueobject.TaskKey;
import dev.llumos.domain.valueobject.VisibilityAnalysis;
import dev.llumos.repository.BatchJobRepository;
import dev.llumos.repository.BatchTaskRepository;
import dev.llumos.repository.ResponseRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * PostgreSQL-backed {@link JobStore}.
 *
 * <p>Concurrency relies on the database, not on Java-side locking:
 * <ul>
 *   <li>counters move by single-statement increments guarded by {@code completed + failed <= total}</li>
 *   <li>task claims, status transitions and reconciler takeovers are compare-and-set updates
 *       whose row count tells the caller whether it won</li>
 *   <li>the partial unique index on {@code batch_jobs(org_id)} enforces one active job per org</li>
 * </ul>
 * Timestamps are truncated to microseconds so a heartbeat read back from the database compares
 * equal to the value that was written.
 */
@Component
public class JpaJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JpaJobStore.class);

    private static final Set<JobStatus> ACTIVE = EnumSet.of(JobStatus.PENDING, JobStatus.PROCESSING);
    private static final Set<TaskStatus> FINISHED = EnumSet.of(TaskStatus.COMPLETED, TaskStatus.FAILED);

    private final BatchJobRepository jobRepository;
    private final BatchTaskRepository taskRepository;
    private final ResponseRecordRepository responseRepository;
    private final Clock clock;

    public JpaJobStore(BatchJobRepository jobRepository, BatchTaskRepository taskRepository,
                       ResponseRecordRepository responseRepository, Clock clock) {
        this.jobRepository = jobRepository;
        this.taskRepository = taskRepository;
        this.responseRepository = responseRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public JobSnapshot create(UUID orgId, List<TaskKey> tasks, Map<String, Object> metadata) {
        Set<TaskKey> distinct = new LinkedHashSet<>(tasks);
        Instant now = now();
        BatchJob job = BatchJob.create(orgId, distinct.size(), metadata, now);
        // flush now so a concurrent create fails on the partial unique index before tasks are written
        jobRepository.saveAndFlush(job);

        List<BatchTask> rows = new ArrayList<>(distinct.size());
        for (TaskKey key : distinct) {
            rows.add(BatchTask.pending(job.getId(), key.promptId(), key.provider(), now));
        }
        taskRepository.saveAll(rows);
        log.info("Created batch job {} for org {} with {} tasks", job.getId(), orgId, rows.size());
        return JobSnapshot.from(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobSnapshot> get(UUID jobId) {
        return jobRepository.findById(jobId).map(JobSnapshot::from);
    }

    @Override
    @Transactional
    public boolean updateProgress(UUID jobId, int completedDelta, int failedDelta) {
        int updated = jobRepository.incrementCounters(jobId, completedDelta, failedDelta, now());
        if (updated == 0) {
            log.warn("Counter update +{}/+{} rejected for job {}", completedDelta, failedDelta, jobId);
        }
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean heartbeat(UUID jobId, String runnerId) {
        return jobRepository.heartbeat(jobId, runnerId, ACTIVE, now()) == 1;
    }

    @Override
    @Transactional
    public boolean setStatus(UUID jobId, JobEvent event) {
        Set<JobStatus> sources = JobStateMachine.sourcesFor(event);
        int updated = event == JobEvent.START
                ? jobRepository.markStarted(jobId, sources, now())
                : jobRepository.markFinished(jobId, JobStateMachine.targetOf(event), sources, now());
        if (updated == 1) {
            log.debug("Job {} accepted {}", jobId, event);
        }
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean requestCancellation(UUID jobId) {
        return jobRepository.requestCancellation(jobId, ACTIVE) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<TaskSnapshot> pendingTasks(UUID jobId, int limit) {
        return taskRepository.findByBatchJobIdAndStatusOrderByPromptIdAscProviderAsc(
                        jobId, TaskStatus.PENDING, PageRequest.of(0, limit))
                .stream().map(TaskSnapshot::from).toList();
    }

    @Override
    @Transactional
    public boolean claimTask(UUID taskId) {
        return taskRepository.claim(taskId, now()) == 1;
    }

    @Override
    @Transactional
    public boolean releaseTask(UUID taskId) {
        return taskRepository.release(taskId) == 1;
    }

    @Override
    @Transactional
    public boolean recordSuccess(TaskSnapshot task, ProviderAnswer answer, VisibilityAnalysis analysis) {
        Instant now = now();
        if (taskRepository.finish(task.id(), TaskStatus.COMPLETED, null, now) == 0) {
            log.debug("Task {} was no longer processing; success not recorded", task.id());
            return false;
        }
        UUID orgId = orgOf(task.jobId());
        responseRepository.saveAndFlush(ResponseRecord.success(
                orgId, task.jobId(), task.promptId(), task.provider(), answer, analysis, now));
        if (jobRepository.incrementCounters(task.jobId(), 1, 0, now) == 0) {
            log.warn("Completed counter for job {} already at total", task.jobId());
        }
        return true;
    }

    @Override
    @Transactional
    public boolean recordFailure(TaskSnapshot task, String error) {
        Instant now = now();
        if (taskRepository.finish(task.id(), TaskStatus.FAILED, truncate(error), now) == 0) {
            log.debug("Task {} was no longer processing; failure not recorded", task.id());
            return false;
        }
        if (!responseRepository.existsByBatchJobIdAndPromptIdAndProvider(task.jobId(), task.promptId(), task.provider())) {
            responseRepository.save(ResponseRecord.error(
                    orgOf(task.jobId()), task.jobId(), task.promptId(), task.provider(), error, now));
        }
        if (jobRepository.incrementCounters(task.jobId(), 0, 1, now) == 0) {
            log.warn("Failed counter for job {} already at total", task.jobId());
        }
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public TaskCounts taskCounts(UUID jobId) {
        Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
        for (Object[] row : taskRepository.countGroupedByStatus(jobId)) {
            byStatus.put((TaskStatus) row[0], ((Number) row[1]).longValue());
        }
        return new TaskCounts(
                byStatus.getOrDefault(TaskStatus.PENDING, 0L),
                byStatus.getOrDefault(TaskStatus.PROCESSING, 0L),
                byStatus.getOrDefault(TaskStatus.COMPLETED, 0L),
                byStatus.getOrDefault(TaskStatus.FAILED, 0L),
                byStatus.getOrDefault(TaskStatus.CANCELLED, 0L));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TaskSnapshot> finishedTasks(UUID jobId) {
        return taskRepository.findByBatchJobIdAndStatusInOrderByCompletedAtAsc(jobId, FINISHED)
                .stream().map(TaskSnapshot::from).toList();
    }

    @Override
    @Transactional
    public int cancelOpenTasks(UUID jobId) {
        return taskRepository.cancelOpenTasks(jobId, now());
    }

    @Override
    @Transactional
    public List<UUID> cancelActiveJobs(UUID orgId, String reason) {
        List<UUID> cancelled = new ArrayList<>();
        for (BatchJob job : jobRepository.findByOrgIdAndStatusIn(orgId, ACTIVE)) {
            Instant now = now();
            int tasks = taskRepository.cancelOpenTasks(job.getId(), now);
            jobRepository.requestCancellation(job.getId(), ACTIVE);
            if (jobRepository.markFinished(job.getId(), JobStatus.CANCELLED,
                    JobStateMachine.sourcesFor(JobEvent.CANCEL), now) == 1) {
                cancelled.add(job.getId());
                log.info("Cancelled job {} for org {} ({} open tasks): {}", job.getId(), orgId, tasks, reason);
            }
        }
        return cancelled;
    }

    @Override
    @Transactional
    public int resetStuckTasks(UUID jobId, Instant olderThan) {
        return taskRepository.resetStuck(jobId, olderThan);
    }

    @Override
    @Transactional
    public void syncCounters(UUID jobId) {
        jobRepository.syncCountersFromTasks(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobSnapshot> findStale(Instant before) {
        return jobRepository.findStale(ACTIVE, before).stream().map(JobSnapshot::from).toList();
    }

    @Override
    @Transactional
    public boolean tryTakeOver(UUID jobId, Instant observedHeartbeat, String runnerId) {
        int updated = observedHeartbeat == null
                ? jobRepository.takeOverNeverBeaten(jobId, runnerId, ACTIVE, now())
                : jobRepository.takeOver(jobId, observedHeartbeat, runnerId, ACTIVE, now());
        return updated == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobSnapshot> findActiveJob(UUID orgId) {
        return jobRepository.findFirstByOrgIdAndStatusInOrderByCreatedAtDesc(orgId, ACTIVE).map(JobSnapshot::from);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobSnapshot> findJobSince(UUID orgId, Instant since) {
        return jobRepository
                .findFirstByOrgIdAndStatusNotAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                        orgId, JobStatus.CANCELLED, since)
                .map(JobSnapshot::from);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobSnapshot> recentJobs(UUID orgId, int limit) {
        return jobRepository.findByOrgIdOrderByCreatedAtDesc(orgId, PageRequest.of(0, limit))
                .stream().map(JobSnapshot::from).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) counts.put(s, 0L);
        for (Object[] row : jobRepository.countGroupedByStatus()) {
            counts.put((JobStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    private UUID orgOf(UUID jobId) {
        return jobRepository.findOrgIdById(jobId)
                .orElseThrow(() -> new IllegalStateException("Job not found: " + jobId));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= 2000 ? error : error.substring(0, 2000);
    }
}
