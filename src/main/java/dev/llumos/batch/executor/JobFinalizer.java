package dev.llumos.batch.executor;

import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.batch.store.JobStore;
import dev.llumos.batch.store.TaskCounts;
import dev.llumos.domain.enums.JobEvent;
import dev.llumos.domain.enums.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Moves a drained or cancelled job to its terminal state. Shared by the executor, the reconciler
 * and the cancel endpoint so they all finalize the same way; every step is a conditional update,
 * so finalizing twice is harmless.
 */
@Component
public class JobFinalizer {

    private static final Logger log = LoggerFactory.getLogger(JobFinalizer.class);

    private final JobStore store;

    public JobFinalizer(JobStore store) {
        this.store = store;
    }

    /**
     * COMPLETED, or FAILED when every task failed. Counters are re-synced from the task rows first,
     * so a terminal job's counters always match its tasks. Callers must have checked that no task
     * is pending or processing.
     */
    public JobStatus finalizeJob(UUID jobId) {
        TaskCounts counts = store.taskCounts(jobId);
        if (!counts.isDrained()) {
            throw new IllegalStateException("Job %s still has %d open tasks".formatted(jobId, counts.open()));
        }
        store.syncCounters(jobId);
        boolean applied;
        if (counts.allFailed()) {
            applied = store.setStatus(jobId, JobEvent.FAIL);
        } else {
            store.setStatus(jobId, JobEvent.START);
            applied = store.setStatus(jobId, JobEvent.FINISH);
        }
        JobStatus status = currentStatus(jobId);
        if (applied) {
            log.info("Job {} finalized as {} (completed={}, failed={})", jobId, status, counts.completed(), counts.failed());
        }
        return status;
    }

    /** Cancels open tasks, then the job. */
    public JobStatus cancel(UUID jobId) {
        int tasks = store.cancelOpenTasks(jobId);
        if (store.setStatus(jobId, JobEvent.CANCEL)) {
            log.info("Job {} cancelled, {} open tasks cancelled", jobId, tasks);
        }
        return currentStatus(jobId);
    }

    private JobStatus currentStatus(UUID jobId) {
        return store.get(jobId).map(JobSnapshot::status).orElseThrow();
    }
}
