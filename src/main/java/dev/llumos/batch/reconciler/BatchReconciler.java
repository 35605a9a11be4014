package dev.llumos.batch.reconciler;

import dev.llumos.batch.driver.BatchDriverLoop;
import dev.llumos.batch.executor.JobFinalizer;
import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.batch.store.JobStore;
import dev.llumos.batch.store.TaskCounts;
import dev.llumos.config.BatchProperties;
import dev.llumos.domain.enums.JobAction;
import dev.llumos.domain.enums.JobStatus;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Recovers jobs whose runner went away.
 *
 * <p>A job is stale when it is PENDING or PROCESSING and its heartbeat (or creation time, if it
 * never beat) is older than {@code staleHeartbeat}. For each stale job:
 * <ol>
 *   <li>cancellation requested → cancel open tasks and the job</li>
 *   <li>no pending or processing task → finalize (which re-syncs counters); the executor is not called</li>
 *   <li>otherwise → take the job over with a heartbeat compare-and-set, then return tasks stuck in
 *       PROCESSING for longer than {@code stuckTaskAge} to PENDING, re-sync counters and hand the
 *       job to the driver loop. A reconciler that loses the compare-and-set touches nothing.</li>
 * </ol>
 */
@Component
public class BatchReconciler {

    private static final Logger log = LoggerFactory.getLogger(BatchReconciler.class);

    private final JobStore store;
    private final JobFinalizer finalizer;
    private final BatchDriverLoop driverLoop;
    private final BatchProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final String runnerId = "reconciler-" + UUID.randomUUID();

    public BatchReconciler(JobStore store, JobFinalizer finalizer, BatchDriverLoop driverLoop,
                           BatchProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.store = store;
        this.finalizer = finalizer;
        this.driverLoop = driverLoop;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public ReconcileReport reconcile() {
        Instant now = clock.instant();
        List<JobSnapshot> stale = store.findStale(now.minus(properties.staleHeartbeat()));
        int limit = properties.reconciler().maxJobsPerSweep();
        if (stale.size() > limit) {
            log.warn("{} stale jobs found; handling the oldest {} this sweep", stale.size(), limit);
            stale = stale.subList(0, limit);
        }

        List<ReconcileReport.JobResult> results = new ArrayList<>(stale.size());
        for (JobSnapshot job : stale) {
            ReconcileReport.JobResult result;
            try (MDC.MDCCloseable ignored = MDC.putCloseable("jobId", job.id().toString())) {
                result = reconcileJob(job, now);
            } catch (RuntimeException e) {
                log.error("Reconciling job {} failed", job.id(), e);
                result = new ReconcileReport.JobResult(job.id(), JobAction.ERROR, e.getMessage());
            }
            meterRegistry.counter("llumos.reconciler.jobs", "action", result.action().wireName()).increment();
            results.add(result);
        }

        ReconcileReport report = ReconcileReport.of(results);
        if (report.processed() > 0) {
            log.info("Reconciler sweep: {} stale, {} finalized, {} resumed, {} skipped, {} errors",
                    report.processed(), report.finalized(), report.resumed(), report.skipped(), report.errors());
        }
        return report;
    }

    private ReconcileReport.JobResult reconcileJob(JobSnapshot job, Instant now) {
        log.info("Job {} is stale (last sign of life {}, status {})", job.id(), job.lastSignOfLife(), job.status());

        if (job.cancellationRequested()) {
            JobStatus status = finalizer.cancel(job.id());
            return new ReconcileReport.JobResult(job.id(), JobAction.CANCELLED, "cancelled, now " + status);
        }

        TaskCounts counts = store.taskCounts(job.id());
        if (counts.isDrained()) {
            JobStatus status = finalizer.finalizeJob(job.id());
            return new ReconcileReport.JobResult(job.id(), JobAction.FINALIZED, "finalized as " + status);
        }

        if (!store.tryTakeOver(job.id(), job.lastHeartbeat(), runnerId)) {
            return new ReconcileReport.JobResult(job.id(), JobAction.SKIPPED, "taken over by another runner");
        }
        int reset = store.resetStuckTasks(job.id(), now.minus(properties.stuckTaskAge()));
        store.syncCounters(job.id());
        boolean dispatched = driverLoop.driveAsync(job.id());
        String detail = "%d open tasks, %d stuck tasks reset%s".formatted(
                counts.open(), reset, dispatched ? "" : ", driver pool saturated");
        return new ReconcileReport.JobResult(job.id(), JobAction.RESUMED, detail);
    }
}
