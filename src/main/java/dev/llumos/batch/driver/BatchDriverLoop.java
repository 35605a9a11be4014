package dev.llumos.batch.driver;

import dev.llumos.batch.executor.ExecutionResult;
import dev.llumos.batch.executor.MicroBatchExecutor;
import dev.llumos.config.BatchProperties;
import dev.llumos.domain.enums.JobAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Re-invokes the executor until the job is done or stops making progress.
 *
 * <p>Stops on COMPLETED/CANCELLED, on an executor error, after {@code maxIterations} or
 * {@code maxDuration}, or after {@code stallThreshold} consecutive invocations that moved no task.
 * A job left unfinished keeps its heartbeat ageing and is picked up by the reconciler.
 */
@Component
public class BatchDriverLoop {

    private static final Logger log = LoggerFactory.getLogger(BatchDriverLoop.class);

    private final MicroBatchExecutor executor;
    private final BatchProperties.Driver settings;
    private final Clock clock;
    private final TaskExecutor driverExecutor;
    private final Set<UUID> driving = ConcurrentHashMap.newKeySet();

    public BatchDriverLoop(MicroBatchExecutor executor, BatchProperties properties, Clock clock,
                           @Qualifier("driverExecutor") TaskExecutor driverExecutor) {
        this.executor = executor;
        this.settings = properties.driver();
        this.clock = clock;
        this.driverExecutor = driverExecutor;
    }

    /**
     * Runs the loop on the driver pool. Returns false when the pool is saturated; the job then
     * waits for the reconciler.
     */
    public boolean driveAsync(UUID jobId) {
        try {
            driverExecutor.execute(() -> drive(jobId));
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Driver pool saturated; job {} left for the reconciler", jobId);
            return false;
        }
    }

    public DriveResult drive(UUID jobId) {
        Instant start = clock.instant();
        if (!driving.add(jobId)) {
            log.debug("Job {} is already being driven in this process", jobId);
            return new DriveResult(jobId, StopReason.ALREADY_RUNNING, 0, 0, Duration.ZERO, null, null);
        }
        try (MDC.MDCCloseable ignored = MDC.putCloseable("jobId", jobId.toString())) {
            DriveResult result = loop(jobId, start);
            log.info("Driver for job {} stopped: {} after {} iterations, {} tasks processed",
                    jobId, result.reason(), result.iterations(), result.processed());
            return result;
        } finally {
            driving.remove(jobId);
        }
    }

    private DriveResult loop(UUID jobId, Instant start) {
        int iterations = 0;
        int processed = 0;
        int idle = 0;
        ExecutionResult last = null;

        while (true) {
            if (iterations >= settings.maxIterations()) {
                return stop(jobId, StopReason.MAX_ITERATIONS, iterations, processed, start, last, null);
            }
            if (Duration.between(start, clock.instant()).compareTo(settings.maxDuration()) >= 0) {
                return stop(jobId, StopReason.MAX_DURATION, iterations, processed, start, last, null);
            }

            try {
                last = executor.execute(jobId);
            } catch (RuntimeException e) {
                log.error("Executor failed for job {} on iteration {}", jobId, iterations + 1, e);
                return stop(jobId, StopReason.ERROR, iterations + 1, processed, start, last, e.getMessage());
            }
            iterations++;
            processed += last.processed();

            if (last.action() == JobAction.COMPLETED) {
                return stop(jobId, StopReason.COMPLETED, iterations, processed, start, last, null);
            }
            if (last.action() == JobAction.CANCELLED) {
                return stop(jobId, StopReason.CANCELLED, iterations, processed, start, last, null);
            }

            idle = last.madeProgress() ? 0 : idle + 1;
            if (idle >= settings.stallThreshold()) {
                log.warn("Job {} made no progress in {} consecutive invocations", jobId, idle);
                return stop(jobId, StopReason.STALLED, iterations, processed, start, last, null);
            }

            if (!pause()) {
                return stop(jobId, StopReason.ERROR, iterations, processed, start, last, "interrupted");
            }
        }
    }

    private boolean pause() {
        long millis = settings.pollInterval().toMillis();
        if (millis <= 0) return true;
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private DriveResult stop(UUID jobId, StopReason reason, int iterations, int processed, Instant start,
                             ExecutionResult last, String error) {
        return new DriveResult(jobId, reason, iterations, processed,
                Duration.between(start, clock.instant()), last, error);
    }
}
