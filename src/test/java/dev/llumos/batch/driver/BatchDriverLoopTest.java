package dev.llumos.batch.driver;

import dev.llumos.batch.executor.ExecutionResult;
import dev.llumos.batch.executor.MicroBatchExecutor;
import dev.llumos.config.BatchProperties;
import dev.llumos.domain.enums.JobAction;
import dev.llumos.domain.enums.JobStatus;
import dev.llumos.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchDriverLoopTest {

    private final UUID jobId = UUID.randomUUID();
    private final MicroBatchExecutor executor = mock(MicroBatchExecutor.class);
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T08:00:00Z"));

    private BatchDriverLoop loop(int maxIterations, Duration maxDuration, TaskExecutor pool) {
        BatchProperties.Driver driver = new BatchProperties.Driver(Duration.ZERO, maxIterations, maxDuration, 3, true, 1);
        BatchProperties properties = new BatchProperties(0, null, null, 0, 0, null, null, driver, null);
        return new BatchDriverLoop(executor, properties, clock, pool);
    }

    private BatchDriverLoop loop() {
        return loop(200, Duration.ofHours(2), new SyncTaskExecutor());
    }

    @Test
    @DisplayName("runs until the executor reports completion")
    void drivesToCompletion() {
        when(executor.execute(jobId)).thenReturn(inProgress(4), inProgress(3), completed(3));

        DriveResult result = loop().drive(jobId);

        assertThat(result.reason()).isEqualTo(StopReason.COMPLETED);
        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.processed()).isEqualTo(10);
    }

    @Test
    @DisplayName("gives up after three invocations without progress")
    void stopsOnStall() {
        when(executor.execute(jobId)).thenReturn(inProgress(2), inProgress(0));

        DriveResult result = loop().drive(jobId);

        assertThat(result.reason()).isEqualTo(StopReason.STALLED);
        assertThat(result.iterations()).isEqualTo(4);
        verify(executor, times(4)).execute(jobId);
    }

    @Test
    @DisplayName("stops on an executor error")
    void stopsOnError() {
        when(executor.execute(jobId)).thenReturn(inProgress(1)).thenThrow(new IllegalStateException("db down"));

        DriveResult result = loop().drive(jobId);

        assertThat(result.reason()).isEqualTo(StopReason.ERROR);
        assertThat(result.error()).isEqualTo("db down");
        assertThat(result.processed()).isEqualTo(1);
    }

    @Test
    @DisplayName("stops at the iteration ceiling")
    void stopsAtMaxIterations() {
        when(executor.execute(jobId)).thenReturn(inProgress(1));

        DriveResult result = loop(2, Duration.ofHours(2), new SyncTaskExecutor()).drive(jobId);

        assertThat(result.reason()).isEqualTo(StopReason.MAX_ITERATIONS);
        verify(executor, times(2)).execute(jobId);
    }

    @Test
    @DisplayName("stops at the duration ceiling")
    void stopsAtMaxDuration() {
        when(executor.execute(jobId)).thenAnswer(inv -> {
            clock.advance(Duration.ofMinutes(40));
            return inProgress(1);
        });

        DriveResult result = loop(200, Duration.ofHours(1), new SyncTaskExecutor()).drive(jobId);

        assertThat(result.reason()).isEqualTo(StopReason.MAX_DURATION);
        assertThat(result.iterations()).isEqualTo(2);
    }

    @Test
    @DisplayName("stops when the job is cancelled")
    void stopsOnCancel() {
        when(executor.execute(jobId)).thenReturn(new ExecutionResult(jobId, JobAction.CANCELLED, JobStatus.CANCELLED,
                0, 0, 0, 0, 0, Duration.ZERO, "Job cancelled"));

        assertThat(loop().drive(jobId).reason()).isEqualTo(StopReason.CANCELLED);
    }

    @Test
    @DisplayName("a saturated pool leaves the job for the reconciler")
    void saturatedPool() {
        TaskExecutor rejecting = task -> { throw new TaskRejectedException("full"); };

        assertThat(loop(200, Duration.ofHours(2), rejecting).driveAsync(jobId)).isFalse();
        verify(executor, never()).execute(jobId);
    }

    @Test
    @DisplayName("a job already driven in this process is not driven twice")
    void alreadyRunning() {
        BatchDriverLoop loop = loop();
        when(executor.execute(jobId)).thenAnswer(inv -> {
            assertThat(loop.drive(jobId).reason()).isEqualTo(StopReason.ALREADY_RUNNING);
            return completed(1);
        });

        assertThat(loop.drive(jobId).reason()).isEqualTo(StopReason.COMPLETED);
        verify(executor, times(1)).execute(jobId);
    }

    private ExecutionResult inProgress(int processed) {
        return new ExecutionResult(jobId, JobAction.IN_PROGRESS, JobStatus.PROCESSING, processed, processed, 0,
                5, 1, Duration.ofSeconds(1), "Budget exhausted; resume to continue");
    }

    private ExecutionResult completed(int processed) {
        return new ExecutionResult(jobId, JobAction.COMPLETED, JobStatus.COMPLETED, processed, processed, 0,
                0, 1, Duration.ofSeconds(1), "Job finished");
    }
}
