package dev.llumos.batch.executor;

import dev.llumos.domain.enums.JobAction;
import dev.llumos.domain.enums.JobStatus;

import java.time.Duration;
import java.util.UUID;

/**
 * Outcome of one executor invocation. {@code processed} counts tasks this invocation moved to a
 * terminal state; {@code remaining} is what is still pending or processing afterwards.
 */
public record ExecutionResult(UUID jobId, JobAction action, JobStatus status, int processed, int succeeded,
                              int failed, long remaining, int slices, Duration elapsed, String message) {

    public boolean madeProgress() {
        return processed > 0;
    }
}
