package dev.llumos.batch.driver;

import dev.llumos.batch.executor.ExecutionResult;

import java.time.Duration;
import java.util.UUID;

/**
 * @param last the final executor result, or null when the loop stopped before any invocation
 */
public record DriveResult(UUID jobId, StopReason reason, int iterations, int processed,
                          Duration elapsed, ExecutionResult last, String error) {
}
