package dev.llumos.batch.executor;

import dev.llumos.batch.store.TaskSnapshot;
import dev.llumos.domain.enums.TaskStatus;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Per-prompt Resilience4j circuit breakers for one executor invocation. A prompt's circuit opens
 * after {@code threshold} consecutive failed tasks; its remaining tasks are then failed without an
 * outbound call.
 *
 * <p>The registry lives for one invocation and is re-seeded from finished task history at the
 * start of the next, so an open circuit holds across invocations. The open state outlasts the
 * invocation, so a circuit never half-opens mid-run.
 */
public final class PromptCircuitBreaker {

    private static final Throwable EARLIER_FAILURE = new IllegalStateException("Task failed in an earlier invocation");

    private final int threshold;
    private final CircuitBreakerRegistry registry;

    public PromptCircuitBreaker(int threshold, Duration invocationBudget) {
        if (threshold <= 0) throw new IllegalArgumentException("threshold must be > 0");
        this.threshold = threshold;
        this.registry = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100)
                .waitDurationInOpenState(invocationBudget.plus(Duration.ofMinutes(1)))
                .build());
    }

    /**
     * @param finished COMPLETED and FAILED tasks, oldest completion first
     */
    public static PromptCircuitBreaker seeded(int threshold, Duration invocationBudget, List<TaskSnapshot> finished) {
        PromptCircuitBreaker breaker = new PromptCircuitBreaker(threshold, invocationBudget);
        for (TaskSnapshot task : finished) {
            if (task.status() == TaskStatus.FAILED) breaker.recordFailure(task.promptId(), EARLIER_FAILURE);
            else if (task.status() == TaskStatus.COMPLETED) breaker.recordSuccess(task.promptId());
        }
        return breaker;
    }

    /** False while the prompt's circuit is open. A granted permission must be followed by a record or a release. */
    public boolean tryAcquire(UUID promptId) {
        return circuit(promptId).tryAcquirePermission();
    }

    /** Gives back a permission when no provider call was made. */
    public void release(UUID promptId) {
        circuit(promptId).releasePermission();
    }

    public void recordFailure(UUID promptId, Throwable cause) {
        circuit(promptId).onError(0, TimeUnit.NANOSECONDS, cause);
    }

    public void recordSuccess(UUID promptId) {
        circuit(promptId).onSuccess(0, TimeUnit.NANOSECONDS);
    }

    public boolean isOpen(UUID promptId) {
        return circuit(promptId).getState() == CircuitBreaker.State.OPEN;
    }

    public int threshold() {
        return threshold;
    }

    private CircuitBreaker circuit(UUID promptId) {
        return registry.circuitBreaker(promptId.toString());
    }
}
