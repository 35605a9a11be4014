package dev.llumos.batch.executor;

import dev.llumos.analysis.BrandProfile;
import dev.llumos.analysis.VisibilityAnalyzer;
import dev.llumos.batch.store.JobStore;
import dev.llumos.batch.store.TaskSnapshot;
import dev.llumos.config.ProviderProperties;
import dev.llumos.domain.valueobject.ProviderAnswer;
import dev.llumos.domain.valueobject.VisibilityAnalysis;
import dev.llumos.infrastructure.provider.CallBudgetExhaustedException;
import dev.llumos.infrastructure.provider.LlmProviderClient;
import dev.llumos.infrastructure.provider.ProviderCallException;
import dev.llumos.infrastructure.provider.ProviderRegistry;
import dev.llumos.infrastructure.provider.RetryingProviderCaller;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs one task end to end: budget and circuit checks, claim, provider call with retries,
 * scoring, and recording the outcome.
 */
@Component
public class TaskProcessor {

    private static final Logger log = LoggerFactory.getLogger(TaskProcessor.class);

    private final JobStore store;
    private final ProviderRegistry providers;
    private final RetryingProviderCaller caller;
    private final VisibilityAnalyzer analyzer;
    private final Duration callTimeout;
    private final MeterRegistry meterRegistry;

    public TaskProcessor(JobStore store, ProviderRegistry providers, RetryingProviderCaller caller,
                         VisibilityAnalyzer analyzer, ProviderProperties providerProperties,
                         MeterRegistry meterRegistry) {
        this.store = store;
        this.providers = providers;
        this.caller = caller;
        this.analyzer = analyzer;
        this.callTimeout = providerProperties.callTimeout();
        this.meterRegistry = meterRegistry;
    }

    public TaskOutcome process(TaskSnapshot task, String promptText, BrandProfile brands,
                               PromptCircuitBreaker breaker, InvocationBudget budget) {
        if (budget.isExhausted()) return TaskOutcome.DEFERRED;
        if (!store.claimTask(task.id())) return count(TaskOutcome.NOT_CLAIMED);

        if (!breaker.tryAcquire(task.promptId())) {
            return fail(task, "Skipped: %d consecutive failures for this prompt".formatted(breaker.threshold()),
                    TaskOutcome.SKIPPED);
        }
        if (promptText == null) {
            breaker.release(task.promptId());
            return fail(task, "Prompt no longer exists", TaskOutcome.FAILED);
        }
        Optional<LlmProviderClient> client = providers.client(task.provider()).filter(LlmProviderClient::isConfigured);
        if (client.isEmpty()) {
            breaker.release(task.promptId());
            return fail(task, "Provider %s is not configured".formatted(task.provider().wireName()), TaskOutcome.FAILED);
        }

        ProviderAnswer answer;
        try {
            answer = caller.call(client.get(), promptText, () -> budget.clamp(callTimeout));
        } catch (CallBudgetExhaustedException e) {
            breaker.release(task.promptId());
            store.releaseTask(task.id());
            return count(TaskOutcome.DEFERRED);
        } catch (ProviderCallException e) {
            log.warn("Task {} ({}) failed: {}", task.id(), task.provider().wireName(), e.getMessage());
            return failAfterCall(task, e.getMessage(), e, breaker);
        } catch (RuntimeException e) {
            log.error("Task {} ({}) failed unexpectedly", task.id(), task.provider().wireName(), e);
            return failAfterCall(task, "Unexpected error: " + e.getMessage(), e, breaker);
        }

        VisibilityAnalysis analysis = analyzer.analyze(answer.text(), brands);
        boolean recorded;
        try {
            recorded = store.recordSuccess(task, answer, analysis);
        } catch (RuntimeException e) {
            log.error("Could not persist response for task {}; failing it", task.id(), e);
            breaker.release(task.promptId());
            return fail(task, "Failed to persist response: " + e.getMessage(), TaskOutcome.FAILED);
        }
        if (!recorded) {
            breaker.release(task.promptId());
            return superseded(task);
        }
        breaker.recordSuccess(task.promptId());
        log.debug("Task {} ({}) completed, score {}", task.id(), task.provider().wireName(), analysis.score());
        return count(TaskOutcome.COMPLETED);
    }

    private TaskOutcome failAfterCall(TaskSnapshot task, String error, Throwable cause, PromptCircuitBreaker breaker) {
        if (!store.recordFailure(task, error)) {
            breaker.release(task.promptId());
            return superseded(task);
        }
        breaker.recordFailure(task.promptId(), cause);
        return count(TaskOutcome.FAILED);
    }

    private TaskOutcome fail(TaskSnapshot task, String error, TaskOutcome outcome) {
        return store.recordFailure(task, error) ? count(outcome) : superseded(task);
    }

    /** The task left PROCESSING while we held it: cancelled, or reset and reclaimed elsewhere. */
    private TaskOutcome superseded(TaskSnapshot task) {
        log.info("Task {} was cancelled or reset while in flight; result discarded", task.id());
        return count(TaskOutcome.NOT_CLAIMED);
    }

    private TaskOutcome count(TaskOutcome outcome) {
        meterRegistry.counter("llumos.batch.tasks", "outcome", outcome.name().toLowerCase()).increment();
        return outcome;
    }
}
