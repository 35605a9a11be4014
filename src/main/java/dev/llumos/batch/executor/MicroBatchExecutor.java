package dev.llumos.batch.executor;

import dev.llumos.analysis.BrandProfile;
import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.batch.store.JobStore;
import dev.llumos.batch.store.TaskCounts;
import dev.llumos.batch.store.TaskSnapshot;
import dev.llumos.config.BatchProperties;
import dev.llumos.domain.entity.Prompt;
import dev.llumos.domain.enums.JobAction;
import dev.llumos.domain.enums.JobEvent;
import dev.llumos.domain.enums.JobStatus;
import dev.llumos.exception.JobNotFoundException;
import dev.llumos.repository.BrandCatalogRepository;
import dev.llumos.repository.PromptRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Processes a job in short, time-boxed invocations.
 *
 * <pre>
 *  1. Terminal job?               → report it, touch nothing
 *  2. Cancellation requested?     → cancel open tasks, job → CANCELLED
 *  3. Nothing pending/processing? → finalize, counters untouched
 *  4. job → PROCESSING, heartbeat, seed the per-prompt breaker from task history
 *  5. Loop while budget remains:
 *       check cancellation, fetch a slice of pending tasks, group by prompt,
 *       run groups in parallel (tasks within a group sequentially), heartbeat
 *  6. Drained → finalize; otherwise return IN_PROGRESS with the remaining count
 * </pre>
 *
 * <p>Tasks of one prompt run sequentially so the circuit breaker sees failures in order and the
 * task after the threshold is skipped deterministically. Different prompts share a bounded pool;
 * at most {@code maxConcurrentCalls} groups of one invocation are in flight.
 */
@Component
public class MicroBatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(MicroBatchExecutor.class);

    private final JobStore store;
    private final TaskProcessor taskProcessor;
    private final JobFinalizer finalizer;
    private final PromptRepository promptRepository;
    private final BrandCatalogRepository brandCatalogRepository;
    private final BatchProperties properties;
    private final ExecutorService providerCallExecutor;
    private final Clock clock;
    private final Timer invocationTimer;
    private final String runnerId = "executor-" + UUID.randomUUID();

    public MicroBatchExecutor(JobStore store,
                              TaskProcessor taskProcessor,
                              JobFinalizer finalizer,
                              PromptRepository promptRepository,
                              BrandCatalogRepository brandCatalogRepository,
                              BatchProperties properties,
                              @Qualifier("providerCallExecutor") ExecutorService providerCallExecutor,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.store = store;
        this.taskProcessor = taskProcessor;
        this.finalizer = finalizer;
        this.promptRepository = promptRepository;
        this.brandCatalogRepository = brandCatalogRepository;
        this.properties = properties;
        this.providerCallExecutor = providerCallExecutor;
        this.clock = clock;
        this.invocationTimer = Timer.builder("llumos.batch.invocation.duration")
                .description("Wall-clock time of one micro-batch executor invocation")
                .register(meterRegistry);
    }

    public ExecutionResult execute(UUID jobId) {
        return execute(jobId, properties.invocationBudget());
    }

    public ExecutionResult execute(UUID jobId, Duration budget) {
        Timer.Sample sample = Timer.start();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("jobId", jobId.toString())) {
            return run(jobId, InvocationBudget.start(clock, budget, properties.budgetSafetyMargin()));
        } finally {
            sample.stop(invocationTimer);
        }
    }

    private ExecutionResult run(UUID jobId, InvocationBudget budget) {
        JobSnapshot job = store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        if (job.isTerminal()) {
            return result(job.id(), JobAction.forStatus(job.status()), job.status(), Tally.EMPTY, 0, 0, budget,
                    "Job already " + job.status());
        }
        if (job.cancellationRequested()) {
            JobStatus status = finalizer.cancel(jobId);
            return result(jobId, JobAction.CANCELLED, status, Tally.EMPTY, 0, 0, budget, "Job cancelled");
        }
        TaskCounts counts = store.taskCounts(jobId);
        if (counts.isDrained()) {
            JobStatus status = finalizer.finalizeJob(jobId);
            return result(jobId, JobAction.COMPLETED, status, Tally.EMPTY, 0, 0, budget, "No tasks left");
        }

        store.setStatus(jobId, JobEvent.START);
        store.heartbeat(jobId, runnerId);

        PromptCircuitBreaker breaker = PromptCircuitBreaker.seeded(
                properties.circuitBreakerThreshold(), budget.total(), store.finishedTasks(jobId));
        BrandProfile brands = BrandProfile.from(brandCatalogRepository.findByOrgId(job.orgId()));
        Tally tally = new Tally();
        int slices = 0;

        log.info("Executing job {}: {} open tasks, budget {}s", jobId, counts.open(), budget.remaining().toSeconds());

        while (!budget.isExhausted()) {
            if (isCancellationRequested(jobId)) {
                JobStatus status = finalizer.cancel(jobId);
                return result(jobId, JobAction.CANCELLED, status, tally, 0, slices, budget, "Job cancelled");
            }
            List<TaskSnapshot> slice = store.pendingTasks(jobId, properties.microBatchSize());
            if (slice.isEmpty()) break;

            boolean progressed = runSlice(slice, brands, breaker, budget, tally);
            slices++;
            store.heartbeat(jobId, runnerId);
            if (!progressed) break;
        }

        counts = store.taskCounts(jobId);
        if (counts.isDrained()) {
            JobStatus status = finalizer.finalizeJob(jobId);
            return result(jobId, JobAction.COMPLETED, status, tally, 0, slices, budget, "Job finished");
        }
        log.info("Job {} paused after {} slices: {} processed this invocation, {} remaining",
                jobId, slices, tally.processed(), counts.open());
        return result(jobId, JobAction.IN_PROGRESS, JobStatus.PROCESSING, tally, counts.open(), slices, budget,
                "Budget exhausted; resume to continue");
    }

    /** Returns whether any task in the slice reached a terminal state or was taken by another runner. */
    private boolean runSlice(List<TaskSnapshot> slice, BrandProfile brands, PromptCircuitBreaker breaker,
                             InvocationBudget budget, Tally tally) {
        Map<UUID, String> promptTexts = promptRepository
                .findAllById(slice.stream().map(TaskSnapshot::promptId).distinct().toList())
                .stream().collect(Collectors.toMap(Prompt::getId, Prompt::getText));

        Map<UUID, List<TaskSnapshot>> byPrompt = slice.stream().collect(Collectors.groupingBy(
                TaskSnapshot::promptId, LinkedHashMap::new, Collectors.toList()));

        Semaphore permits = new Semaphore(properties.maxConcurrentCalls());
        List<CompletableFuture<Void>> futures = new ArrayList<>(byPrompt.size());
        AtomicInteger moved = new AtomicInteger();
        try {
            for (Map.Entry<UUID, List<TaskSnapshot>> group : byPrompt.entrySet()) {
                permits.acquire();
                String text = promptTexts.get(group.getKey());
                futures.add(CompletableFuture
                        .runAsync(() -> runGroup(group.getValue(), text, brands, breaker, budget, tally, moved),
                                providerCallExecutor)
                        .whenComplete((ok, error) -> permits.release()));
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while dispatching tasks", e);
        }
        return moved.get() > 0;
    }

    private void runGroup(List<TaskSnapshot> tasks, String promptText, BrandProfile brands,
                          PromptCircuitBreaker breaker, InvocationBudget budget, Tally tally, AtomicInteger moved) {
        for (TaskSnapshot task : tasks) {
            TaskOutcome outcome = taskProcessor.process(task, promptText, brands, breaker, budget);
            if (outcome == TaskOutcome.DEFERRED) return;
            tally.add(outcome);
            moved.incrementAndGet();
        }
    }

    private boolean isCancellationRequested(UUID jobId) {
        return store.get(jobId).map(JobSnapshot::cancellationRequested).orElse(false);
    }

    private ExecutionResult result(UUID jobId, JobAction action, JobStatus status, Tally tally, long remaining,
                                   int slices, InvocationBudget budget, String message) {
        return new ExecutionResult(jobId, action, status, tally.processed(), tally.succeeded.get(),
                tally.failed.get(), remaining, slices, budget.elapsed(), message);
    }

    /** Thread-safe per-invocation counts. */
    private static final class Tally {
        static final Tally EMPTY = new Tally();

        final AtomicInteger succeeded = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();

        void add(TaskOutcome outcome) {
            switch (outcome) {
                case COMPLETED -> succeeded.incrementAndGet();
                case FAILED, SKIPPED -> failed.incrementAndGet();
                default -> { }
            }
        }

        int processed() {
            return succeeded.get() + failed.get();
        }
    }
}
