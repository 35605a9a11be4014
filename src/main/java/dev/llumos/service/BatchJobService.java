package dev.llumos.service;

import dev.llumos.batch.executor.ExecutionResult;
import dev.llumos.batch.executor.JobFinalizer;
import dev.llumos.batch.executor.MicroBatchExecutor;
import dev.llumos.batch.fanout.FanoutPlan;
import dev.llumos.batch.fanout.TaskFanoutPlanner;
import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.batch.store.JobStore;
import dev.llumos.config.SchedulerProperties;
import dev.llumos.domain.entity.Organization;
import dev.llumos.domain.enums.JobAction;
import dev.llumos.domain.enums.JobStatus;
import dev.llumos.domain.event.BatchJobCreatedEvent;
import dev.llumos.exception.BatchValidationException;
import dev.llumos.exception.JobNotFoundException;
import dev.llumos.repository.OrganizationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Command side for batch jobs: start (fan-out with the one-active-job guard), resume one
 * executor invocation, and cancel.
 *
 * <p>Not {@code @Transactional}: each store call commits on its own, so a duplicate-create
 * violation can be answered by reading the winning job, and the created event is delivered to
 * its listener right away.
 */
@Service
public class BatchJobService {

    private static final Logger log = LoggerFactory.getLogger(BatchJobService.class);

    private final OrganizationRepository organizationRepository;
    private final TaskFanoutPlanner planner;
    private final JobStore store;
    private final MicroBatchExecutor executor;
    private final JobFinalizer finalizer;
    private final ApplicationEventPublisher eventPublisher;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    public BatchJobService(OrganizationRepository organizationRepository, TaskFanoutPlanner planner,
                           JobStore store, MicroBatchExecutor executor, JobFinalizer finalizer,
                           ApplicationEventPublisher eventPublisher, SchedulerProperties schedulerProperties,
                           Clock clock) {
        this.organizationRepository = organizationRepository;
        this.planner = planner;
        this.store = store;
        this.executor = executor;
        this.finalizer = finalizer;
        this.eventPublisher = eventPublisher;
        this.schedulerProperties = schedulerProperties;
        this.clock = clock;
    }

    public JobCommandResult start(UUID orgId, boolean replace, String triggerSource) {
        if (orgId == null) throw new BatchValidationException("orgId is required");
        Organization org = organizationRepository.findById(orgId)
                .orElseThrow(() -> new BatchValidationException("Unknown organization: " + orgId));
        String trigger = triggerSource == null || triggerSource.isBlank() ? "api" : triggerSource;

        List<UUID> replaced = List.of();
        if (replace) {
            replaced = store.cancelActiveJobs(orgId, "replaced by a new run from " + trigger);
        } else {
            Optional<JobCommandResult> existing = existingJob(orgId);
            if (existing.isPresent()) return existing.get();
        }

        FanoutPlan plan = planner.plan(org);
        Map<String, Object> metadata = plan.metadata();
        metadata.put("triggerSource", trigger);
        String correlationId = MDC.get("correlationId");
        if (correlationId != null) metadata.put("correlationId", correlationId);
        if (!replaced.isEmpty()) metadata.put("replacedJobs", replaced.stream().map(UUID::toString).toList());

        JobSnapshot job;
        try {
            job = store.create(orgId, plan.tasks(), metadata);
        } catch (DataIntegrityViolationException e) {
            JobSnapshot winner = store.findActiveJob(orgId).orElseThrow(() -> e);
            log.info("Concurrent start for org {} lost to job {}", orgId, winner.id());
            return new JobCommandResult(JobAction.EXISTING, winner, "A batch job is already running");
        }

        eventPublisher.publishEvent(new BatchJobCreatedEvent(job.id(), orgId, job.totalTasks(), trigger, clock.instant()));
        log.info("Started job {} for org {}: {} prompts x {} providers = {} tasks ({})", job.id(), orgId,
                plan.promptIds().size(), plan.providers().size(), job.totalTasks(), trigger);
        return new JobCommandResult(JobAction.CREATED, job,
                "Created %d tasks".formatted(job.totalTasks()));
    }

    public ExecutionResult resume(UUID jobId) {
        return executor.execute(jobId);
    }

    /**
     * Requests cooperative cancellation. A job no runner has started yet is cancelled on the spot;
     * a running one stops at its next slice boundary.
     */
    public JobCommandResult cancel(UUID jobId) {
        JobSnapshot job = store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.isTerminal()) {
            JobAction action = job.status() == JobStatus.CANCELLED ? JobAction.CANCELLED : JobAction.SKIPPED;
            return new JobCommandResult(action, job, "Job already " + job.status());
        }
        store.requestCancellation(jobId);
        if (job.status() == JobStatus.PENDING) {
            finalizer.cancel(jobId);
        }
        JobSnapshot current = store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        log.info("Cancellation requested for job {} (now {})", jobId, current.status());
        return new JobCommandResult(JobAction.CANCELLED, current,
                current.isTerminal() ? "Job cancelled" : "Cancellation requested; the runner stops at the next slice");
    }

    private Optional<JobCommandResult> existingJob(UUID orgId) {
        Optional<JobSnapshot> active = store.findActiveJob(orgId);
        if (active.isPresent()) {
            return Optional.of(new JobCommandResult(JobAction.EXISTING, active.get(), "A batch job is already running"));
        }
        return store.findJobSince(orgId, startOfToday())
                .map(job -> new JobCommandResult(JobAction.EXISTING, job, "A batch job already ran today"));
    }

    private Instant startOfToday() {
        return LocalDate.now(clock.withZone(schedulerProperties.zone()))
                .atStartOfDay(schedulerProperties.zone())
                .toInstant();
    }
}
