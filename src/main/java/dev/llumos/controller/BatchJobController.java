package dev.llumos.controller;

import dev.llumos.batch.executor.ExecutionResult;
import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.domain.enums.JobAction;
import dev.llumos.dto.request.StartBatchRequest;
import dev.llumos.dto.response.BatchJobListResponse;
import dev.llumos.dto.response.BatchRunResponse;
import dev.llumos.service.BatchJobQueryService;
import dev.llumos.service.BatchJobService;
import dev.llumos.service.OrgAccessPolicy;
import jakarta.validation.Valid;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Batch job endpoints. Every call is scoped to one organization: the caller's org claim must match,
 * unless the call carries the scheduler secret.
 */
@RestController
@RequestMapping("/batch-jobs")
public class BatchJobController {

    private final BatchJobService jobService;
    private final BatchJobQueryService queryService;
    private final OrgAccessPolicy accessPolicy;

    public BatchJobController(BatchJobService jobService, BatchJobQueryService queryService,
                              OrgAccessPolicy accessPolicy) {
        this.jobService = jobService;
        this.queryService = queryService;
        this.accessPolicy = accessPolicy;
    }

    @PostMapping
    public BatchRunResponse start(@Valid @RequestBody StartBatchRequest request, Authentication authentication) {
        accessPolicy.checkAccess(authentication, request.orgId());
        String trigger = request.triggerSource() != null ? request.triggerSource()
                : accessPolicy.isScheduler(authentication) ? "scheduler" : "api";
        return BatchRunResponse.of(jobService.start(request.orgId(), request.replace(), trigger));
    }

    @PostMapping("/{id}/resume")
    public BatchRunResponse resume(@PathVariable UUID id, Authentication authentication) {
        authorizedJob(id, authentication);
        ExecutionResult result = jobService.resume(id);
        return BatchRunResponse.of(result, queryService.get(id));
    }

    @PostMapping("/{id}/cancel")
    public BatchRunResponse cancel(@PathVariable UUID id, Authentication authentication) {
        authorizedJob(id, authentication);
        return BatchRunResponse.of(jobService.cancel(id));
    }

    @GetMapping("/{id}")
    public BatchRunResponse get(@PathVariable UUID id, Authentication authentication) {
        JobSnapshot job = authorizedJob(id, authentication);
        return BatchRunResponse.of(JobAction.forStatus(job.status()), job, null);
    }

    @GetMapping
    public BatchJobListResponse list(@RequestParam UUID orgId, @RequestParam(defaultValue = "20") int limit,
                                     Authentication authentication) {
        accessPolicy.checkAccess(authentication, orgId);
        List<BatchRunResponse> jobs = queryService.recent(orgId, limit).stream()
                .map(job -> BatchRunResponse.of(JobAction.forStatus(job.status()), job, null))
                .toList();
        return new BatchJobListResponse(true, orgId, jobs.size(), jobs);
    }

    private JobSnapshot authorizedJob(UUID id, Authentication authentication) {
        JobSnapshot job = queryService.get(id);
        accessPolicy.checkAccess(authentication, job.orgId());
        return job;
    }
}
