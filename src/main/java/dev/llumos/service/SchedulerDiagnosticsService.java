package dev.llumos.service;

import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.batch.store.JobStore;
import dev.llumos.config.BatchProperties;
import dev.llumos.domain.entity.SchedulerRun;
import dev.llumos.domain.enums.JobStatus;
import dev.llumos.dto.response.DiagnosticsResponse;
import dev.llumos.repository.SchedulerRunRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Operator view of the scheduler: recent runs and the state of the job table. */
@Service
@Transactional(readOnly = true)
public class SchedulerDiagnosticsService {

    private final SchedulerRunRepository runRepository;
    private final JobStore store;
    private final BatchProperties properties;
    private final Clock clock;

    public SchedulerDiagnosticsService(SchedulerRunRepository runRepository, JobStore store,
                                       BatchProperties properties, Clock clock) {
        this.runRepository = runRepository;
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    public DiagnosticsResponse diagnostics() {
        Instant now = clock.instant();
        Map<JobStatus, Long> byStatus = store.countByStatus();
        long active = byStatus.getOrDefault(JobStatus.PENDING, 0L) + byStatus.getOrDefault(JobStatus.PROCESSING, 0L);
        List<UUID> stale = store.findStale(now.minus(properties.staleHeartbeat())).stream()
                .map(JobSnapshot::id)
                .toList();
        List<DiagnosticsResponse.RunSummary> runs = runRepository.findTop10ByOrderByStartedAtDesc().stream()
                .map(this::toSummary)
                .toList();
        return new DiagnosticsResponse(true, active, byStatus, stale, runs, now);
    }

    private DiagnosticsResponse.RunSummary toSummary(SchedulerRun r) {
        return new DiagnosticsResponse.RunSummary(r.getId(), r.getFunctionName(), r.getRunKey(),
                r.getTriggerSource(), r.getStatus(), r.getResult(), r.getErrorMessage(),
                r.getStartedAt(), r.getCompletedAt());
    }
}
