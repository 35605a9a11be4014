package dev.llumos.dto.response;

import dev.llumos.domain.enums.JobStatus;
import dev.llumos.domain.enums.SchedulerRunStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record DiagnosticsResponse(boolean success, long activeJobs, Map<JobStatus, Long> jobsByStatus,
                                  List<UUID> staleJobIds, List<RunSummary> recentRuns, Instant generatedAt) {

    public record RunSummary(UUID id, String functionName, String runKey, String triggerSource,
                             SchedulerRunStatus status, Map<String, Object> result, String errorMessage,
                             Instant startedAt, Instant completedAt) {}
}
