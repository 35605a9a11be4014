package dev.llumos.dto.response;

import dev.llumos.batch.scheduler.DailyRunReport;
import dev.llumos.domain.enums.JobAction;

import java.util.List;
import java.util.UUID;

public record DailyRunResponse(boolean success, JobAction action, String runKey, int organizations, int created,
                               int existing, int failed, List<UUID> jobIds, String message) {

    public static DailyRunResponse from(DailyRunReport report) {
        return new DailyRunResponse(report.action() != JobAction.ERROR, report.action(), report.runKey(),
                report.organizations(), report.created(), report.existing(), report.failed(), report.jobIds(),
                report.message());
    }
}
