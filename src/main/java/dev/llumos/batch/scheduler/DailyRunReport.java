package dev.llumos.batch.scheduler;

import dev.llumos.domain.enums.JobAction;

import java.util.List;
import java.util.UUID;

/**
 * Result of one daily trigger. {@code action} is COMPLETED when the run went through, SKIPPED when
 * it was outside the window or already done for the day, ERROR when the run itself failed.
 */
public record DailyRunReport(JobAction action, String runKey, int organizations, int created, int existing,
                             int failed, List<UUID> jobIds, String message) {

    public DailyRunReport {
        jobIds = jobIds == null ? List.of() : List.copyOf(jobIds);
    }

    static DailyRunReport skipped(String runKey, String message) {
        return new DailyRunReport(JobAction.SKIPPED, runKey, 0, 0, 0, 0, List.of(), message);
    }
}
