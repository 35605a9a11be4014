package dev.llumos.batch.reconciler;

import dev.llumos.domain.enums.JobAction;

import java.util.List;
import java.util.UUID;

/**
 * Summary of one reconciler sweep. {@code processed} counts stale jobs examined;
 * cancelled jobs are included in {@code finalized}.
 */
public record ReconcileReport(int processed, int finalized, int resumed, int skipped, int errors,
                              List<JobResult> results) {

    public ReconcileReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ReconcileReport of(List<JobResult> results) {
        int finalized = 0, resumed = 0, skipped = 0, errors = 0;
        for (JobResult r : results) {
            switch (r.action()) {
                case FINALIZED, CANCELLED -> finalized++;
                case RESUMED -> resumed++;
                case ERROR -> errors++;
                default -> skipped++;
            }
        }
        return new ReconcileReport(results.size(), finalized, resumed, skipped, errors, results);
    }

    public record JobResult(UUID jobId, JobAction action, String detail) {}
}
