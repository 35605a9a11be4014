package dev.llumos.dto.response;

import dev.llumos.batch.reconciler.ReconcileReport;
import dev.llumos.domain.enums.JobAction;

import java.util.List;

public record ReconcileResponse(boolean success, JobAction action, int processed, int finalized, int resumed,
                                int skipped, int errors, List<ReconcileReport.JobResult> results) {

    public static ReconcileResponse from(ReconcileReport report) {
        return new ReconcileResponse(true, JobAction.COMPLETED, report.processed(), report.finalized(),
                report.resumed(), report.skipped(), report.errors(), report.results());
    }
}
