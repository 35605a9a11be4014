package dev.llumos.controller;

import dev.llumos.batch.reconciler.BatchReconciler;
import dev.llumos.batch.scheduler.DailyBatchScheduler;
import dev.llumos.dto.request.DailyRunRequest;
import dev.llumos.dto.response.DailyRunResponse;
import dev.llumos.dto.response.DiagnosticsResponse;
import dev.llumos.dto.response.ReconcileResponse;
import dev.llumos.service.SchedulerDiagnosticsService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

/** Cron-facing endpoints; security restricts them to callers holding the cron secret. */
@RestController
@RequestMapping("/scheduler")
public class SchedulerController {

    private final BatchReconciler reconciler;
    private final DailyBatchScheduler dailyScheduler;
    private final SchedulerDiagnosticsService diagnosticsService;

    public SchedulerController(BatchReconciler reconciler, DailyBatchScheduler dailyScheduler,
                               SchedulerDiagnosticsService diagnosticsService) {
        this.reconciler = reconciler;
        this.dailyScheduler = dailyScheduler;
        this.diagnosticsService = diagnosticsService;
    }

    @PostMapping("/reconcile")
    public ReconcileResponse reconcile() {
        return ReconcileResponse.from(reconciler.reconcile());
    }

    @PostMapping("/daily-run")
    public DailyRunResponse dailyRun(@Valid @RequestBody(required = false) DailyRunRequest request) {
        boolean force = request != null && request.force();
        String trigger = request != null && request.triggerSource() != null ? request.triggerSource() : "http";
        return DailyRunResponse.from(dailyScheduler.runDaily(force, trigger));
    }

    @GetMapping("/diagnostics")
    public DiagnosticsResponse diagnostics() {
        return diagnosticsService.diagnostics();
    }
}
