package dev.llumos.batch.scheduler;

import dev.llumos.config.SchedulerProperties;
import dev.llumos.domain.entity.Organization;
import dev.llumos.domain.entity.SchedulerRun;
import dev.llumos.domain.enums.JobAction;
import dev.llumos.domain.enums.SchedulerRunStatus;
import dev.llumos.repository.OrganizationRepository;
import dev.llumos.repository.SchedulerRunRepository;
import dev.llumos.service.BatchJobService;
import dev.llumos.service.JobCommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Daily scan trigger. Starts one non-replacing job per organization with active prompts; each
 * created job is picked up by the driver once its creation commits.
 *
 * <p>Only runs inside the configured local window unless forced, and at most once per local date.
 */
@Component
public class DailyBatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailyBatchScheduler.class);

    static final String FUNCTION_NAME = "daily-batch";

    private final OrganizationRepository organizationRepository;
    private final SchedulerRunRepository runRepository;
    private final BatchJobService jobService;
    private final SchedulerProperties properties;
    private final Clock clock;

    public DailyBatchScheduler(OrganizationRepository organizationRepository, SchedulerRunRepository runRepository,
                               BatchJobService jobService, SchedulerProperties properties, Clock clock) {
        this.organizationRepository = organizationRepository;
        this.runRepository = runRepository;
        this.jobService = jobService;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${llumos.scheduler.cron:0 5 3 * * *}", zone = "${llumos.scheduler.zone:America/New_York}")
    public void onSchedule() {
        if (!properties.enabled()) return;
        DailyRunReport report = runDaily(false, "cron");
        log.info("Daily run {}: {} ({} created, {} existing, {} failed)", report.runKey(), report.action(),
                report.created(), report.existing(), report.failed());
    }

    public DailyRunReport runDaily(boolean force, String triggerSource) {
        ZonedDateTime localNow = ZonedDateTime.now(clock.withZone(properties.zone()));
        String runKey = localNow.toLocalDate().toString();
        String trigger = triggerSource == null || triggerSource.isBlank() ? "manual" : triggerSource;

        if (!force && !properties.isInWindow(localNow.getHour())) {
            String reason = "Outside execution window (%02d:00-%02d:00 %s), local hour %d".formatted(
                    properties.windowStartHour(), properties.windowEndHour(), properties.zone(), localNow.getHour());
            log.info("Daily run skipped: {}", reason);
            return DailyRunReport.skipped(runKey, reason);
        }
        if (!force && runRepository.existsByFunctionNameAndRunKeyAndStatus(
                FUNCTION_NAME, runKey, SchedulerRunStatus.COMPLETED)) {
            runRepository.save(SchedulerRun.skipped(FUNCTION_NAME, runKey, trigger, "already completed", clock.instant()));
            return DailyRunReport.skipped(runKey, "Daily run already completed for " + runKey);
        }

        SchedulerRun run = runRepository.save(SchedulerRun.start(FUNCTION_NAME, runKey, trigger, clock.instant()));
        try {
            DailyRunReport report = startJobs(runKey, trigger);
            run.complete(summary(report), clock.instant());
            runRepository.save(run);
            return report;
        } catch (RuntimeException e) {
            log.error("Daily run {} failed", runKey, e);
            run.fail(e.getMessage(), clock.instant());
            runRepository.save(run);
            return new DailyRunReport(JobAction.ERROR, runKey, 0, 0, 0, 0, List.of(), e.getMessage());
        }
    }

    private DailyRunReport startJobs(String runKey, String trigger) {
        List<Organization> orgs = organizationRepository.findWithActivePrompts();
        int created = 0, existing = 0, failed = 0;
        List<UUID> jobIds = new ArrayList<>();
        for (Organization org : orgs) {
            try {
                JobCommandResult result = jobService.start(org.getId(), false, trigger);
                jobIds.add(result.job().id());
                if (result.action() == JobAction.CREATED) created++;
                else existing++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Daily run could not start a job for org {}: {}", org.getId(), e.getMessage());
            }
        }
        return new DailyRunReport(JobAction.COMPLETED, runKey, orgs.size(), created, existing, failed, jobIds,
                "Started %d jobs for %d organizations".formatted(created, orgs.size()));
    }

    private static Map<String, Object> summary(DailyRunReport report) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("organizations", report.organizations());
        summary.put("created", report.created());
        summary.put("existing", report.existing());
        summary.put("failed", report.failed());
        summary.put("jobIds", report.jobIds().stream().map(UUID::toString).toList());
        return summary;
    }
}
