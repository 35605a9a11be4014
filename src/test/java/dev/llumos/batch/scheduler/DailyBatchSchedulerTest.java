package dev.llumos.batch.scheduler;

import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.config.SchedulerProperties;
import dev.llumos.domain.entity.Organization;
import dev.llumos.domain.entity.SchedulerRun;
import dev.llumos.domain.enums.JobAction;
import dev.llumos.domain.enums.JobStatus;
import dev.llumos.domain.enums.PlanTier;
import dev.llumos.domain.enums.SchedulerRunStatus;
import dev.llumos.exception.BatchValidationException;
import dev.llumos.repository.OrganizationRepository;
import dev.llumos.repository.SchedulerRunRepository;
import dev.llumos.service.BatchJobService;
import dev.llumos.service.JobCommandResult;
import dev.llumos.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DailyBatchSchedulerTest {

    // 03:00 in New York, inside the 03:00-06:00 window
    private static final Instant IN_WINDOW = Instant.parse("2026-03-02T08:00:00Z");

    private final MutableClock clock = new MutableClock(IN_WINDOW);
    private final OrganizationRepository organizationRepository = mock(OrganizationRepository.class);
    private final SchedulerRunRepository runRepository = mock(SchedulerRunRepository.class);
    private final BatchJobService jobService = mock(BatchJobService.class);

    private DailyBatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        when(runRepository.save(any(SchedulerRun.class))).thenAnswer(inv -> inv.getArgument(0));
        scheduler = new DailyBatchScheduler(organizationRepository, runRepository, jobService,
                new SchedulerProperties(true, null, ZoneId.of("America/New_York"), 3, 6), clock);
    }

    @Test
    @DisplayName("outside the window nothing is recorded or started")
    void outsideWindow() {
        clock.set(Instant.parse("2026-03-02T15:00:00Z"));

        DailyRunReport report = scheduler.runDaily(false, "cron");

        assertThat(report.action()).isEqualTo(JobAction.SKIPPED);
        assertThat(report.message()).contains("Outside execution window");
        verifyNoInteractions(runRepository, jobService, organizationRepository);
    }

    @Test
    @DisplayName("force ignores the window")
    void forceIgnoresWindow() {
        clock.set(Instant.parse("2026-03-02T15:00:00Z"));
        when(organizationRepository.findWithActivePrompts()).thenReturn(List.of());

        DailyRunReport report = scheduler.runDaily(true, "http");

        assertThat(report.action()).isEqualTo(JobAction.COMPLETED);
        assertThat(report.organizations()).isZero();
    }

    @Test
    @DisplayName("a second delivery on the same day is skipped and recorded as such")
    void alreadyCompletedToday() {
        when(runRepository.existsByFunctionNameAndRunKeyAndStatus(
                DailyBatchScheduler.FUNCTION_NAME, "2026-03-02", SchedulerRunStatus.COMPLETED)).thenReturn(true);

        DailyRunReport report = scheduler.runDaily(false, "cron");

        assertThat(report.action()).isEqualTo(JobAction.SKIPPED);
        ArgumentCaptor<SchedulerRun> saved = ArgumentCaptor.forClass(SchedulerRun.class);
        verify(runRepository).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(SchedulerRunStatus.SKIPPED);
        verifyNoInteractions(jobService);
    }

    @Test
    @DisplayName("starts a job per organization and counts each outcome")
    void startsJobsPerOrganization() {
        Organization fresh = Organization.create("Fresh", null, PlanTier.STARTER);
        Organization busy = Organization.create("Busy", null, PlanTier.GROWTH);
        Organization broken = Organization.create("Broken", null, PlanTier.FREE);
        when(organizationRepository.findWithActivePrompts()).thenReturn(List.of(fresh, busy, broken));
        when(jobService.start(eq(fresh.getId()), eq(false), anyString()))
                .thenReturn(result(JobAction.CREATED, fresh.getId()));
        when(jobService.start(eq(busy.getId()), eq(false), anyString()))
                .thenReturn(result(JobAction.EXISTING, busy.getId()));
        when(jobService.start(eq(broken.getId()), anyBoolean(), anyString()))
                .thenThrow(new BatchValidationException("Organization has no active prompts"));

        DailyRunReport report = scheduler.runDaily(false, "cron");

        assertThat(report.action()).isEqualTo(JobAction.COMPLETED);
        assertThat(report.runKey()).isEqualTo("2026-03-02");
        assertThat(report.organizations()).isEqualTo(3);
        assertThat(report.created()).isEqualTo(1);
        assertThat(report.existing()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.jobIds()).hasSize(2);

        ArgumentCaptor<SchedulerRun> saved = ArgumentCaptor.forClass(SchedulerRun.class);
        verify(runRepository, atLeastOnce()).save(saved.capture());
        SchedulerRun run = saved.getValue();
        assertThat(run.getStatus()).isEqualTo(SchedulerRunStatus.COMPLETED);
        assertThat(run.getResult()).containsEntry("created", 1).containsEntry("failed", 1);
    }

    @Test
    @DisplayName("a failure of the run itself is recorded and reported as ERROR")
    void runFailure() {
        when(organizationRepository.findWithActivePrompts()).thenThrow(new IllegalStateException("db down"));

        DailyRunReport report = scheduler.runDaily(false, "cron");

        assertThat(report.action()).isEqualTo(JobAction.ERROR);
        assertThat(report.message()).isEqualTo("db down");
        ArgumentCaptor<SchedulerRun> saved = ArgumentCaptor.forClass(SchedulerRun.class);
        verify(runRepository, atLeastOnce()).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(SchedulerRunStatus.FAILED);
        assertThat(saved.getValue().getErrorMessage()).isEqualTo("db down");
    }

    private static JobCommandResult result(JobAction action, UUID orgId) {
        JobSnapshot job = new JobSnapshot(UUID.randomUUID(), orgId, JobStatus.PENDING, 2, 0, 0, false, null,
                null, Map.of(), IN_WINDOW, null, null);
        return new JobCommandResult(action, job, "ok");
    }
}
