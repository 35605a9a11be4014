package dev.llumos.controller;

import dev.llumos.batch.reconciler.BatchReconciler;
import dev.llumos.batch.reconciler.ReconcileReport;
import dev.llumos.batch.scheduler.DailyBatchScheduler;
import dev.llumos.batch.scheduler.DailyRunReport;
import dev.llumos.config.SecurityConfig;
import dev.llumos.domain.enums.JobAction;
import dev.llumos.domain.enums.JobStatus;
import dev.llumos.dto.response.DiagnosticsResponse;
import dev.llumos.infrastructure.security.CronSecretVerifier;
import dev.llumos.service.OrgAccessPolicy;
import dev.llumos.service.SchedulerDiagnosticsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SchedulerController.class)
@Import({SecurityConfig.class, CronSecretVerifier.class, OrgAccessPolicy.class})
@TestPropertySource(properties = {
        "llumos.security.jwt-secret=0123456789abcdef0123456789abcdef",
        "llumos.security.cron-secret=cron-test-secret"
})
class SchedulerControllerTest {

    private static final String SECRET_HEADER = "X-Cron-Secret";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private BatchReconciler reconciler;

    @MockitoBean
    private DailyBatchScheduler dailyScheduler;

    @MockitoBean
    private SchedulerDiagnosticsService diagnosticsService;

    @Test
    @DisplayName("reconcile reports what the sweep did")
    void reconcile() throws Exception {
        UUID finalized = UUID.randomUUID();
        UUID resumed = UUID.randomUUID();
        when(reconciler.reconcile()).thenReturn(ReconcileReport.of(List.of(
                new ReconcileReport.JobResult(finalized, JobAction.FINALIZED, "all tasks done"),
                new ReconcileReport.JobResult(resumed, JobAction.RESUMED, "2 stuck tasks reset"))));

        mockMvc.perform(post("/scheduler/reconcile").header(SECRET_HEADER, "cron-test-secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.processed").value(2))
                .andExpect(jsonPath("$.finalized").value(1))
                .andExpect(jsonPath("$.resumed").value(1))
                .andExpect(jsonPath("$.results[0].jobId").value(finalized.toString()));
    }

    @Test
    @DisplayName("a wrong secret is rejected with 401")
    void wrongSecret() throws Exception {
        mockMvc.perform(post("/scheduler/reconcile").header(SECRET_HEADER, "guess"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(reconciler);
    }

    @Test
    @DisplayName("a user token is not enough for scheduler endpoints")
    void userTokenForbidden() throws Exception {
        mockMvc.perform(post("/scheduler/reconcile").with(jwt().jwt(j -> j.claim("org_id", UUID.randomUUID().toString()))))
                .andExpect(status().isForbidden());

        verifyNoInteractions(reconciler);
    }

    @Test
    @DisplayName("no credentials at all gets 401")
    void noCredentials() throws Exception {
        mockMvc.perform(post("/scheduler/reconcile"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("daily-run passes force and trigger through")
    void dailyRunForced() throws Exception {
        when(dailyScheduler.runDaily(true, "github-actions")).thenReturn(new DailyRunReport(JobAction.COMPLETED,
                "2026-03-02", 2, 1, 1, 0, List.of(UUID.randomUUID(), UUID.randomUUID()), "Started 1 jobs for 2 organizations"));

        mockMvc.perform(post("/scheduler/daily-run").header(SECRET_HEADER, "cron-test-secret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"force\":true,\"triggerSource\":\"github-actions\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.created").value(1))
                .andExpect(jsonPath("$.runKey").value("2026-03-02"));
    }

    @Test
    @DisplayName("daily-run without a body is an unforced http trigger")
    void dailyRunWithoutBody() throws Exception {
        when(dailyScheduler.runDaily(false, "http")).thenReturn(new DailyRunReport(JobAction.SKIPPED,
                "2026-03-02", 0, 0, 0, 0, List.of(), "Outside execution window"));

        mockMvc.perform(post("/scheduler/daily-run").header(SECRET_HEADER, "cron-test-secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("skipped"));

        verify(dailyScheduler).runDaily(false, "http");
    }

    @Test
    @DisplayName("diagnostics lists stale jobs")
    void diagnostics() throws Exception {
        UUID stale = UUID.randomUUID();
        when(diagnosticsService.diagnostics()).thenReturn(new DiagnosticsResponse(true, 1,
                Map.of(JobStatus.PROCESSING, 1L), List.of(stale), List.of(), Instant.parse("2026-03-02T08:00:00Z")));

        mockMvc.perform(get("/scheduler/diagnostics").header(SECRET_HEADER, "cron-test-secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeJobs").value(1))
                .andExpect(jsonPath("$.staleJobIds[0]").value(stale.toString()));
    }
}
