package dev.llumos.integration;

import dev.llumos.batch.executor.JobFinalizer;
import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.batch.store.JobStore;
import dev.llumos.batch.store.TaskSnapshot;
import dev.llumos.domain.enums.JobEvent;
import dev.llumos.domain.enums.JobStatus;
import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.enums.TaskStatus;
import dev.llumos.domain.valueobject.ProviderAnswer;
import dev.llumos.domain.valueobject.TaskKey;
import dev.llumos.domain.valueobject.VisibilityAnalysis;
import dev.llumos.repository.ResponseRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JpaJobStoreIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private JobStore store;

    @Autowired
    private ResponseRecordRepository responseRepository;

    @Autowired
    private JobFinalizer finalizer;

    private static List<TaskKey> tasks(int prompts, LlmProvider... providers) {
        List<TaskKey> keys = new ArrayList<>();
        for (int i = 0; i < prompts; i++) {
            UUID promptId = UUID.randomUUID();
            for (LlmProvider provider : providers) keys.add(new TaskKey(promptId, provider));
        }
        return keys;
    }

    @Test
    @DisplayName("create writes one task per distinct key and stores metadata")
    void createsJobWithTasks() {
        List<TaskKey> keys = tasks(3, LlmProvider.OPENAI, LlmProvider.PERPLEXITY);
        keys.add(keys.get(0));

        JobSnapshot job = store.create(UUID.randomUUID(), keys, Map.of("triggerSource", "test"));

        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.totalTasks()).isEqualTo(6);
        assertThat(store.taskCounts(job.id()).pending()).isEqualTo(6);
        assertThat(store.get(job.id()).orElseThrow().metadata()).containsEntry("triggerSource", "test");
    }

    @Test
    @DisplayName("a second active job for the same org violates the unique index")
    void oneActiveJobPerOrg() {
        UUID orgId = UUID.randomUUID();
        JobSnapshot first = store.create(orgId, tasks(1, LlmProvider.OPENAI), Map.of());

        assertThatThrownBy(() -> store.create(orgId, tasks(1, LlmProvider.OPENAI), Map.of()))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(store.findActiveJob(orgId)).map(JobSnapshot::id).contains(first.id());

        store.cancelActiveJobs(orgId, "test");
        JobSnapshot next = store.create(orgId, tasks(1, LlmProvider.OPENAI), Map.of());
        assertThat(next.id()).isNotEqualTo(first.id());
    }

    @Test
    @DisplayName("a task can be claimed once")
    void claimIsCompareAndSet() {
        JobSnapshot job = store.create(UUID.randomUUID(), tasks(1, LlmProvider.OPENAI), Map.of());
        TaskSnapshot task = store.pendingTasks(job.id(), 10).get(0);

        assertThat(store.claimTask(task.id())).isTrue();
        assertThat(store.claimTask(task.id())).isFalse();
        assertThat(store.pendingTasks(job.id(), 10)).isEmpty();

        assertThat(store.releaseTask(task.id())).isTrue();
        assertThat(store.pendingTasks(job.id(), 10)).hasSize(1);
    }

    @Test
    @DisplayName("a success is recorded once, with its response row and counter")
    void recordSuccessOnce() {
        JobSnapshot job = store.create(UUID.randomUUID(), tasks(1, LlmProvider.GEMINI), Map.of());
        TaskSnapshot task = store.pendingTasks(job.id(), 10).get(0);
        store.claimTask(task.id());
        ProviderAnswer answer = new ProviderAnswer("Acme leads.", "gemini-2.0-flash", 3, 4);
        VisibilityAnalysis analysis = new VisibilityAnalysis(9, true, 10, List.of("Acme"), List.of());

        assertThat(store.recordSuccess(task, answer, analysis)).isTrue();
        assertThat(store.recordSuccess(task, answer, analysis)).isFalse();
        assertThat(store.recordFailure(task, "late failure")).isFalse();

        JobSnapshot after = store.get(job.id()).orElseThrow();
        assertThat(after.completedTasks()).isEqualTo(1);
        assertThat(after.failedTasks()).isZero();
        assertThat(responseRepository.existsByBatchJobIdAndPromptIdAndProvider(
                job.id(), task.promptId(), LlmProvider.GEMINI)).isTrue();
        assertThat(store.finishedTasks(job.id())).extracting(TaskSnapshot::status)
                .containsExactly(TaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("counters never exceed the task total")
    void counterGuard() {
        JobSnapshot job = store.create(UUID.randomUUID(), tasks(2, LlmProvider.OPENAI), Map.of());

        assertThat(store.updateProgress(job.id(), 2, 0)).isTrue();
        assertThat(store.updateProgress(job.id(), 0, 1)).isFalse();

        JobSnapshot after = store.get(job.id()).orElseThrow();
        assertThat(after.completedTasks() + after.failedTasks()).isEqualTo(2);
    }

    @Test
    @DisplayName("finalizing re-syncs drifted counters so they match the task totals")
    void finalizeSyncsCounters() {
        JobSnapshot job = store.create(UUID.randomUUID(), tasks(3, LlmProvider.OPENAI), Map.of());
        List<TaskSnapshot> pending = store.pendingTasks(job.id(), 10);
        store.claimTask(pending.get(0).id());
        store.recordSuccess(pending.get(0), new ProviderAnswer("Acme", "gpt-4o-mini", 1, 1),
                new VisibilityAnalysis(1, false, null, List.of(), List.of()));
        store.updateProgress(job.id(), -1, 0);
        for (TaskSnapshot task : pending.subList(1, 3)) {
            store.claimTask(task.id());
            store.recordFailure(task, "HTTP 500");
        }

        assertThat(finalizer.finalizeJob(job.id())).isEqualTo(JobStatus.COMPLETED);

        JobSnapshot after = store.get(job.id()).orElseThrow();
        assertThat(after.completedTasks()).isEqualTo(1);
        assertThat(after.failedTasks()).isEqualTo(2);
        assertThat(after.completedTasks() + after.failedTasks()).isEqualTo(after.totalTasks());
    }

    @Test
    @DisplayName("only one reconciler wins a takeover")
    void takeoverIsCompareAndSet() {
        JobSnapshot job = store.create(UUID.randomUUID(), tasks(1, LlmProvider.OPENAI), Map.of());
        Instant observed = job.lastHeartbeat();

        boolean first = store.tryTakeOver(job.id(), observed, "reconciler-a");
        boolean second = store.tryTakeOver(job.id(), observed, "reconciler-b");

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(store.get(job.id()).orElseThrow().runnerId()).isEqualTo("reconciler-a");
    }

    @Test
    @DisplayName("status transitions follow the job lifecycle")
    void guardedTransitions() {
        JobSnapshot job = store.create(UUID.randomUUID(), tasks(1, LlmProvider.OPENAI), Map.of());

        assertThat(store.setStatus(job.id(), JobEvent.FINISH)).isFalse();
        assertThat(store.setStatus(job.id(), JobEvent.START)).isTrue();
        assertThat(store.setStatus(job.id(), JobEvent.FINISH)).isTrue();
        assertThat(store.setStatus(job.id(), JobEvent.CANCEL)).isFalse();

        JobSnapshot after = store.get(job.id()).orElseThrow();
        assertThat(after.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(after.startedAt()).isNotNull();
        assertThat(after.completedAt()).isNotNull();
    }
}
