package dev.llumos.domain.lifecycle;

import dev.llumos.domain.enums.JobEvent;
import dev.llumos.domain.enums.JobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStateMachineTest {

    @Test
    @DisplayName("PENDING starts, fails or cancels but cannot finish")
    void pendingTransitions() {
        assertThat(JobStateMachine.next(JobStatus.PENDING, JobEvent.START)).contains(JobStatus.PROCESSING);
        assertThat(JobStateMachine.next(JobStatus.PENDING, JobEvent.CANCEL)).contains(JobStatus.CANCELLED);
        assertThat(JobStateMachine.next(JobStatus.PENDING, JobEvent.FAIL)).contains(JobStatus.FAILED);
        assertThat(JobStateMachine.next(JobStatus.PENDING, JobEvent.FINISH)).isEmpty();
    }

    @Test
    @DisplayName("PROCESSING accepts every event, START re-enters")
    void processingTransitions() {
        assertThat(JobStateMachine.next(JobStatus.PROCESSING, JobEvent.START)).contains(JobStatus.PROCESSING);
        assertThat(JobStateMachine.next(JobStatus.PROCESSING, JobEvent.FINISH)).contains(JobStatus.COMPLETED);
        assertThat(JobStateMachine.next(JobStatus.PROCESSING, JobEvent.FAIL)).contains(JobStatus.FAILED);
        assertThat(JobStateMachine.next(JobStatus.PROCESSING, JobEvent.CANCEL)).contains(JobStatus.CANCELLED);
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    @DisplayName("terminal states accept no event")
    void terminalStatesAreFinal(JobStatus terminal) {
        for (JobEvent event : JobEvent.values()) {
            assertThat(JobStateMachine.canApply(terminal, event)).isFalse();
        }
        assertThatThrownBy(() -> JobStateMachine.require(terminal, JobEvent.START))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(terminal.name());
    }

    @Test
    @DisplayName("sourcesFor drives the conditional update")
    void sourcesFor() {
        assertThat(JobStateMachine.sourcesFor(JobEvent.FINISH)).containsExactly(JobStatus.PROCESSING);
        assertThat(JobStateMachine.sourcesFor(JobEvent.CANCEL))
                .containsExactlyInAnyOrder(JobStatus.PENDING, JobStatus.PROCESSING);
        assertThat(JobStateMachine.targetOf(JobEvent.FAIL)).isEqualTo(JobStatus.FAILED);
    }
}
