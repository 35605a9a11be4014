package dev.llumos.domain.lifecycle;

import dev.llumos.domain.enums.JobEvent;
import dev.llumos.domain.enums.JobStatus;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Single source of truth for batch job status transitions.
 *
 * <pre>
 *   PENDING    --START-->  PROCESSING
 *   PENDING    --CANCEL--> CANCELLED
 *   PENDING    --FAIL-->   FAILED
 *   PROCESSING --START-->  PROCESSING   (resume / re-entry)
 *   PROCESSING --FINISH--> COMPLETED
 *   PROCESSING --FAIL-->   FAILED
 *   PROCESSING --CANCEL--> CANCELLED
 * </pre>
 *
 * <p>Terminal states accept no event. The creator, executor, reconciler and cancel handler all
 * go through {@link #next}; the store uses {@link #sourcesFor} to build its conditional update,
 * so a transition only lands if the row is still in an allowed source state.
 */
public final class JobStateMachine {

    private JobStateMachine() {}

    public static Optional<JobStatus> next(JobStatus current, JobEvent event) {
        if (current == null || event == null || current.isTerminal()) return Optional.empty();
        return switch (event) {
            case START -> Optional.of(JobStatus.PROCESSING);
            case FINISH -> current == JobStatus.PROCESSING
                    ? Optional.of(JobStatus.COMPLETED)
                    : Optional.empty();
            case FAIL -> Optional.of(JobStatus.FAILED);
            case CANCEL -> Optional.of(JobStatus.CANCELLED);
        };
    }

    /**
     * Like {@link #next} but throws when the transition is not allowed.
     */
    public static JobStatus require(JobStatus current, JobEvent event) {
        return next(current, event).orElseThrow(() -> new IllegalStateException(
                "Transition %s is not allowed from %s".formatted(event, current)));
    }

    public static boolean canApply(JobStatus current, JobEvent event) {
        return next(current, event).isPresent();
    }

    /**
     * Every event is accepted from PROCESSING and has exactly one target.
     */
    public static JobStatus targetOf(JobEvent event) {
        return require(JobStatus.PROCESSING, event);
    }

    /**
     * States from which {@code event} is accepted.
     */
    public static Set<JobStatus> sourcesFor(JobEvent event) {
        Set<JobStatus> sources = EnumSet.noneOf(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            if (canApply(status, event)) sources.add(status);
        }
        return sources;
    }
}
