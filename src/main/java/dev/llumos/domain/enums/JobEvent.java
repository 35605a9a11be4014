package dev.llumos.domain.enums;

/**
 * Inputs to {@link dev.llumos.domain.lifecycle.JobStateMachine}.
 */
public enum JobEvent {
    /** An executor picked the job up. */
    START,
    /** All tasks are terminal and at least one succeeded. */
    FINISH,
    /** All tasks are terminal and none succeeded, or the job cannot proceed. */
    FAIL,
    /** Cancellation was requested or the job was replaced. */
    CANCEL
}
