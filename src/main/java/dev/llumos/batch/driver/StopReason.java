package dev.llumos.batch.driver;

/** Why the driver loop stopped re-invoking the executor. */
public enum StopReason {
    COMPLETED,
    CANCELLED,
    /** Consecutive invocations without progress; left for the reconciler. */
    STALLED,
    MAX_ITERATIONS,
    MAX_DURATION,
    ERROR,
    /** Another driver in this process is already working the job. */
    ALREADY_RUNNING
}
