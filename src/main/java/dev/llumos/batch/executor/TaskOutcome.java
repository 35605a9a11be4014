package dev.llumos.batch.executor;

/** What happened to one task during an invocation. */
public enum TaskOutcome {
    COMPLETED,
    FAILED,
    /** Failed without a call because the prompt's circuit was open. */
    SKIPPED,
    /** Another invocation claimed it first, or it was cancelled or reset before its result was written. */
    NOT_CLAIMED,
    /** Left (or put back) as PENDING because the budget ran out. */
    DEFERRED
}
