package dev.llumos.domain.enums;

/**
 * Lifecycle: RUNNING → COMPLETED | SKIPPED | FAILED
 */
public enum SchedulerRunStatus {
    RUNNING, COMPLETED, SKIPPED, FAILED
}
