package dev.llumos.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome label carried by every batch endpoint response.
 */
public enum JobAction {
    CREATED, EXISTING, IN_PROGRESS, COMPLETED, CANCELLED, RESUMED, FINALIZED, SKIPPED, ERROR;

    /** How a job is reported once read back: finished (including FAILED), cancelled or still running. */
    public static JobAction forStatus(JobStatus status) {
        return switch (status) {
            case CANCELLED -> CANCELLED;
            case COMPLETED, FAILED -> COMPLETED;
            case PENDING, PROCESSING -> IN_PROGRESS;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
