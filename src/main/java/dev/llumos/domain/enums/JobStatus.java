package dev.llumos.domain.enums;

/**
 * Lifecycle: PENDING → PROCESSING → COMPLETED | FAILED | CANCELLED.
 * PENDING may also go straight to CANCELLED or FAILED. Terminal states are final.
 */
public enum JobStatus {
    PENDING, PROCESSING, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return !isTerminal();
    }
}
