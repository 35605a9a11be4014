package dev.llumos.domain.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a new batch job and its tasks have been persisted.
 * Consumed after commit by the dispatcher that starts the server-side driver loop.
 */
public record BatchJobCreatedEvent(
        UUID jobId,
        UUID orgId,
        int totalTasks,
        String triggerSource,
        Instant occurredAt
) {
    public BatchJobCreatedEvent {
        if (jobId == null) throw new IllegalArgumentException("jobId required");
        if (occurredAt == null) occurredAt = Instant.now();
    }
}
