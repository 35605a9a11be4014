package dev.llumos.domain.valueobject;

import dev.llumos.domain.enums.LlmProvider;

import java.util.UUID;

/** Identity of a task within a job: one prompt asked of one provider. */
public record TaskKey(UUID promptId, LlmProvider provider) {
    public TaskKey {
        if (promptId == null) throw new IllegalArgumentException("promptId required");
        if (provider == null) throw new IllegalArgumentException("provider required");
    }
}
