package dev.llumos.batch.fanout;

import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.enums.PlanTier;
import dev.llumos.domain.valueobject.TaskKey;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** The task set for one job: every selected prompt asked of every entitled provider. */
public record FanoutPlan(UUID orgId, PlanTier tier, List<UUID> promptIds, List<LlmProvider> providers,
                         List<TaskKey> tasks, long activePrompts) {

    public FanoutPlan {
        promptIds = List.copyOf(promptIds);
        providers = List.copyOf(providers);
        tasks = List.copyOf(tasks);
    }

    public int totalTasks() {
        return tasks.size();
    }

    /** True when the tier quota dropped some active prompts. */
    public boolean isCapped() {
        return activePrompts > promptIds.size();
    }

    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tier", tier.name());
        metadata.put("providers", providers.stream().map(LlmProvider::wireName).toList());
        metadata.put("promptCount", promptIds.size());
        metadata.put("providerCount", providers.size());
        metadata.put("activePrompts", activePrompts);
        return metadata;
    }
}
