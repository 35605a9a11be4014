package dev.llumos.domain.valueobject;

import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.enums.PlanTier;

import java.util.List;

/**
 * What an organization may run right now: its tier's prompt quota and the providers that are
 * both allowed by the tier and configured on this deployment.
 */
public record Entitlement(PlanTier tier, int promptLimit, List<LlmProvider> providers) {
    public Entitlement {
        if (tier == null) throw new IllegalArgumentException("tier required");
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public boolean hasProviders() {
        return !providers.isEmpty();
    }
}
