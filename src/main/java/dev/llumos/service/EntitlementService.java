package dev.llumos.service;

import dev.llumos.domain.entity.Organization;
import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.enums.PlanTier;
import dev.llumos.domain.valueobject.Entitlement;
import dev.llumos.infrastructure.provider.ProviderRegistry;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Derives what an organization may run: tier-allowed providers intersected with the providers
 * configured on this deployment, and the tier's prompt quota.
 */
@Service
public class EntitlementService {

    private final ProviderRegistry providerRegistry;

    public EntitlementService(ProviderRegistry providerRegistry) {
        this.providerRegistry = providerRegistry;
    }

    public Entitlement resolve(Organization org) {
        PlanTier tier = org.getPlanTier() == null ? PlanTier.FREE : org.getPlanTier();
        List<LlmProvider> configured = providerRegistry.configuredProviders();
        List<LlmProvider> providers = tier.allowedProviders().stream()
                .filter(configured::contains)
                .toList();
        return new Entitlement(tier, tier.promptsPerDay(), providers);
    }
}
