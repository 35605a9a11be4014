package dev.llumos.service;

import dev.llumos.domain.entity.Organization;
import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.enums.PlanTier;
import dev.llumos.domain.valueobject.Entitlement;
import dev.llumos.infrastructure.provider.ProviderRegistry;
import dev.llumos.support.StubProviderClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EntitlementServiceTest {

    private final EntitlementService service = new EntitlementService(new ProviderRegistry(List.of(
            new StubProviderClient(LlmProvider.OPENAI),
            new StubProviderClient(LlmProvider.PERPLEXITY),
            new StubProviderClient(LlmProvider.GEMINI),
            new StubProviderClient(LlmProvider.GOOGLE_AI_OVERVIEW, false))));

    @Test
    @DisplayName("FREE gets OpenAI and five prompts")
    void freeTier() {
        Entitlement e = service.resolve(Organization.create("Acme", "acme.io", PlanTier.FREE));

        assertThat(e.providers()).containsExactly(LlmProvider.OPENAI);
        assertThat(e.promptLimit()).isEqualTo(5);
    }

    @Test
    @DisplayName("STARTER gets OpenAI and Perplexity")
    void starterTier() {
        Entitlement e = service.resolve(Organization.create("Acme", "acme.io", PlanTier.STARTER));

        assertThat(e.providers()).containsExactly(LlmProvider.OPENAI, LlmProvider.PERPLEXITY);
        assertThat(e.promptLimit()).isEqualTo(25);
    }

    @Test
    @DisplayName("providers the tier allows but this deployment lacks are dropped")
    void growthTierWithoutAiOverview() {
        Entitlement e = service.resolve(Organization.create("Acme", "acme.io", PlanTier.GROWTH));

        assertThat(e.providers()).containsExactly(LlmProvider.OPENAI, LlmProvider.PERPLEXITY, LlmProvider.GEMINI);
        assertThat(e.promptLimit()).isEqualTo(100);
    }

    @Test
    @DisplayName("nothing configured means no providers")
    void nothingConfigured() {
        EntitlementService bare = new EntitlementService(new ProviderRegistry(List.of()));

        assertThat(bare.resolve(Organization.create("Acme", null, PlanTier.PRO)).hasProviders()).isFalse();
    }
}
