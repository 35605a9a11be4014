package dev.llumos.domain.enums;

import java.util.List;

/**
 * Subscription tiers ordered by price.
 *
 * FREE = 5 prompts, OpenAI only | STARTER = 25 prompts, OpenAI + Perplexity |
 * GROWTH = 100 prompts, all providers | PRO = 300 prompts, all providers
 */
public enum PlanTier {
    FREE(5, List.of(LlmProvider.OPENAI)),
    STARTER(25, List.of(LlmProvider.OPENAI, LlmProvider.PERPLEXITY)),
    GROWTH(100, List.of(LlmProvider.OPENAI, LlmProvider.PERPLEXITY,
            LlmProvider.GEMINI, LlmProvider.GOOGLE_AI_OVERVIEW)),
    PRO(300, List.of(LlmProvider.OPENAI, LlmProvider.PERPLEXITY,
            LlmProvider.GEMINI, LlmProvider.GOOGLE_AI_OVERVIEW));

    private final int promptsPerDay;
    private final List<LlmProvider> allowedProviders;

    PlanTier(int promptsPerDay, List<LlmProvider> allowedProviders) {
        this.promptsPerDay = promptsPerDay;
        this.allowedProviders = allowedProviders;
    }

    public int promptsPerDay() {
        return promptsPerDay;
    }

    public List<LlmProvider> allowedProviders() {
        return allowedProviders;
    }

    public boolean allows(LlmProvider provider) {
        return allowedProviders.contains(provider);
    }
}
