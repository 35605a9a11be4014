package dev.llumos.domain.enums;

/**
 * AI assistants whose answers are scanned for brand mentions.
 * The wire name is what API clients and stored metadata use.
 */
public enum LlmProvider {
    OPENAI("openai"),
    PERPLEXITY("perplexity"),
    GEMINI("gemini"),
    GOOGLE_AI_OVERVIEW("google_ai_overview");

    private final String wireName;

    LlmProvider(String wireName) { this.wireName = wireName; }

    public String wireName() {
        return wireName;
    }
}
