package dev.llumos.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Outbound provider settings. A provider is usable only when enabled and given an API key;
 * base URL and model fall back to each client's defaults.
 */
@ConfigurationProperties(prefix = "llumos.providers")
public record ProviderProperties(Endpoint openai,
                                 Endpoint perplexity,
                                 Endpoint gemini,
                                 Endpoint googleAiOverview,
                                 Duration callTimeout,
                                 Retry retry) {

    public ProviderProperties {
        if (openai == null) openai = Endpoint.disabled();
        if (perplexity == null) perplexity = Endpoint.disabled();
        if (gemini == null) gemini = Endpoint.disabled();
        if (googleAiOverview == null) googleAiOverview = Endpoint.disabled();
        if (callTimeout == null) callTimeout = Duration.ofSeconds(60);
        if (retry == null) retry = new Retry(0, null, null, null);
    }

    public record Endpoint(boolean enabled, String apiKey, String baseUrl, String model) {
        static Endpoint disabled() {
            return new Endpoint(false, null, null, null);
        }

        public boolean isConfigured() {
            return enabled && apiKey != null && !apiKey.isBlank();
        }

        public String baseUrlOr(String fallback) {
            return baseUrl == null || baseUrl.isBlank() ? fallback : baseUrl;
        }

        public String modelOr(String fallback) {
            return model == null || model.isBlank() ? fallback : model;
        }
    }

    /** Exponential backoff with jitter between attempts of one provider call. */
    public record Retry(int maxAttempts, Duration initialInterval, Double multiplier, Double randomizationFactor) {
        public Retry {
            if (maxAttempts <= 0) maxAttempts = 3;
            if (initialInterval == null) initialInterval = Duration.ofSeconds(1);
            if (multiplier == null || multiplier < 1.0) multiplier = 2.0;
            if (randomizationFactor == null || randomizationFactor < 0 || randomizationFactor >= 1) randomizationFactor = 0.5;
        }
    }
}
