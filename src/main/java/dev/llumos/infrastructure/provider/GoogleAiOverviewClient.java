package dev.llumos.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import dev.llumos.config.ProviderProperties;
import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.valueobject.ProviderAnswer;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Internal service that fetches the Google AI Overview for a search query.
 * Authenticated with a bearer service key. A query without an overview yields an empty answer.
 */
@Component
public class GoogleAiOverviewClient extends AbstractProviderClient {

    static final String MODEL = "google-ai-overview";

    public GoogleAiOverviewClient(WebClient.Builder builder, ProviderProperties properties) {
        super(builder, properties.googleAiOverview(), "http://localhost:8089");
    }

    @Override
    public LlmProvider provider() {
        return LlmProvider.GOOGLE_AI_OVERVIEW;
    }

    @Override
    public boolean isConfigured() {
        return super.isConfigured() && endpoint.baseUrl() != null && !endpoint.baseUrl().isBlank();
    }

    @Override
    @CircuitBreaker(name = "google-ai-overview")
    public ProviderAnswer ask(String prompt, Duration timeout) {
        JsonNode response = postJson(client -> client.post().uri("/v1/ai-overview")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + endpoint.apiKey()),
                Map.of("query", prompt, "gl", "us", "hl", "en"), timeout);

        JsonNode overview = response.path("overview");
        String text = overview.isTextual() ? overview.asText() : "";
        return new ProviderAnswer(text, MODEL, 0, 0);
    }
}
