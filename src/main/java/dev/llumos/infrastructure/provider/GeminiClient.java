package dev.llumos.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import dev.llumos.config.ProviderProperties;
import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.valueobject.ProviderAnswer;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini {@code generateContent}. The API key travels as the {@code key} query parameter.
 */
@Component
public class GeminiClient extends AbstractProviderClient {

    static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com";
    static final String DEFAULT_MODEL = "gemini-2.0-flash";

    private final String model;

    public GeminiClient(WebClient.Builder builder, ProviderProperties properties) {
        super(builder, properties.gemini(), DEFAULT_BASE_URL);
        this.model = properties.gemini().modelOr(DEFAULT_MODEL);
    }

    @Override
    public LlmProvider provider() {
        return LlmProvider.GEMINI;
    }

    @Override
    @CircuitBreaker(name = "gemini")
    public ProviderAnswer ask(String prompt, Duration timeout) {
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of("temperature", 0.3, "maxOutputTokens", 4000));

        JsonNode response = postJson(client -> client.post()
                .uri(uri -> uri.path("/v1beta/models/{model}:generateContent")
                        .queryParam("key", endpoint.apiKey())
                        .build(model)), body, timeout);

        JsonNode parts = response.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            throw ProviderCallException.malformed(provider(), "no candidates[0].content.parts");
        }
        StringBuilder text = new StringBuilder();
        parts.forEach(part -> text.append(part.path("text").asText("")));

        JsonNode usage = response.path("usageMetadata");
        return new ProviderAnswer(text.toString(), model,
                intOrZero(usage.path("promptTokenCount")), intOrZero(usage.path("candidatesTokenCount")));
    }
}
