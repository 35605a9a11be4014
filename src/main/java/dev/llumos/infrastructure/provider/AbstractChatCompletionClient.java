package dev.llumos.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import dev.llumos.config.ProviderProperties;
import dev.llumos.domain.valueobject.ProviderAnswer;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions: bearer key, single user message,
 * answer in {@code choices[0].message.content}.
 */
abstract class AbstractChatCompletionClient extends AbstractProviderClient {

    private static final double TEMPERATURE = 0.3;
    private static final int MAX_TOKENS = 4000;

    private final String model;
    private final String path;

    protected AbstractChatCompletionClient(WebClient.Builder builder, ProviderProperties.Endpoint endpoint,
                                           String defaultBaseUrl, String path, String defaultModel) {
        super(builder, endpoint, defaultBaseUrl);
        this.model = endpoint.modelOr(defaultModel);
        this.path = path;
    }

    protected ProviderAnswer complete(String prompt, Duration timeout) {
        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(Map.of("role", "user", "content", prompt)),
                "temperature", TEMPERATURE,
                "max_tokens", MAX_TOKENS);

        JsonNode response = postJson(client -> client.post().uri(path)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + endpoint.apiKey()), body, timeout);

        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw ProviderCallException.malformed(provider(), "no choices[0].message.content");
        }
        JsonNode usage = response.path("usage");
        return new ProviderAnswer(content.asText(), response.path("model").asText(model),
                intOrZero(usage.path("prompt_tokens")), intOrZero(usage.path("completion_tokens")));
    }
}
