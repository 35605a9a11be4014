package dev.llumos.infrastructure.provider;

import dev.llumos.config.ProviderProperties;
import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.valueobject.ProviderAnswer;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Component
public class OpenAiClient extends AbstractChatCompletionClient {

    static final String DEFAULT_BASE_URL = "https://api.openai.com";
    static final String DEFAULT_MODEL = "gpt-4o-mini";

    public OpenAiClient(WebClient.Builder builder, ProviderProperties properties) {
        super(builder, properties.openai(), DEFAULT_BASE_URL, "/v1/chat/completions", DEFAULT_MODEL);
    }

    @Override
    public LlmProvider provider() {
        return LlmProvider.OPENAI;
    }

    @Override
    @CircuitBreaker(name = "openai")
    public ProviderAnswer ask(String prompt, Duration timeout) {
        return complete(prompt, timeout);
    }
}
