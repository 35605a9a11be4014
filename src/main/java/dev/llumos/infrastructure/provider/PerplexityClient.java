package dev.llumos.infrastructure.provider;

import dev.llumos.config.ProviderProperties;
import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.valueobject.ProviderAnswer;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Component
public class PerplexityClient extends AbstractChatCompletionClient {

    static final String DEFAULT_BASE_URL = "https://api.perplexity.ai";
    static final String DEFAULT_MODEL = "sonar";

    public PerplexityClient(WebClient.Builder builder, ProviderProperties properties) {
        super(builder, properties.perplexity(), DEFAULT_BASE_URL, "/chat/completions", DEFAULT_MODEL);
    }

    @Override
    public LlmProvider provider() {
        return LlmProvider.PERPLEXITY;
    }

    @Override
    @CircuitBreaker(name = "perplexity")
    public ProviderAnswer ask(String prompt, Duration timeout) {
        return complete(prompt, timeout);
    }
}
