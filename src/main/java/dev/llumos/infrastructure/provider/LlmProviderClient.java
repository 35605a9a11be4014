package dev.llumos.infrastructure.provider;

import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.valueobject.ProviderAnswer;

import java.time.Duration;

/**
 * One AI assistant. Implementations are stateless and safe to call from several threads.
 */
public interface LlmProviderClient {

    LlmProvider provider();

    /** Enabled and holding credentials. Unconfigured providers are never fanned out. */
    boolean isConfigured();

    /**
     * Asks the prompt once, without retries.
     *
     * @throws ProviderCallException when no usable answer came back within {@code timeout}
     */
    ProviderAnswer ask(String prompt, Duration timeout);
}
