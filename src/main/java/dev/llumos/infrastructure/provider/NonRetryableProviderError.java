package dev.llumos.infrastructure.provider;

import java.util.function.Predicate;

/**
 * Keeps request-level rejections (bad key, unknown model, malformed request) out of the provider
 * circuit breakers. Only failures that say something about the provider's health should open them.
 * Referenced by class name from {@code resilience4j.circuitbreaker.configs.default}.
 */
public class NonRetryableProviderError implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable error) {
        return error instanceof ProviderCallException p && !p.isRetryable();
    }
}
