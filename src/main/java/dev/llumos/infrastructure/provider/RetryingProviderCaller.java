package dev.llumos.infrastructure.provider;

import dev.llumos.config.ProviderProperties;
import dev.llumos.domain.valueobject.ProviderAnswer;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Wraps a single provider call in a Resilience4j {@link Retry}: exponential backoff with jitter,
 * retrying only {@link ProviderCallException}s flagged retryable.
 *
 * <p>The timeout for each attempt is asked from {@code attemptTimeout} right before the attempt,
 * so later attempts shrink with the remaining invocation budget.
 */
@Component
public class RetryingProviderCaller {

    private static final Logger log = LoggerFactory.getLogger(RetryingProviderCaller.class);

    private final RetryRegistry retryRegistry;

    public RetryingProviderCaller(ProviderProperties properties) {
        ProviderProperties.Retry retry = properties.retry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retry.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        retry.initialInterval(), retry.multiplier(), retry.randomizationFactor()))
                .retryOnException(e -> e instanceof ProviderCallException p && p.isRetryable())
                .build();
        this.retryRegistry = RetryRegistry.of(config);
    }

    public ProviderAnswer call(LlmProviderClient client, String prompt, Supplier<Duration> attemptTimeout) {
        Retry retry = retryRegistry.retry(client.provider().wireName());
        try {
            return retry.executeSupplier(() -> {
                Duration timeout = attemptTimeout.get();
                if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                    throw new CallBudgetExhaustedException("No budget left to call " + client.provider().wireName());
                }
                return client.ask(prompt, timeout);
            });
        } catch (CallNotPermittedException e) {
            log.debug("Circuit open for {}", client.provider());
            throw ProviderCallException.circuitOpen(client.provider(), e);
        }
    }
}
