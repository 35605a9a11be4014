package dev.llumos.infrastructure.provider;

import dev.llumos.domain.enums.LlmProvider;

import java.util.Locale;
import java.util.Set;

/**
 * A provider call that did not produce an answer. {@code retryable} decides whether the
 * retry policy tries again; client errors and invalid-model responses fail fast.
 */
public class ProviderCallException extends RuntimeException {

    private static final Set<Integer> NON_RETRYABLE_STATUS = Set.of(400, 401, 403, 404, 422);
    private static final int MAX_BODY_IN_MESSAGE = 300;

    private final LlmProvider provider;
    private final int statusCode;
    private final boolean retryable;

    public ProviderCallException(LlmProvider provider, String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public static ProviderCallException fromStatus(LlmProvider provider, int status, String body) {
        boolean invalidModel = isInvalidModel(body);
        boolean retryable = !invalidModel && !NON_RETRYABLE_STATUS.contains(status)
                && (status == 408 || status == 429 || status >= 500);
        String message = "%s returned HTTP %d%s: %s".formatted(provider.wireName(), status,
                invalidModel ? " (invalid model)" : "", abbreviate(body));
        return new ProviderCallException(provider, message, status, retryable, null);
    }

    public static ProviderCallException transport(LlmProvider provider, Throwable cause) {
        return new ProviderCallException(provider,
                "%s request failed: %s".formatted(provider.wireName(), cause.getMessage()), 0, true, cause);
    }

    public static ProviderCallException timeout(LlmProvider provider, Throwable cause) {
        return new ProviderCallException(provider, provider.wireName() + " request timed out", 0, true, cause);
    }

    public static ProviderCallException malformed(LlmProvider provider, String detail) {
        return new ProviderCallException(provider,
                "%s returned an unreadable response: %s".formatted(provider.wireName(), detail), 0, true, null);
    }

    public static ProviderCallException circuitOpen(LlmProvider provider, Throwable cause) {
        return new ProviderCallException(provider,
                provider.wireName() + " circuit breaker is open", 0, false, cause);
    }

    static boolean isInvalidModel(String body) {
        if (body == null) return false;
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("model_not_found") || lower.contains("invalid model")
                || lower.contains("invalid_model") || lower.contains("model does not exist");
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) return "<empty body>";
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }

    public LlmProvider getProvider() {
        return provider;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
