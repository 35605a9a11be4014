package dev.llumos.infrastructure.provider;

/**
 * Thrown before an attempt when the invocation has no time left for it. The task should be
 * released for a later invocation, not failed.
 */
public class CallBudgetExhaustedException extends RuntimeException {
    public CallBudgetExhaustedException(String message) {
        super(message);
    }
}
