package dev.llumos.batch.executor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock allowance for one executor invocation.
 *
 * <p>New work starts only while more than the safety margin remains; an in-flight call may use
 * the margin, since its timeout is clamped to {@link #remaining()}.
 */
public final class InvocationBudget {

    private final Clock clock;
    private final Instant startedAt;
    private final Instant deadline;
    private final Duration safetyMargin;

    private InvocationBudget(Clock clock, Duration budget, Duration safetyMargin) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.deadline = startedAt.plus(budget);
        this.safetyMargin = safetyMargin;
    }

    public static InvocationBudget start(Clock clock, Duration budget, Duration safetyMargin) {
        if (budget == null || budget.isNegative()) throw new IllegalArgumentException("budget must be >= 0");
        return new InvocationBudget(clock, budget, safetyMargin == null ? Duration.ZERO : safetyMargin);
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public Duration total() {
        return Duration.between(startedAt, deadline);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    /** True once no new task should be started. */
    public boolean isExhausted() {
        return remaining().compareTo(safetyMargin) <= 0;
    }

    /** The call timeout, cut down to what is left of the budget. */
    public Duration clamp(Duration callTimeout) {
        Duration left = remaining();
        return callTimeout.compareTo(left) < 0 ? callTimeout : left;
    }
}
