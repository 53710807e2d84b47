package org.javai.provisioning.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Where a {@link Retrier} loop stands when a {@link RetryPolicy} is asked about the latest failure.
 *
 * @param attemptNumber 1-based number of the attempt that just failed
 * @param startedAt     start of the first attempt
 * @param elapsed       wall time since {@code startedAt}, sampled when this context was built
 * @param budget        overall wall-time allowance for the loop, or null when the loop is unbounded
 */
public record RetryContext(
        int attemptNumber,
        Instant startedAt,
        Duration elapsed,
        Duration budget
) {
    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempts are numbered from 1, got " + attemptNumber);
        }
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(elapsed, "elapsed");
    }

    /** Context for the first attempt of an unbounded loop. */
    public static RetryContext first() {
        return first(null);
    }

    /** Context for the first attempt of a loop limited to {@code budget}, which may be null. */
    public static RetryContext first(Duration budget) {
        return new RetryContext(1, Instant.now(), Duration.ZERO, budget);
    }

    /** Context for the following attempt, with {@code elapsed} re-sampled. */
    public RetryContext next() {
        return new RetryContext(attemptNumber + 1, startedAt, Duration.between(startedAt, Instant.now()), budget);
    }

    /**
     * Time left in the budget, measured now; null if there is no budget.
     */
    public Duration remainingBudget() {
        if (budget == null) {
            return null;
        }
        Duration remaining = budget.minus(Duration.between(startedAt, Instant.now()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
