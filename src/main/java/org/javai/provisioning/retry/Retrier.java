package org.javai.provisioning.retry;

import org.javai.provisioning.CancellationToken;
import org.javai.provisioning.Failure;
import org.javai.provisioning.Outcome;
import org.javai.provisioning.boundary.Boundary;
import org.javai.provisioning.boundary.ThrowingSupplier;
import org.javai.provisioning.ops.OpReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Executes operations with retry logic based on a policy.
 * Operates entirely over Outcome values; no operational exception escapes.
 *
 * <p>Backoff waits block only the calling thread. A wait ends early, and the loop
 * stops with a {@code CANCELLED} failure, when the caller's {@link CancellationToken}
 * is cancelled, the thread is interrupted, or the optional time budget runs out.</p>
 *
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .policy(RetryPolicyConfig.creationDefaults().toPolicy("create-topic"))
 *     .reporter(reporter)
 *     .budget(Duration.ofMinutes(10))
 *     .build();
 *
 * Outcome<TopicDescriptor> created = retrier.execute(
 *     "TopicAdmin.createTopic",
 *     () -> boundary.call("TopicAdmin.createTopic", () -> admin.createTopic(desired)),
 *     token
 * );
 * }</pre>
 */
public final class Retrier {

    private final RetryPolicy policy;
    private final OpReporter reporter;
    private final Duration budget;
    private final Sleeper sleeper;

    private Retrier(RetryPolicy policy, OpReporter reporter, Duration budget, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.budget = budget;  // null means unlimited
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryPolicy policy;
        private OpReporter reporter = OpReporter.noOp();
        private Duration budget;
        private Sleeper sleeper = Sleeper.onToken();

        private Builder() {}

        /**
         * Sets the retry policy (required).
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets a time budget for the whole retry loop (optional, defaults to unlimited).
         */
        public Builder budget(Duration budget) {
            Objects.requireNonNull(budget, "budget must not be null");
            if (budget.isNegative() || budget.isZero()) {
                throw new IllegalArgumentException("budget must be positive");
            }
            this.budget = budget;
            return this;
        }

        /**
         * Replaces the backoff wait, e.g. with one that records delays instead of sleeping.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * @throws NullPointerException if policy has not been set
         */
        public Retrier build() {
            Objects.requireNonNull(policy, "policy must be set");
            return new Retrier(policy, reporter, budget, sleeper);
        }
    }

    public RetryPolicy policy() {
        return policy;
    }

    public <T> Outcome<T> execute(String operation, Supplier<Outcome<T>> attempt) {
        return execute(operation, attempt, CancellationToken.none());
    }

    /**
     * Executes an operation with retry according to the configured policy.
     *
     * @param operation The operation name for reporting
     * @param attempt A supplier that returns an Outcome
     * @param token Cancels the loop between attempts or during a backoff wait
     * @return The first success, the first failure the policy will not retry,
     *         or a {@code CANCELLED} failure wrapping the last failure
     */
    public <T> Outcome<T> execute(String operation, Supplier<Outcome<T>> attempt, CancellationToken token) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");
        Objects.requireNonNull(token, "token must not be null");

        if (token.isCancelled()) {
            return cancelled(operation, "cancelled before first attempt: " + token.reason(), null, 0);
        }

        RetryContext context = RetryContext.first(budget);
        Outcome<T> result = attempt.get();

        while (result instanceof Outcome.Fail<T> fail) {
            Failure failure = fail.failure();
            RetryDecision decision = policy.decide(context, failure);

            if (decision instanceof RetryDecision.GiveUp) {
                if (failure.isRetryable()) {
                    reporter.reportRetryExhausted(failure, context.attemptNumber(), policy.id());
                }
                return result;
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            Duration remaining = context.remainingBudget();
            if (remaining != null && remaining.compareTo(delay) <= 0) {
                return cancelled(operation, "retry budget of " + budget.toMillis() + " ms exhausted", failure, context.attemptNumber());
            }

            reporter.reportRetryAttempt(failure, context.attemptNumber(), delay, policy.id());
            String stopReason = pause(delay, token);
            if (stopReason != null) {
                return cancelled(operation, stopReason, failure, context.attemptNumber());
            }

            context = context.next();
            result = attempt.get();
        }

        return result;
    }

    /**
     * Convenience method that wraps a throwing supplier with a Boundary before retrying.
     */
    public <T> Outcome<T> execute(
            String operation,
            Boundary boundary,
            ThrowingSupplier<T, ? extends Exception> work,
            CancellationToken token
    ) {
        return execute(operation, () -> boundary.call(operation, work), token);
    }

    /**
     * Waits out a backoff delay.
     *
     * @return null if the next attempt may go ahead, otherwise why the loop must stop
     */
    private String pause(Duration delay, CancellationToken token) {
        if (token.isCancelled()) {
            return token.reason();
        }
        if (delay.isZero()) {
            return null;
        }
        try {
            if (sleeper.sleep(delay, token)) {
                return token.reason();
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "interrupted while waiting to retry";
        }
    }

    private <T> Outcome<T> cancelled(String operation, String reason, Failure last, int attempts) {
        Failure failure = Failure.cancelled(reason, operation, last);
        reporter.reportCancelled(failure, attempts, policy.id());
        return Outcome.fail(failure);
    }

    /**
     * Performs the backoff wait between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {

        /**
         * Waits for {@code delay} unless {@code token} is cancelled first.
         *
         * @return true if the wait ended because the token was cancelled
         */
        boolean sleep(Duration delay, CancellationToken token) throws InterruptedException;

        static Sleeper onToken() {
            return (delay, token) -> token.await(delay);
        }
    }
}
