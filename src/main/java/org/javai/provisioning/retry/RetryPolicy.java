package org.javai.provisioning.retry;

import org.javai.provisioning.Failure;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether and when to retry after a failure.
 *
 * <p>The policies built here retry {@code TRANSIENT} failures only. Structural
 * signals ({@code ENTITY_NOT_FOUND}, {@code ENTITY_ALREADY_EXISTS}) and permanent
 * failures are given up on at once, so the caller sees them unchanged.</p>
 */
public interface RetryPolicy {

    /**
     * A unique identifier for this policy, used in reporting.
     */
    String id();

    /**
     * Evaluates a failure and decides whether to retry.
     *
     * @param context The current retry context
     * @param failure The failure that occurred
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(RetryContext context, Failure failure);

    static RetryPolicy noRetry() {
        return new RetryPolicy() {
            @Override
            public String id() {
                return "no-retry";
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                return RetryDecision.GiveUp.because("no-retry policy");
            }
        };
    }

    /**
     * Creates a policy with fixed delay and max attempts.
     */
    static RetryPolicy fixed(String id, int maxAttempts, Duration delay) {
        return exponentialBackoff(id, new RetryPolicyConfig(maxAttempts, delay, delay));
    }

    /**
     * Creates a policy with exponential backoff.
     */
    static RetryPolicy exponentialBackoff(String id, int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return exponentialBackoff(id, new RetryPolicyConfig(maxAttempts, initialDelay, maxDelay));
    }

    /**
     * Creates a policy whose n-th delay is {@code min(minBackoff * 2^(n-1), maxBackoff)}.
     * A retry-after hint on the failure may lengthen a delay, never beyond {@code maxBackoff}.
     */
    static RetryPolicy exponentialBackoff(String id, RetryPolicyConfig config) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(config, "config must not be null");

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                if (!failure.isRetryable()) {
                    return RetryDecision.GiveUp.because("failure is not retryable");
                }
                if (!config.isUnbounded() && context.attemptNumber() >= config.maxAttempts()) {
                    return RetryDecision.GiveUp.because("max attempts reached");
                }

                Duration delay = backoff(context.attemptNumber(), config.minBackoff(), config.maxBackoff());

                Duration hint = failure.retryAfter();
                if (hint != null && hint.compareTo(delay) > 0) {
                    delay = hint.compareTo(config.maxBackoff()) > 0 ? config.maxBackoff() : hint;
                }

                return RetryDecision.Retry.after(delay);
            }
        };
    }

    private static Duration backoff(int attemptNumber, Duration minBackoff, Duration maxBackoff) {
        // exponent is capped so the multiplication cannot overflow for very long loops
        int exponent = Math.min(attemptNumber - 1, 30);
        Duration delay = minBackoff.multipliedBy(1L << exponent);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }
}
