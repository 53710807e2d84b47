package org.javai.provisioning.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry settings injected into a {@link Retrier}.
 *
 * @param maxAttempts Attempt ceiling including the first attempt, or {@link #UNBOUNDED}
 * @param minBackoff Delay before the first retry; later delays double from here
 * @param maxBackoff Upper bound on any single delay
 */
public record RetryPolicyConfig(int maxAttempts, Duration minBackoff, Duration maxBackoff) {

    /**
     * Sentinel for "no attempt ceiling". A retrier using it must be bounded by a
     * budget or a {@link org.javai.provisioning.CancellationToken} instead.
     */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public RetryPolicyConfig {
        Objects.requireNonNull(minBackoff, "minBackoff must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (minBackoff.isNegative()) {
            throw new IllegalArgumentException("minBackoff must not be negative");
        }
        if (maxBackoff.compareTo(minBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= minBackoff");
        }
    }

    /**
     * Short-lived existence probes: few attempts, short waits.
     */
    public static RetryPolicyConfig existenceCheckDefaults() {
        return new RetryPolicyConfig(5, Duration.ofMillis(100), Duration.ofSeconds(2));
    }

    /**
     * Creation is expected to succeed once transient conditions clear, so it gets a
     * large but finite ceiling.
     */
    public static RetryPolicyConfig creationDefaults() {
        return new RetryPolicyConfig(1_000, Duration.ofMillis(100), Duration.ofSeconds(5));
    }

    public boolean isUnbounded() {
        return maxAttempts == UNBOUNDED;
    }

    public RetryPolicyConfig withMaxAttempts(int maxAttempts) {
        return new RetryPolicyConfig(maxAttempts, minBackoff, maxBackoff);
    }

    /**
     * Builds the exponential-backoff policy these settings describe.
     */
    public RetryPolicy toPolicy(String id) {
        return RetryPolicy.exponentialBackoff(id, this);
    }
}
