package org.javai.provisioning.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What {@link RetryPolicy#decide} concluded about one failed attempt: wait and go again, or stop.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Another attempt is warranted once {@code delay} has elapsed. A zero delay retries at once.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("Retry delay cannot be negative: " + delay);
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * No further attempts. {@code reason} ends up in the log line for the final failure.
     */
    record GiveUp(String reason) implements RetryDecision {
        public static GiveUp because(String reason) {
            return new GiveUp(reason);
        }
    }
}
