package org.javai.provisioning.ops;

import org.javai.provisioning.Failure;
import org.javai.provisioning.topic.ProvisioningState;

import java.time.Duration;

/**
 * Reports provisioning events for observability.
 * Implementations might emit structured logs or metrics.
 */
public interface OpReporter {

    /**
     * Reports a classified failure at the boundary where it was observed.
     */
    void report(Failure failure);

    /**
     * Reports that a failed attempt will be retried.
     *
     * @param failure The failure that triggered the retry
     * @param attemptNumber The attempt that failed (1-based)
     * @param delay How long the retrier will wait before the next attempt
     * @param policyId The retry policy being applied
     */
    default void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
    }

    /**
     * Reports that a transient failure outlasted its retry policy.
     *
     * @param failure The final failure
     * @param totalAttempts The total number of attempts made
     * @param policyId The retry policy that was exhausted
     */
    default void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
    }

    /**
     * Reports that a retry loop was abandoned by cancellation, interruption or budget exhaustion.
     */
    default void reportCancelled(Failure failure, int totalAttempts, String policyId) {
    }

    /**
     * Reports a step of the provisioning state machine.
     */
    default void reportTransition(String topicName, ProvisioningState from, ProvisioningState to) {
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
