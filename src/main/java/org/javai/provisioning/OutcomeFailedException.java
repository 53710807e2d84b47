package org.javai.provisioning;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 *
 * <p>This is how {@code ensureTopic} and the sender/receiver constructors surface
 * provisioning failures; the {@link Failure} carries the {@link FailureType} that
 * tells callers whether the failure was permanent, an invariant violation,
 * an exhausted transient failure, or a cancellation.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;

    public OutcomeFailedException(Failure failure) {
        super("Outcome failed [" + failure.id() + "]: " + failure.message(), failure.exception());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }

    public FailureType type() {
        return failure.type();
    }
}
