package org.javai.provisioning.boundary;

/**
 * Maps an exception raised by a backend call to exactly one failure category.
 * Implementations must be deterministic and side-effect free.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies an exception into a FailureKind.
     *
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return A classified FailureKind
     */
    FailureKind classify(String operation, Throwable throwable);
}
