package org.javai.provisioning.boundary;

import org.javai.provisioning.FailureId;
import org.javai.provisioning.FailureType;

import java.time.Duration;
import java.util.Objects;

/**
 * Describes a failure without operational context.
 * This is what classifiers produce; the {@link Boundary} adds context to create a full Failure.
 *
 * @param id Namespaced failure identifier
 * @param message Human-readable description
 * @param type The category the failure falls into
 * @param retryAfter Backend-suggested delay before retrying (may be null)
 */
public record FailureKind(
        FailureId id,
        String message,
        FailureType type,
        Duration retryAfter
) {

    public FailureKind {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static FailureKind transientFailure(FailureId id, String message) {
        return new FailureKind(id, message, FailureType.TRANSIENT, null);
    }

    public static FailureKind permanentFailure(FailureId id, String message) {
        return new FailureKind(id, message, FailureType.PERMANENT, null);
    }

    public static FailureKind entityNotFound(FailureId id, String message) {
        return new FailureKind(id, message, FailureType.ENTITY_NOT_FOUND, null);
    }

    public static FailureKind entityAlreadyExists(FailureId id, String message) {
        return new FailureKind(id, message, FailureType.ENTITY_ALREADY_EXISTS, null);
    }

    public FailureKind withRetryAfter(Duration delay) {
        return new FailureKind(id, message, type, delay);
    }
}
