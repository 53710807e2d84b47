package org.javai.provisioning;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fully-contextualized failure ready for reporting and policy evaluation.
 *
 * @param id The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param type How provisioning must react to the failure
 * @param exception The underlying exception (may be null)
 * @param retryAfter Backend-suggested delay before retry (may be null)
 * @param operation The operation that failed (e.g., "TopicAdmin.getTopic")
 * @param occurredAt When the failure happened
 * @param tags Additional key-value metadata for observability
 * @param cause The failure that led to this one, e.g. the last attempt before cancellation (may be null)
 */
public record Failure(
        FailureId id,
        String message,
        FailureType type,
        Throwable exception,
        Duration retryAfter,
        String operation,
        Instant occurredAt,
        Map<String, String> tags,
        Failure cause
) {

    public Failure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static Failure transientFailure(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.TRANSIENT, exception, null,
                operation, Instant.now(), null, null);
    }

    public static Failure permanentFailure(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.PERMANENT, exception, null,
                operation, Instant.now(), null, null);
    }

    /**
     * Creates a failure for a request that contradicts an immutable property of an existing resource.
     */
    public static Failure invariantViolation(FailureId id, String message, String operation) {
        return new Failure(id, message, FailureType.INVARIANT_VIOLATION, null, null,
                operation, Instant.now(), null, null);
    }

    /**
     * Creates a cancellation failure that keeps the last observed failure as its cause.
     */
    public static Failure cancelled(String reason, String operation, Failure last) {
        return new Failure(FailureId.of("retry", "cancelled"), reason, FailureType.CANCELLED,
                last == null ? null : last.exception(), null,
                operation, Instant.now(), last == null ? null : last.tags(), last);
    }

    /**
     * Returns a copy of this failure with the given tags merged over the existing ones.
     */
    public Failure withTags(Map<String, String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new HashMap<>(tags);
        merged.putAll(extra);
        return new Failure(id, message, type, exception, retryAfter, operation, occurredAt, merged, cause);
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }
}
