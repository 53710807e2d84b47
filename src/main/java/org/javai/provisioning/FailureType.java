package org.javai.provisioning;

/**
 * Classifies failures by how the provisioning flow must react to them.
 *
 * <p>The first four values are the categories a
 * {@link org.javai.provisioning.boundary.FailureClassifier} may produce.
 * The remaining values are raised by the provisioning machinery itself.
 */
public enum FailureType {
    /**
     * Temporary failure that may resolve on retry.
     * Examples: network timeout, throttling, service temporarily unavailable.
     */
    TRANSIENT,

    /**
     * Failure that retrying cannot fix.
     * Examples: authorization failure, malformed entity name, quota exceeded.
     */
    PERMANENT,

    /**
     * The named entity does not exist. An expected branch of provisioning, not an error.
     */
    ENTITY_NOT_FOUND,

    /**
     * A create lost a race against a concurrent creator. Resolved by re-fetching.
     */
    ENTITY_ALREADY_EXISTS,

    /**
     * The request conflicts with an immutable property of an existing entity.
     */
    INVARIANT_VIOLATION,

    /**
     * The operation was abandoned because the caller cancelled it or its time budget ran out.
     */
    CANCELLED;

    /**
     * Whether a retry policy may retry a failure of this type.
     */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }

    /**
     * Whether this type is a structural signal consumed by the provisioning state machine
     * rather than an error.
     */
    public boolean isStructural() {
        return this == ENTITY_NOT_FOUND || this == ENTITY_ALREADY_EXISTS;
    }
}
