package org.javai.provisioning;

import java.util.Objects;

/**
 * The durable identity of a topic together with its one immutable structural property.
 *
 * @param name The topic name, never blank
 * @param partitioningEnabled Whether the topic is partitioned; cannot change once the topic exists
 */
public record TopicDescriptor(String name, boolean partitioningEnabled) {

    public TopicDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static TopicDescriptor of(String name, boolean partitioningEnabled) {
        return new TopicDescriptor(name, partitioningEnabled);
    }

    /**
     * Whether this existing topic can serve a request for the given partitioning.
     * Partitioning may be required of an existing topic but never added to it; an
     * already-partitioned topic serves both kinds of request.
     */
    public boolean satisfies(boolean partitioningRequested) {
        return partitioningEnabled || !partitioningRequested;
    }
}
