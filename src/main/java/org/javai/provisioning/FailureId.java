package org.javai.provisioning;

import java.util.Objects;

/**
 * Stable identifier of a failure kind, rendered as {@code namespace:name}.
 * Operators grep for these, so existing ids should not be renamed.
 *
 * @param namespace where the failure was detected, such as {@code backend} or {@code provisioning}
 * @param name      the failure within that area, such as {@code server_busy} or {@code topic_vanished}
 */
public record FailureId(String namespace, String name) {

    public FailureId {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
        if (namespace.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("FailureId parts must be non-blank: '" + namespace + "', '" + name + "'");
        }
    }

    public static FailureId of(String namespace, String name) {
        return new FailureId(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
