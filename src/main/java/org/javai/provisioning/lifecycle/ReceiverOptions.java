package org.javai.provisioning.lifecycle;

import java.util.Objects;

/**
 * @param subscription Subscription on the provisioned topic to receive from
 * @param mode Settlement mode
 * @param prefetchCount Messages the client may buffer ahead of {@code receive} calls
 * @param sessionAware Whether to receive from the next available message session
 */
public record ReceiverOptions(String subscription, ReceiveMode mode, int prefetchCount, boolean sessionAware) {

    public ReceiverOptions {
        Objects.requireNonNull(subscription, "subscription must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (subscription.isBlank()) {
            throw new IllegalArgumentException("subscription must not be blank");
        }
        if (prefetchCount < 0) {
            throw new IllegalArgumentException("prefetchCount must not be negative");
        }
    }

    /**
     * Sessionless receive-and-delete options with no prefetch.
     */
    public static ReceiverOptions of(String subscription) {
        return new ReceiverOptions(subscription, ReceiveMode.RECEIVE_AND_DELETE, 0, false);
    }

    /**
     * The same options, receiving from the next available message session.
     */
    public ReceiverOptions asSessionAware() {
        return new ReceiverOptions(subscription, mode, prefetchCount, true);
    }

    public ReceiverOptions withMode(ReceiveMode mode) {
        return new ReceiverOptions(subscription, mode, prefetchCount, sessionAware);
    }

    public ReceiverOptions withPrefetchCount(int prefetchCount) {
        return new ReceiverOptions(subscription, mode, prefetchCount, sessionAware);
    }
}
