package org.javai.provisioning.lifecycle;

import org.javai.provisioning.TopicDescriptor;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;

/**
 * Base class for senders and receivers.
 *
 * <p>Construction borrows the shared connection, provisions the configured topic and opens
 * the endpoint's own client, in that order. If any step fails, everything acquired so far
 * is released before the exception propagates, so a half-built endpoint never escapes.</p>
 *
 * <p>{@link #close()} releases the owned client first and the borrowed connection second,
 * exactly once, even when closing the client fails.</p>
 *
 * @param <C> the client type this endpoint owns
 */
public abstract class MessagingEndpoint<C extends MessagingClient> implements AutoCloseable {

    private final SharedConnection.Lease lease;
    private final TopicDescriptor topic;
    private final C client;
    private final AtomicBoolean closed = new AtomicBoolean();

    protected MessagingEndpoint(BusConfiguration configuration, BiFunction<MessagingFactory, TopicDescriptor, C> opener) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        Objects.requireNonNull(opener, "opener must not be null");

        SharedConnection.Lease borrowed = configuration.connection().lease();
        try {
            TopicDescriptor resolved = configuration.provisionTopic();
            C opened = Objects.requireNonNull(opener.apply(borrowed.factory(), resolved), "opener returned no client");
            this.topic = resolved;
            this.client = opened;
        } catch (RuntimeException e) {
            borrowed.close();
            throw e;
        }
        this.lease = borrowed;
    }

    /**
     * The topic as it exists on the backend.
     */
    public TopicDescriptor topic() {
        return topic;
    }

    public boolean isClosed() {
        return closed.get();
    }

    protected C client() {
        if (closed.get()) {
            throw new IllegalStateException(getClass().getSimpleName() + " for topic '" + topic.name() + "' is closed");
        }
        return client;
    }

    @Override
    public final void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            client.close();
        } finally {
            lease.close();
        }
    }
}
