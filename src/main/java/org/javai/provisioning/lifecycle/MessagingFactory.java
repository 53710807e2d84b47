package org.javai.provisioning.lifecycle;

import org.javai.provisioning.TopicDescriptor;

/**
 * The connection-level resource that senders and receivers borrow to open their clients.
 *
 * <p>A factory is shared by every endpoint built from one {@link BusConfiguration} and is
 * closed only by its {@link SharedConnection}, never by an individual endpoint.</p>
 */
public interface MessagingFactory extends AutoCloseable {

    MessageSender createSender(TopicDescriptor topic);

    MessageReceiver createReceiver(TopicDescriptor topic, ReceiverOptions options);

    @Override
    void close();
}
