package org.javai.provisioning.lifecycle;

/**
 * Publishes messages to one topic.
 */
public interface MessageSender extends MessagingClient {

    void send(OutboundMessage message);
}
