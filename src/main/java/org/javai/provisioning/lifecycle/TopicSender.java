package org.javai.provisioning.lifecycle;

/**
 * Publishes to the configured topic, provisioning it on construction.
 */
public class TopicSender extends MessagingEndpoint<MessageSender> {

    public TopicSender(BusConfiguration configuration) {
        super(configuration, MessagingFactory::createSender);
    }

    public void send(OutboundMessage message) {
        client().send(message);
    }
}
