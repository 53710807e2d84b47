package org.javai.provisioning.lifecycle;

import java.time.Duration;
import java.util.List;

/**
 * Receives from one subscription of the configured topic, provisioning the topic on construction.
 */
public class TopicReceiver extends MessagingEndpoint<MessageReceiver> {

    public TopicReceiver(BusConfiguration configuration, ReceiverOptions options) {
        super(configuration, (factory, topic) -> factory.createReceiver(topic, options));
    }

    public List<InboundMessage> receive(int maxMessages, Duration maxWait) {
        return client().receive(maxMessages, maxWait);
    }

    public int prefetchCount() {
        return client().prefetchCount();
    }

    public ReceiveMode mode() {
        return client().mode();
    }
}
