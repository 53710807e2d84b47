package org.javai.provisioning.azure;

import com.azure.messaging.servicebus.ServiceBusMessage;
import com.azure.messaging.servicebus.ServiceBusSenderClient;
import org.javai.provisioning.lifecycle.MessageSender;
import org.javai.provisioning.lifecycle.MessagingClient;
import org.javai.provisioning.lifecycle.OutboundMessage;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link MessageSender} over a {@link ServiceBusSenderClient}.
 */
final class ServiceBusTopicSender implements MessageSender {

    private final ServiceBusSenderClient client;
    private final Consumer<MessagingClient> onClose;
    private final AtomicBoolean closed = new AtomicBoolean();

    ServiceBusTopicSender(ServiceBusSenderClient client, Consumer<MessagingClient> onClose) {
        this.client = client;
        this.onClose = onClose;
    }

    @Override
    public void send(OutboundMessage message) {
        ServiceBusMessage outgoing = new ServiceBusMessage(message.body());
        outgoing.getApplicationProperties().putAll(
                ServiceBusMessagingFactory.outboundProperties(message.messageType(), message.properties()));
        client.sendMessage(outgoing);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                client.close();
            } finally {
                onClose.accept(this);
            }
        }
    }
}
