package org.javai.provisioning.azure;

import com.azure.messaging.servicebus.ServiceBusReceiverClient;
import org.javai.provisioning.lifecycle.InboundMessage;
import org.javai.provisioning.lifecycle.MessageReceiver;
import org.javai.provisioning.lifecycle.MessagingClient;
import org.javai.provisioning.lifecycle.ReceiveMode;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * {@link MessageReceiver} over a sessionless {@link ServiceBusReceiverClient}.
 */
final class ServiceBusSubscriptionReceiver implements MessageReceiver {

    private final ServiceBusReceiverClient client;
    private final ReceiveMode mode;
    private final int prefetchCount;
    private final Consumer<MessagingClient> onClose;
    private final AtomicBoolean closed = new AtomicBoolean();

    ServiceBusSubscriptionReceiver(ServiceBusReceiverClient client, ReceiveMode mode, int prefetchCount, Consumer<MessagingClient> onClose) {
        this.client = client;
        this.mode = mode;
        this.prefetchCount = prefetchCount;
        this.onClose = onClose;
    }

    @Override
    public List<InboundMessage> receive(int maxMessages, Duration maxWait) {
        return client.receiveMessages(maxMessages, maxWait).stream()
                .map(ServiceBusMessagingFactory::toInbound)
                .collect(Collectors.toList());
    }

    @Override
    public int prefetchCount() {
        return prefetchCount;
    }

    @Override
    public ReceiveMode mode() {
        return mode;
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
