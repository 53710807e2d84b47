package org.javai.provisioning.azure;

import com.azure.messaging.servicebus.ServiceBusReceiverClient;
import com.azure.messaging.servicebus.ServiceBusSessionReceiverClient;
import org.javai.provisioning.lifecycle.InboundMessage;
import org.javai.provisioning.lifecycle.MessageReceiver;
import org.javai.provisioning.lifecycle.MessagingClient;
import org.javai.provisioning.lifecycle.ReceiveMode;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * {@link MessageReceiver} that locks the next available message session on first use
 * and receives from it until closed.
 */
final class ServiceBusSessionReceiver implements MessageReceiver {

    private final ServiceBusSessionReceiverClient sessions;
    private final ReceiveMode mode;
    private final int prefetchCount;
    private final Consumer<MessagingClient> onClose;
    private final SessionSlot<ServiceBusReceiverClient> session = new SessionSlot<>(ServiceBusReceiverClient::close);

    ServiceBusSessionReceiver(ServiceBusSessionReceiverClient sessions, ReceiveMode mode, int prefetchCount, Consumer<MessagingClient> onClose) {
        this.sessions = sessions;
        this.mode = mode;
        this.prefetchCount = prefetchCount;
        this.onClose = onClose;
    }

    @Override
    public List<InboundMessage> receive(int maxMessages, Duration maxWait) {
        return session.get(sessions::acceptNextSession).receiveMessages(maxMessages, maxWait).stream()
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
        if (!session.close()) {
            return;
        }
        try {
            sessions.close();
        } finally {
            onClose.accept(this);
        }
    }
}
