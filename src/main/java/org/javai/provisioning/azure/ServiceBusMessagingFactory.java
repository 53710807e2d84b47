package org.javai.provisioning.azure;

import com.azure.messaging.servicebus.ServiceBusClientBuilder;
import com.azure.messaging.servicebus.ServiceBusReceivedMessage;
import com.azure.messaging.servicebus.models.ServiceBusReceiveMode;
import org.javai.provisioning.TopicDescriptor;
import org.javai.provisioning.lifecycle.InboundMessage;
import org.javai.provisioning.lifecycle.MessageReceiver;
import org.javai.provisioning.lifecycle.MessageSender;
import org.javai.provisioning.lifecycle.MessagingClient;
import org.javai.provisioning.lifecycle.MessagingFactory;
import org.javai.provisioning.lifecycle.ReceiveMode;
import org.javai.provisioning.lifecycle.ReceiverOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MessagingFactory} over one {@link ServiceBusClientBuilder}. Every client it
 * builds shares the builder's AMQP connection.
 *
 * <p>Clients are tracked until they close; {@link #close()} closes whatever is still open.</p>
 */
public final class ServiceBusMessagingFactory implements MessagingFactory {

    private static final Logger log = LoggerFactory.getLogger(ServiceBusMessagingFactory.class);

    /** Application property carrying the message type name. */
    public static final String TYPE_PROPERTY = "x_proj_ext_type";

    private final ServiceBusClientBuilder builder;
    private final Set<MessagingClient> open = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public ServiceBusMessagingFactory(ServiceBusClientBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
    }

    @Override
    public MessageSender createSender(TopicDescriptor topic) {
        ensureOpen();
        return track(new ServiceBusTopicSender(
                builder.sender().topicName(topic.name()).buildClient(),
                open::remove));
    }

    @Override
    public MessageReceiver createReceiver(TopicDescriptor topic, ReceiverOptions options) {
        ensureOpen();
        ServiceBusReceiveMode mode = toAzure(options.mode());
        if (options.sessionAware()) {
            return track(new ServiceBusSessionReceiver(
                    builder.sessionReceiver()
                            .topicName(topic.name())
                            .subscriptionName(options.subscription())
                            .receiveMode(mode)
                            .prefetchCount(options.prefetchCount())
                            .buildClient(),
                    options.mode(), options.prefetchCount(),
                    open::remove));
        }
        return track(new ServiceBusSubscriptionReceiver(
                builder.receiver()
                        .topicName(topic.name())
                        .subscriptionName(options.subscription())
                        .receiveMode(mode)
                        .prefetchCount(options.prefetchCount())
                        .buildClient(),
                options.mode(), options.prefetchCount(),
                open::remove));
    }

    int openClients() {
        return open.size();
    }

    @Override
    public void close() {
        closed = true;
        List<MessagingClient> leftovers = new ArrayList<>(open);
        if (!leftovers.isEmpty()) {
            log.warn("Closing {} messaging client(s) left open at factory shutdown", leftovers.size());
        }
        for (MessagingClient client : leftovers) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close messaging client {}", client, e);
            }
        }
        open.clear();
    }

    static InboundMessage toInbound(ServiceBusReceivedMessage message) {
        Map<String, Object> applicationProperties = message.getApplicationProperties();
        return new InboundMessage(
                message.getMessageId(),
                message.getBody().toBytes(),
                messageType(applicationProperties),
                message.getSessionId(),
                inboundProperties(applicationProperties));
    }

    /**
     * Application properties for an outgoing message: the caller's properties plus
     * {@link #TYPE_PROPERTY} when the message has a type.
     *
     * @throws IllegalArgumentException if the caller's properties already use {@link #TYPE_PROPERTY}
     */
    static Map<String, Object> outboundProperties(String messageType, Map<String, Object> properties) {
        if (properties.containsKey(TYPE_PROPERTY)) {
            throw new IllegalArgumentException("Application property " + TYPE_PROPERTY + " is reserved for the message type");
        }
        Map<String, Object> outgoing = new HashMap<>(properties);
        if (messageType != null) {
            outgoing.put(TYPE_PROPERTY, messageType);
        }
        return outgoing;
    }

    static String messageType(Map<String, Object> applicationProperties) {
        Object type = applicationProperties.get(TYPE_PROPERTY);
        return type == null ? null : type.toString();
    }

    /** Received application properties without the type property and without null values. */
    static Map<String, Object> inboundProperties(Map<String, Object> applicationProperties) {
        Map<String, Object> properties = new HashMap<>();
        applicationProperties.forEach((key, value) -> {
            if (value != null && !TYPE_PROPERTY.equals(key)) {
                properties.put(key, value);
            }
        });
        return properties;
    }

    static ServiceBusReceiveMode toAzure(ReceiveMode mode) {
        return mode == ReceiveMode.PEEK_LOCK ? ServiceBusReceiveMode.PEEK_LOCK : ServiceBusReceiveMode.RECEIVE_AND_DELETE;
    }

    private <C extends MessagingClient> C track(C client) {
        open.add(client);
        if (closed) {
            client.close();
            throw new IllegalStateException("Messaging factory is closed");
        }
        return client;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Messaging factory is closed");
        }
    }
}
