package org.javai.provisioning.lifecycle;

import org.javai.provisioning.CancellationToken;
import org.javai.provisioning.TopicDescriptor;
import org.javai.provisioning.config.ProvisioningSettings;
import org.javai.provisioning.topic.TopicProvisioner;

import java.util.Objects;

/**
 * Top-level owner of everything senders and receivers share: the settings, the
 * messaging factory and the topic provisioner.
 *
 * <p>{@link #close()} is the explicit teardown phase. It cancels any provisioning still
 * retrying on another thread and closes the shared connection; the factory itself closes
 * once the last endpoint built from this configuration has been closed.</p>
 */
public final class BusConfiguration implements AutoCloseable {

    private final ProvisioningSettings settings;
    private final SharedConnection connection;
    private final TopicProvisioner provisioner;
    private final CancellationToken shutdown = CancellationToken.create();

    public BusConfiguration(ProvisioningSettings settings, MessagingFactory factory, TopicProvisioner provisioner) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.connection = new SharedConnection(factory);
        this.provisioner = Objects.requireNonNull(provisioner, "provisioner must not be null");
    }

    public ProvisioningSettings settings() {
        return settings;
    }

    public SharedConnection connection() {
        return connection;
    }

    public TopicProvisioner provisioner() {
        return provisioner;
    }

    /**
     * Ensures the configured topic exists.
     *
     * @throws org.javai.provisioning.OutcomeFailedException if provisioning fails or is cancelled by {@link #close()}
     */
    public TopicDescriptor provisionTopic() {
        return provisioner.ensureTopic(settings.topicName(), settings.partitioningEnabled(), shutdown);
    }

    public TopicSender createSender() {
        return new TopicSender(this);
    }

    public TopicReceiver createReceiver(ReceiverOptions options) {
        return new TopicReceiver(this, options);
    }

    @Override
    public void close() {
        if (!shutdown.isCancelled()) {
            shutdown.cancel("bus configuration closed");
        }
        connection.close();
    }
}
