package org.javai.provisioning.azure;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.messaging.servicebus.ServiceBusClientBuilder;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClient;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClientBuilder;
import org.javai.provisioning.config.ProvisioningSettings;
import org.javai.provisioning.lifecycle.BusConfiguration;
import org.javai.provisioning.ops.OpReporter;
import org.javai.provisioning.topic.TopicProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires a {@link BusConfiguration} against Azure Service Bus.
 *
 * <p>Authenticates with the connection string when one is configured, otherwise with
 * {@code DefaultAzureCredential} against the configured namespace.</p>
 */
public final class AzureServiceBus {

    private static final Logger log = LoggerFactory.getLogger(AzureServiceBus.class);

    private AzureServiceBus() {
    }

    public static BusConfiguration configure(ProvisioningSettings settings, OpReporter reporter) {
        ServiceBusAdministrationClientBuilder adminBuilder = new ServiceBusAdministrationClientBuilder();
        ServiceBusClientBuilder clientBuilder = new ServiceBusClientBuilder();

        if (settings.connectionString() != null) {
            log.info("Connecting to Service Bus with a connection string");
            adminBuilder.connectionString(settings.connectionString());
            clientBuilder.connectionString(settings.connectionString());
        } else if (settings.namespace() != null) {
            log.info("Connecting to Service Bus namespace {} with ambient credentials", settings.namespace());
            TokenCredential credential = new DefaultAzureCredentialBuilder().build();
            adminBuilder.credential(settings.namespace(), credential);
            clientBuilder.credential(settings.namespace(), credential);
        } else {
            throw new IllegalStateException("Service Bus needs either a connection string or a namespace: " + settings);
        }

        ServiceBusAdministrationClient adminClient = adminBuilder.buildClient();
        TopicProvisioner provisioner = settings.provisionerFor(new ServiceBusTopicAdmin(adminClient), reporter).build();
        return new BusConfiguration(settings, new ServiceBusMessagingFactory(clientBuilder), provisioner);
    }
}
