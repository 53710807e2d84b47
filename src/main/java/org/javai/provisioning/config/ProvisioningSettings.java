package org.javai.provisioning.config;

import org.javai.provisioning.backend.TopicAdmin;
import org.javai.provisioning.ops.OpReporter;
import org.javai.provisioning.retry.RetryPolicyConfig;
import org.javai.provisioning.topic.TopicProvisioner;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything needed to provision one topic.
 *
 * <p>Resolved by {@link #fromEnvironment()} from system properties with environment variable fallbacks:
 * <ul>
 *   <li>{@code provisioning.topic.name} / {@code PROVISIONING_TOPIC_NAME} (required)</li>
 *   <li>{@code provisioning.topic.partitioning} / {@code PROVISIONING_TOPIC_PARTITIONING} (default false)</li>
 *   <li>{@code provisioning.existence.max-attempts}, {@code .min-backoff-ms}, {@code .max-backoff-ms}</li>
 *   <li>{@code provisioning.creation.max-attempts}, {@code .min-backoff-ms}, {@code .max-backoff-ms}, {@code .budget-ms}</li>
 *   <li>{@code azure.servicebus.connection-string} / {@code AZURE_SERVICEBUS_CONNECTION_STRING} (optional)</li>
 *   <li>{@code azure.servicebus.namespace} / {@code AZURE_SERVICEBUS_NAMESPACE} (optional; used with ambient
 *       Azure credentials when no connection string is set)</li>
 * </ul>
 * Each retry property has an upper-case environment variable with dots and dashes turned
 * into underscores, e.g. {@code PROVISIONING_CREATION_BUDGET_MS}.
 *
 * @param topicName Topic to provision
 * @param partitioningEnabled Partitioning the topic must have
 * @param existencePolicy Retry settings for existence lookups
 * @param creationPolicy Retry settings for creation
 * @param creationBudget Time limit on retrying creation
 * @param connectionString Backend connection string, or null to use ambient credentials
 * @param namespace Fully qualified backend namespace for credential-based access (may be null)
 */
public record ProvisioningSettings(
        String topicName,
        boolean partitioningEnabled,
        RetryPolicyConfig existencePolicy,
        RetryPolicyConfig creationPolicy,
        Duration creationBudget,
        String connectionString,
        String namespace
) {

    static final String TOPIC_NAME = "provisioning.topic.name";
    static final String TOPIC_PARTITIONING = "provisioning.topic.partitioning";
    static final String CONNECTION_STRING = "azure.servicebus.connection-string";
    static final String NAMESPACE = "azure.servicebus.namespace";

    public ProvisioningSettings {
        Objects.requireNonNull(topicName, "topicName must not be null");
        if (topicName.isBlank()) {
            throw new IllegalArgumentException("topicName must not be blank");
        }
        Objects.requireNonNull(existencePolicy, "existencePolicy must not be null");
        Objects.requireNonNull(creationPolicy, "creationPolicy must not be null");
        Objects.requireNonNull(creationBudget, "creationBudget must not be null");
    }

    /**
     * Settings with default retry behaviour and no connection string.
     */
    public static ProvisioningSettings of(String topicName, boolean partitioningEnabled) {
        return new ProvisioningSettings(topicName, partitioningEnabled,
                RetryPolicyConfig.existenceCheckDefaults(),
                RetryPolicyConfig.creationDefaults(),
                TopicProvisioner.DEFAULT_CREATION_BUDGET,
                null,
                null);
    }

    public static ProvisioningSettings fromEnvironment() {
        return from(ConfigResolver.system());
    }

    public static ProvisioningSettings from(ConfigResolver resolver) {
        return new ProvisioningSettings(
                resolver.require(TOPIC_NAME, envName(TOPIC_NAME)),
                resolver.booleanValue(TOPIC_PARTITIONING, envName(TOPIC_PARTITIONING), false),
                policy(resolver, "provisioning.existence", RetryPolicyConfig.existenceCheckDefaults()),
                policy(resolver, "provisioning.creation", RetryPolicyConfig.creationDefaults()),
                resolver.millis("provisioning.creation.budget-ms", envName("provisioning.creation.budget-ms"),
                        TopicProvisioner.DEFAULT_CREATION_BUDGET),
                resolver.optional(CONNECTION_STRING, "AZURE_SERVICEBUS_CONNECTION_STRING").orElse(null),
                resolver.optional(NAMESPACE, "AZURE_SERVICEBUS_NAMESPACE").orElse(null));
    }

    public Optional<String> connectionStringIfPresent() {
        return Optional.ofNullable(connectionString);
    }

    public Optional<String> namespaceIfPresent() {
        return Optional.ofNullable(namespace);
    }

    /**
     * Returns a copy that connects with the given connection string.
     */
    public ProvisioningSettings withConnectionString(String connectionString) {
        return new ProvisioningSettings(topicName, partitioningEnabled, existencePolicy, creationPolicy,
                creationBudget, connectionString, namespace);
    }

    /**
     * A provisioner builder preconfigured with these retry settings.
     */
    public TopicProvisioner.Builder provisionerFor(TopicAdmin admin, OpReporter reporter) {
        return TopicProvisioner.builder(admin)
                .existencePolicy(existencePolicy)
                .creationPolicy(creationPolicy)
                .creationBudget(creationBudget)
                .reporter(reporter);
    }

    @Override
    public String toString() {
        return "ProvisioningSettings[topicName=" + topicName
                + ", partitioningEnabled=" + partitioningEnabled
                + ", existencePolicy=" + existencePolicy
                + ", creationPolicy=" + creationPolicy
                + ", creationBudget=" + creationBudget
                + ", connectionString=" + (connectionString == null ? "<none>" : "<redacted>")
                + ", namespace=" + namespace + "]";
    }

    private static RetryPolicyConfig policy(ConfigResolver resolver, String prefix, RetryPolicyConfig defaults) {
        return new RetryPolicyConfig(
                resolver.intValue(prefix + ".max-attempts", envName(prefix + ".max-attempts"), defaults.maxAttempts()),
                resolver.millis(prefix + ".min-backoff-ms", envName(prefix + ".min-backoff-ms"), defaults.minBackoff()),
                resolver.millis(prefix + ".max-backoff-ms", envName(prefix + ".max-backoff-ms"), defaults.maxBackoff()));
    }

    static String envName(String sysProp) {
        return sysProp.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }
}
