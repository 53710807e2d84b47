package org.javai.provisioning.azure;

import com.azure.core.exception.ClientAuthenticationException;
import com.azure.core.exception.HttpResponseException;
import com.azure.core.exception.ResourceExistsException;
import com.azure.core.exception.ResourceNotFoundException;
import com.azure.core.http.HttpResponse;
import com.azure.messaging.servicebus.ServiceBusException;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClient;
import com.azure.messaging.servicebus.administration.models.CreateTopicOptions;
import com.azure.messaging.servicebus.administration.models.TopicProperties;
import org.javai.provisioning.TopicDescriptor;
import org.javai.provisioning.backend.BackendTimeoutException;
import org.javai.provisioning.backend.CommunicationException;
import org.javai.provisioning.backend.ConflictingOperationException;
import org.javai.provisioning.backend.EntityAlreadyExistsException;
import org.javai.provisioning.backend.EntityNotFoundException;
import org.javai.provisioning.backend.InvalidEntityException;
import org.javai.provisioning.backend.QuotaExceededException;
import org.javai.provisioning.backend.ServerBusyException;
import org.javai.provisioning.backend.TopicAdmin;
import org.javai.provisioning.backend.TopicAdminException;
import org.javai.provisioning.backend.UnauthorizedException;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * {@link TopicAdmin} over the Azure Service Bus administration client.
 *
 * <p>The Azure SDK reports failures as unchecked exceptions; this adapter translates the
 * ones that describe backend conditions into the checked {@link TopicAdminException}
 * hierarchy. Anything else is a defect and propagates unchanged.</p>
 */
public final class ServiceBusTopicAdmin implements TopicAdmin {

    private static final String RETRY_AFTER_HEADER = "Retry-After";

    private final ServiceBusAdministrationClient client;

    public ServiceBusTopicAdmin(ServiceBusAdministrationClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public TopicDescriptor getTopic(String name) throws TopicAdminException {
        try {
            TopicProperties properties = client.getTopic(name);
            return TopicDescriptor.of(properties.getName(), properties.isPartitioningEnabled());
        } catch (RuntimeException e) {
            throw translate(name, e);
        }
    }

    @Override
    public TopicDescriptor createTopic(TopicDescriptor descriptor) throws TopicAdminException {
        CreateTopicOptions options = new CreateTopicOptions()
                .setPartitioningEnabled(descriptor.partitioningEnabled());
        try {
            TopicProperties properties = client.createTopic(descriptor.name(), options);
            return TopicDescriptor.of(properties.getName(), properties.isPartitioningEnabled());
        } catch (RuntimeException e) {
            throw translate(descriptor.name(), e);
        }
    }

    /**
     * Translates an SDK failure, rethrowing it unchanged if it is not a backend condition.
     */
    static TopicAdminException translate(String entity, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();

        if (e instanceof ResourceNotFoundException) {
            return new EntityNotFoundException(entity, message, e);
        }
        if (e instanceof ResourceExistsException) {
            return isConflictingOperation(message)
                    ? new ConflictingOperationException(entity, message, e)
                    : new EntityAlreadyExistsException(entity, message, e);
        }
        if (e instanceof ClientAuthenticationException) {
            return new UnauthorizedException(entity, message, e);
        }
        if (e instanceof HttpResponseException http && http.getResponse() != null) {
            HttpResponse response = http.getResponse();
            return forStatus(entity, response.getStatusCode(), message, retryAfter(response), e);
        }
        if (e instanceof ServiceBusException serviceBus) {
            return new TopicAdminException(entity, message, serviceBus.isTransient(), e);
        }
        if (e instanceof IllegalArgumentException) {
            // the SDK validates entity names client-side
            return new InvalidEntityException(entity, message, e);
        }
        if (hasCause(e, TimeoutException.class)) {
            return new BackendTimeoutException(entity, message, e);
        }
        if (hasCause(e, IOException.class)) {
            return new CommunicationException(entity, message, e);
        }
        throw e;
    }

    static TopicAdminException forStatus(String entity, int status, String message, Duration retryAfter, Throwable cause) {
        switch (status) {
            case 400:
                return new InvalidEntityException(entity, message, cause);
            case 401:
            case 403:
                return isQuotaExceeded(message)
                        ? new QuotaExceededException(entity, message, cause)
                        : new UnauthorizedException(entity, message, cause);
            case 404:
                return new EntityNotFoundException(entity, message, cause);
            case 409:
                return isConflictingOperation(message)
                        ? new ConflictingOperationException(entity, message, cause)
                        : new EntityAlreadyExistsException(entity, message, cause);
            case 429:
            case 503:
                return new ServerBusyException(entity, message, retryAfter, cause);
            case 408:
            case 500:
            case 502:
            case 504:
                return new CommunicationException(entity, message, cause);
            default:
                return new TopicAdminException(entity, "HTTP " + status + ": " + message, false, cause);
        }
    }

    private static boolean isConflictingOperation(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("40901") || lower.contains("conflicting operation");
    }

    private static boolean isQuotaExceeded(String message) {
        return message.toLowerCase(Locale.ROOT).contains("quota");
    }

    private static Duration retryAfter(HttpResponse response) {
        String value = response.getHeaderValue(RETRY_AFTER_HEADER);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable current = t; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                return false;
            }
        }
        return false;
    }
}
