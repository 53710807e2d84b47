package org.javai.provisioning.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.provisioning.Failure;
import org.javai.provisioning.ops.OpReporter;
import org.javai.provisioning.topic.ProvisioningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Reports provisioning events as JSON-lines metrics via SLF4J.
 *
 * <p>Every event is one JSON object on one log line, suitable for metrics aggregation.
 * The tracking key is the failing operation, prefixed with an optional namespace.</p>
 *
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"orders.TopicAdmin.createTopic","attemptNumber":2,"delayMs":200,...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.provisioning.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final ObjectMapper mapper = new ObjectMapper();
	private final String namespace;
	private final Logger logger;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		ObjectNode event = failureEvent("failure", failure);
		event.put("message", failure.message());
		if (failure.retryAfter() != null) {
			event.put("retryAfterMs", failure.retryAfter().toMillis());
		}
		appendTags(event, failure.tags());
		emit(event);
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		ObjectNode event = failureEvent("retry_attempt", failure);
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		event.put("policy", policyId);
		emit(event);
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
		ObjectNode event = failureEvent("retry_exhausted", failure);
		event.put("totalAttempts", totalAttempts);
		event.put("policy", policyId);
		emit(event);
	}

	@Override
	public void reportCancelled(Failure failure, int totalAttempts, String policyId) {
		ObjectNode event = failureEvent("cancelled", failure);
		event.put("totalAttempts", totalAttempts);
		event.put("policy", policyId);
		event.put("reason", failure.message());
		emit(event);
	}

	@Override
	public void reportTransition(String topicName, ProvisioningState from, ProvisioningState to) {
		ObjectNode event = mapper.createObjectNode();
		event.put("eventType", "transition");
		event.put("timestamp", ISO_FORMATTER.format(Instant.now()));
		event.put("trackingKey", withNamespace("provisioning." + topicName));
		event.put("from", from.name());
		event.put("to", to.name());
		emit(event);
	}

	private ObjectNode failureEvent(String eventType, Failure failure) {
		ObjectNode event = mapper.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(failure.occurredAt()));
		event.put("trackingKey", withNamespace(failure.operation()));
		event.put("code", failure.id().toString());
		event.put("type", failure.type().name());
		event.put("operation", failure.operation());
		return event;
	}

	private static void appendTags(ObjectNode event, Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return;
		}
		ObjectNode node = event.putObject("tags");
		tags.forEach(node::put);
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(mapper.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialise metrics event {}", event.get("eventType"), e);
		}
	}

	String withNamespace(String key) {
		return namespace == null ? key : namespace + "." + key;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
