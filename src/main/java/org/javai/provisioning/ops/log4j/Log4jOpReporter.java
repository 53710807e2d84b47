package org.javai.provisioning.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.provisioning.Failure;
import org.javai.provisioning.FailureType;
import org.javai.provisioning.ops.OpReporter;
import org.javai.provisioning.topic.ProvisioningState;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports provisioning events using Log4j2.
 *
 * <p>Failures are logged at a level chosen by their {@link FailureType}:
 * <ul>
 *   <li>{@code ENTITY_NOT_FOUND}, {@code ENTITY_ALREADY_EXISTS} → DEBUG (expected branches)</li>
 *   <li>{@code TRANSIENT} → WARN</li>
 *   <li>anything else → ERROR</li>
 * </ul>
 *
 * <p>Each event kind carries its own marker ({@code FAILURE}, {@code RETRY},
 * {@code RETRY_EXHAUSTED}, {@code CANCELLED}, {@code PROVISIONING}) so log
 * configurations can route them separately.
 */
public class Log4jOpReporter implements OpReporter {

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker CANCELLED_MARKER = MarkerManager.getMarker("CANCELLED");
	static final Marker PROVISIONING_MARKER = MarkerManager.getMarker("PROVISIONING");

	private final Logger logger;

	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.provisioning.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure.type()))
			.withMarker(FAILURE_MARKER)
			.withThrowable(failure.type() == FailureType.PERMANENT ? failure.exception() : null)
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} of [{}] failed with {}; retrying in {} ms under policy [{}]",
				attemptNumber,
				failure.operation(),
				failure.id(),
				delay.toMillis(),
				policyId);
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted for [{}] after {} attempts with policy [{}]. Code: {}, Message: {}",
				failure.operation(),
				totalAttempts,
				policyId,
				failure.id(),
				failure.message());
	}

	@Override
	public void reportCancelled(Failure failure, int totalAttempts, String policyId) {
		logger.atWarn()
			.withMarker(CANCELLED_MARKER)
			.log("[{}] abandoned after {} attempts with policy [{}]: {}",
				failure.operation(),
				totalAttempts,
				policyId,
				failure.message());
	}

	@Override
	public void reportTransition(String topicName, ProvisioningState from, ProvisioningState to) {
		logger.atInfo()
			.withMarker(PROVISIONING_MARKER)
			.log("Topic [{}]: {} -> {}", topicName, from, to);
	}

	private static String formatFailureMessage(Failure failure) {
		return "Failure in [%s]: %s | code=%s, type=%s%s%s".formatted(
				failure.operation(),
				failure.message(),
				failure.id(),
				failure.type(),
				formatRetryAfter(failure.retryAfter()),
				formatTags(failure.tags()));
	}

	private static String formatRetryAfter(Duration retryAfter) {
		return retryAfter != null ? ", retryAfter=" + retryAfter.toMillis() + "ms" : "";
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		return tags.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.sorted()
				.collect(Collectors.joining(", ", ", tags={", "}"));
	}

	static Level levelFor(FailureType type) {
		return switch (type) {
			case ENTITY_NOT_FOUND, ENTITY_ALREADY_EXISTS -> Level.DEBUG;
			case TRANSIENT -> Level.WARN;
			default -> Level.ERROR;
		};
	}
}
