package org.javai.provisioning.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Resolves configuration from system properties, falling back to environment variables.
 */
public final class ConfigResolver {

	private final UnaryOperator<String> systemProperties;
	private final UnaryOperator<String> environment;

	public ConfigResolver(UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
		this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	/**
	 * A resolver over the JVM's system properties and the process environment.
	 */
	public static ConfigResolver system() {
		return new ConfigResolver(System::getProperty, System::getenv);
	}

	/**
	 * @throws IllegalStateException if neither the property nor the variable is set
	 */
	public String require(String sysProp, String envVar) {
		return optional(sysProp, envVar).orElseThrow(() -> new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"));
	}

	public Optional<String> optional(String sysProp, String envVar) {
		String value = systemProperties.apply(sysProp);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	public boolean booleanValue(String sysProp, String envVar, boolean defaultValue) {
		return optional(sysProp, envVar)
				.map(value -> parseBoolean(sysProp, value))
				.orElse(defaultValue);
	}

	public int intValue(String sysProp, String envVar, int defaultValue) {
		return optional(sysProp, envVar)
				.map(value -> parseInt(sysProp, value))
				.orElse(defaultValue);
	}

	public Duration millis(String sysProp, String envVar, Duration defaultValue) {
		return optional(sysProp, envVar)
				.map(value -> Duration.ofMillis(parseLong(sysProp, value)))
				.orElse(defaultValue);
	}

	private static boolean parseBoolean(String key, String value) {
		if ("true".equalsIgnoreCase(value)) {
			return true;
		}
		if ("false".equalsIgnoreCase(value)) {
			return false;
		}
		throw new IllegalArgumentException("'" + key + "' must be true or false, was: " + value);
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("'" + key + "' must be an integer, was: " + value, e);
		}
	}

	private static long parseLong(String key, String value) {
		try {
			return Long.parseLong(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("'" + key + "' must be a number of milliseconds, was: " + value, e);
		}
	}
}
