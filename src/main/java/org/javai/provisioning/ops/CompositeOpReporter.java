package org.javai.provisioning.ops;

import org.javai.provisioning.Failure;
import org.javai.provisioning.topic.ProvisioningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * Forwards each provisioning event to several reporters in registration order.
 *
 * <p>A reporter that throws is logged at WARN and skipped; the others still see the event
 * and provisioning carries on.
 *
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.of(
 *     new Log4jOpReporter(),
 *     new MetricsOpReporter("orders-service")
 * );
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	@Override
	public void report(Failure failure) {
		fanOut("report", reporter -> reporter.report(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		fanOut("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(failure, attemptNumber, delay, policyId));
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
		fanOut("reportRetryExhausted", reporter -> reporter.reportRetryExhausted(failure, totalAttempts, policyId));
	}

	@Override
	public void reportCancelled(Failure failure, int totalAttempts, String policyId) {
		fanOut("reportCancelled", reporter -> reporter.reportCancelled(failure, totalAttempts, policyId));
	}

	@Override
	public void reportTransition(String topicName, ProvisioningState from, ProvisioningState to) {
		fanOut("reportTransition", reporter -> reporter.reportTransition(topicName, from, to));
	}

	private void fanOut(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				log.warn("OpReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}
}
