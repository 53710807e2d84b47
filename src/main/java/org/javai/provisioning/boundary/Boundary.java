package org.javai.provisioning.boundary;

import org.javai.provisioning.Failure;
import org.javai.provisioning.Outcome;
import org.javai.provisioning.ops.OpReporter;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Wraps one backend call so that provisioning code only ever sees an {@link Outcome}.
 *
 * <p>A checked exception from the call is turned into a {@link Failure} by the configured
 * {@link FailureClassifier}, handed to the {@link OpReporter} and returned as {@code Fail}.
 * An interrupt becomes a CANCELLED failure with the thread's interrupt flag restored.
 * Runtime exceptions are defects and pass through untouched.
 *
 * <pre>{@code
 * Boundary existence = Boundary.of(new ExistenceCheckFailureClassifier(), reporter);
 * Outcome<TopicDescriptor> topic = existence.call("TopicAdmin.getTopic", Map.of("topic", name),
 *         () -> admin.getTopic(name));
 * }</pre>
 */
public final class Boundary {

    private final FailureClassifier classifier;
    private final OpReporter reporter;

    public static Boundary of(FailureClassifier classifier, OpReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        return call(operation, Map.of(), work);
    }

    /**
     * Runs {@code work} once.
     *
     * @param operation name recorded on any failure, e.g. {@code TopicAdmin.createTopic}
     * @param tags      copied onto any failure, typically the topic name
     */
    public <T> Outcome<T> call(String operation, Map<String, String> tags, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(work, "work");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                return Outcome.fail(Failure.cancelled("interrupted during " + operation, operation, null).withTags(tags));
            }
            return handleException(operation, tags, e);
        }
    }

    private <T> Outcome<T> handleException(String operation, Map<String, String> tags, Exception e) {
        FailureKind kind = classifier.classify(operation, e);
        Failure failure = new Failure(
                kind.id(),
                kind.message(),
                kind.type(),
                e,
                kind.retryAfter(),
                operation,
                Instant.now(),
                tags,
                null
        );

        reporter.report(failure);
        return Outcome.fail(failure);
    }
}
