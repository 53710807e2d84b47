package org.javai.provisioning.topic;

import org.javai.provisioning.CancellationToken;
import org.javai.provisioning.Failure;
import org.javai.provisioning.FailureId;
import org.javai.provisioning.FailureType;
import org.javai.provisioning.Outcome;
import org.javai.provisioning.TopicDescriptor;
import org.javai.provisioning.ops.OpReporter;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One execution of the provisioning state machine for one topic.
 *
 * <pre>
 * UNKNOWN → CHECKING → FOUND → READY | FAILED
 *                    → NOT_FOUND → CREATING → CREATED → READY
 *                                           → CONFLICT_EXISTS → READY | FAILED
 * </pre>
 *
 * <p>A run is single-use: once started it cannot be restarted, and after it reaches
 * {@link ProvisioningState#READY} or {@link ProvisioningState#FAILED} its result is fixed.
 * Runs execute on the calling thread; concurrent runs for the same topic, in this or
 * other processes, are reconciled by the backend's atomic create and the conflict re-fetch.</p>
 */
public final class ProvisioningRun {

    static final String OPERATION = "TopicProvisioner.ensureTopic";

    private final TopicProvisioner provisioner;
    private final TopicDescriptor desired;
    private final CancellationToken token;
    private final OpReporter reporter;

    private volatile ProvisioningState state = ProvisioningState.UNKNOWN;
    private volatile Outcome<TopicDescriptor> result;

    ProvisioningRun(TopicProvisioner provisioner, TopicDescriptor desired, CancellationToken token, OpReporter reporter) {
        this.provisioner = Objects.requireNonNull(provisioner, "provisioner must not be null");
        this.desired = Objects.requireNonNull(desired, "desired must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    public ProvisioningState state() {
        return state;
    }

    public TopicDescriptor desired() {
        return desired;
    }

    /**
     * The terminal outcome, or null while the run has not finished.
     */
    public Outcome<TopicDescriptor> result() {
        return result;
    }

    /**
     * Drives the state machine to a terminal state.
     *
     * @throws IllegalStateException if this run has already been started
     */
    public Outcome<TopicDescriptor> run() {
        synchronized (this) {
            if (state != ProvisioningState.UNKNOWN) {
                throw new IllegalStateException("Provisioning of topic '" + desired.name() + "' already started; state is " + state);
            }
            moveTo(ProvisioningState.CHECKING);
        }

        Outcome<TopicDescriptor> lookup = provisioner.lookup(desired.name(), token);
        if (lookup instanceof Outcome.Ok<TopicDescriptor> found) {
            moveTo(ProvisioningState.FOUND);
            return verify(found.value());
        }

        Failure lookupFailure = ((Outcome.Fail<TopicDescriptor>) lookup).failure();
        if (lookupFailure.type() != FailureType.ENTITY_NOT_FOUND) {
            return fail(lookupFailure);
        }
        moveTo(ProvisioningState.NOT_FOUND);

        moveTo(ProvisioningState.CREATING);
        Outcome<TopicDescriptor> created = provisioner.create(desired, token);
        if (created instanceof Outcome.Ok<TopicDescriptor> ok) {
            moveTo(ProvisioningState.CREATED);
            return ready(ok.value());
        }

        Failure createFailure = ((Outcome.Fail<TopicDescriptor>) created).failure();
        if (createFailure.type() != FailureType.ENTITY_ALREADY_EXISTS) {
            return fail(createFailure);
        }
        moveTo(ProvisioningState.CONFLICT_EXISTS);

        Outcome<TopicDescriptor> refetched = provisioner.lookup(desired.name(), token);
        if (refetched instanceof Outcome.Ok<TopicDescriptor> winner) {
            return verify(winner.value());
        }

        Failure refetchFailure = ((Outcome.Fail<TopicDescriptor>) refetched).failure();
        if (refetchFailure.type() == FailureType.ENTITY_NOT_FOUND) {
            return fail(vanished(refetchFailure));
        }
        return fail(refetchFailure);
    }

    private Outcome<TopicDescriptor> verify(TopicDescriptor existing) {
        if (!existing.satisfies(desired.partitioningEnabled())) {
            return fail(Failure.invariantViolation(
                    FailureId.of("provisioning", "partitioning_mismatch"),
                    "EnablePartitioning may not be changed on existing topic '" + existing.name()
                            + "': it was created without partitioning",
                    OPERATION).withTags(tags()));
        }
        return ready(existing);
    }

    private Outcome<TopicDescriptor> ready(TopicDescriptor descriptor) {
        result = Outcome.ok(descriptor);
        moveTo(ProvisioningState.READY);
        return result;
    }

    private Outcome<TopicDescriptor> fail(Failure failure) {
        result = Outcome.fail(failure);
        moveTo(ProvisioningState.FAILED);
        return result;
    }

    private Failure vanished(Failure notFound) {
        return new Failure(
                FailureId.of("provisioning", "topic_vanished"),
                "Topic '" + desired.name() + "' was reported as existing but disappeared before it could be fetched",
                FailureType.TRANSIENT,
                null,
                null,
                OPERATION,
                Instant.now(),
                tags(),
                notFound);
    }

    private Map<String, String> tags() {
        return Map.of("topic", desired.name(), "partitioning", String.valueOf(desired.partitioningEnabled()));
    }

    private void moveTo(ProvisioningState next) {
        ProvisioningState previous = state;
        state = next;
        reporter.reportTransition(desired.name(), previous, next);
    }
}
