package org.javai.provisioning.topic;

import org.javai.provisioning.CancellationToken;
import org.javai.provisioning.Outcome;
import org.javai.provisioning.OutcomeFailedException;
import org.javai.provisioning.TopicDescriptor;
import org.javai.provisioning.backend.TopicAdmin;
import org.javai.provisioning.boundary.Boundary;
import org.javai.provisioning.boundary.CreationFailureClassifier;
import org.javai.provisioning.boundary.ExistenceCheckFailureClassifier;
import org.javai.provisioning.boundary.FailureClassifier;
import org.javai.provisioning.ops.OpReporter;
import org.javai.provisioning.retry.Retrier;
import org.javai.provisioning.retry.RetryPolicyConfig;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Makes sure a topic exists with the requested partitioning, creating it at most once
 * across any number of concurrently starting processes.
 *
 * <p>Lookups and creation run through separately configured {@link Retrier}s: lookups
 * are short-lived probes with a small attempt ceiling, creation keeps trying for much
 * longer but is bounded by a time budget and by the caller's {@link CancellationToken}.</p>
 *
 * <pre>{@code
 * TopicProvisioner provisioner = TopicProvisioner.builder(admin)
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * TopicDescriptor topic = provisioner.ensureTopic("orders", false);
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe; each call starts a fresh {@link ProvisioningRun}.</p>
 */
public final class TopicProvisioner {

    static final String GET_TOPIC = "TopicAdmin.getTopic";
    static final String CREATE_TOPIC = "TopicAdmin.createTopic";

    public static final Duration DEFAULT_CREATION_BUDGET = Duration.ofMinutes(10);

    private final TopicAdmin admin;
    private final Boundary existenceBoundary;
    private final Boundary creationBoundary;
    private final Retrier existenceRetrier;
    private final Retrier creationRetrier;
    private final OpReporter reporter;

    private TopicProvisioner(Builder builder) {
        this.admin = builder.admin;
        this.reporter = builder.reporter;
        this.existenceBoundary = Boundary.of(builder.existenceClassifier, reporter);
        this.creationBoundary = Boundary.of(builder.creationClassifier, reporter);
        this.existenceRetrier = Retrier.builder()
                .policy(builder.existencePolicy.toPolicy("topic-existence"))
                .reporter(reporter)
                .sleeper(builder.sleeper)
                .build();
        this.creationRetrier = Retrier.builder()
                .policy(builder.creationPolicy.toPolicy("topic-creation"))
                .reporter(reporter)
                .budget(builder.creationBudget)
                .sleeper(builder.sleeper)
                .build();
    }

    public static Builder builder(TopicAdmin admin) {
        return new Builder(admin);
    }

    /**
     * Builder for a {@link TopicProvisioner}. Only the backend is required.
     */
    public static final class Builder {
        private final TopicAdmin admin;
        private RetryPolicyConfig existencePolicy = RetryPolicyConfig.existenceCheckDefaults();
        private RetryPolicyConfig creationPolicy = RetryPolicyConfig.creationDefaults();
        private Duration creationBudget = DEFAULT_CREATION_BUDGET;
        private FailureClassifier existenceClassifier = new ExistenceCheckFailureClassifier();
        private FailureClassifier creationClassifier = new CreationFailureClassifier();
        private OpReporter reporter = OpReporter.noOp();
        private Retrier.Sleeper sleeper = Retrier.Sleeper.onToken();

        private Builder(TopicAdmin admin) {
            this.admin = Objects.requireNonNull(admin, "admin must not be null");
        }

        public Builder existencePolicy(RetryPolicyConfig config) {
            this.existencePolicy = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder creationPolicy(RetryPolicyConfig config) {
            this.creationPolicy = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Upper bound on the time spent retrying creation (default 10 minutes).
         */
        public Builder creationBudget(Duration budget) {
            this.creationBudget = Objects.requireNonNull(budget, "budget must not be null");
            return this;
        }

        public Builder existenceClassifier(FailureClassifier classifier) {
            this.existenceClassifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder creationClassifier(FailureClassifier classifier) {
            this.creationClassifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder sleeper(Retrier.Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public TopicProvisioner build() {
            return new TopicProvisioner(this);
        }
    }

    /**
     * Provisions the topic and returns the resolved descriptor.
     *
     * @throws OutcomeFailedException carrying a {@code PERMANENT}, {@code INVARIANT_VIOLATION},
     *         exhausted {@code TRANSIENT} or {@code CANCELLED} failure
     */
    public TopicDescriptor ensureTopic(String name, boolean enablePartitioning) {
        return ensureTopic(name, enablePartitioning, CancellationToken.none());
    }

    public TopicDescriptor ensureTopic(String name, boolean enablePartitioning, CancellationToken token) {
        return provision(name, enablePartitioning, token).getOrThrow();
    }

    public Outcome<TopicDescriptor> provision(String name, boolean enablePartitioning) {
        return provision(name, enablePartitioning, CancellationToken.none());
    }

    /**
     * Provisions the topic without throwing for operational failures.
     */
    public Outcome<TopicDescriptor> provision(String name, boolean enablePartitioning, CancellationToken token) {
        return newRun(TopicDescriptor.of(name, enablePartitioning), token).run();
    }

    /**
     * Creates a run that has not started yet, for callers that want to observe its state.
     */
    public ProvisioningRun newRun(TopicDescriptor desired, CancellationToken token) {
        return new ProvisioningRun(this, desired, token, reporter);
    }

    Outcome<TopicDescriptor> lookup(String name, CancellationToken token) {
        return existenceRetrier.execute(GET_TOPIC,
                () -> existenceBoundary.call(GET_TOPIC, Map.of("topic", name), () -> admin.getTopic(name)),
                token);
    }

    Outcome<TopicDescriptor> create(TopicDescriptor desired, CancellationToken token) {
        return creationRetrier.execute(CREATE_TOPIC,
                () -> creationBoundary.call(CREATE_TOPIC, Map.of("topic", desired.name()), () -> admin.createTopic(desired)),
                token);
    }
}
