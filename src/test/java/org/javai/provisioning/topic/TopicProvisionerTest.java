package org.javai.provisioning.topic;

import org.javai.provisioning.*;
import org.javai.provisioning.backend.BackendTimeoutException;
import org.javai.provisioning.backend.CommunicationException;
import org.javai.provisioning.backend.FakeTopicAdmin;
import org.javai.provisioning.backend.ServerBusyException;
import org.javai.provisioning.backend.UnauthorizedException;
import org.javai.provisioning.ops.OpReporter;
import org.javai.provisioning.retry.RetryPolicyConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.javai.provisioning.topic.ProvisioningState.*;

class TopicProvisionerTest {

    private FakeTopicAdmin admin;
    private List<ProvisioningState> transitions;
    private List<Failure> reportedFailures;
    private TopicProvisioner provisioner;

    @BeforeEach
    void setUp() {
        admin = new FakeTopicAdmin();
        transitions = Collections.synchronizedList(new ArrayList<>());
        reportedFailures = Collections.synchronizedList(new ArrayList<>());
        provisioner = provisionerFor(admin);
    }

    private TopicProvisioner provisionerFor(FakeTopicAdmin backend) {
        OpReporter reporter = new OpReporter() {
            @Override
            public void report(Failure failure) {
                reportedFailures.add(failure);
            }

            @Override
            public void reportTransition(String topicName, ProvisioningState from, ProvisioningState to) {
                transitions.add(to);
            }
        };
        return TopicProvisioner.builder(backend)
                .reporter(reporter)
                .sleeper((delay, token) -> false)
                .build();
    }

    @Test
    void missingTopic_isCreatedWithRequestedPartitioning() {
        TopicDescriptor topic = provisioner.ensureTopic("orders", false);

        assertThat(topic).isEqualTo(TopicDescriptor.of("orders", false));
        assertThat(admin.topic("orders")).isEqualTo(TopicDescriptor.of("orders", false));
        assertThat(admin.successfulCreates()).isEqualTo(1);
        assertThat(transitions).containsExactly(CHECKING, NOT_FOUND, CREATING, CREATED, READY);
    }

    @Test
    void notFound_isReportedAsStructuralSignalNotAsError() {
        provisioner.ensureTopic("orders", false);

        assertThat(reportedFailures).singleElement()
                .satisfies(f -> assertThat(f.type()).isEqualTo(FailureType.ENTITY_NOT_FOUND));
        assertThat(admin.getCalls()).isEqualTo(1);
    }

    @Test
    void existingMatchingTopic_isReadyWithoutCreate() {
        admin.withTopic("orders", false);

        TopicDescriptor topic = provisioner.ensureTopic("orders", false);

        assertThat(topic.name()).isEqualTo("orders");
        assertThat(admin.createCalls()).isZero();
        assertThat(transitions).containsExactly(CHECKING, FOUND, READY);
    }

    @Test
    void secondCall_isIdempotent() {
        provisioner.ensureTopic("orders", true);
        provisioner.ensureTopic("orders", true);

        assertThat(admin.createCalls()).isEqualTo(1);
        assertThat(admin.topic("orders").partitioningEnabled()).isTrue();
    }

    @Test
    void existingUnpartitionedTopic_requestedPartitioned_isInvariantViolation() {
        admin.withTopic("orders", false);

        Outcome<TopicDescriptor> result = provisioner.provision("orders", true);

        Failure failure = ((Outcome.Fail<TopicDescriptor>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.INVARIANT_VIOLATION);
        assertThat(failure.id()).isEqualTo(FailureId.of("provisioning", "partitioning_mismatch"));
        assertThat(failure.message()).contains("EnablePartitioning", "orders");
        assertThat(failure.tags()).containsEntry("topic", "orders");
        assertThat(admin.createCalls()).isZero();
        assertThat(transitions).containsExactly(CHECKING, FOUND, FAILED);
    }

    @Test
    void ensureTopic_throwsOnInvariantViolation() {
        admin.withTopic("orders", false);

        assertThatThrownBy(() -> provisioner.ensureTopic("orders", true))
                .isInstanceOf(OutcomeFailedException.class)
                .satisfies(e -> assertThat(((OutcomeFailedException) e).type()).isEqualTo(FailureType.INVARIANT_VIOLATION));
    }

    @Test
    void existingPartitionedTopic_satisfiesUnpartitionedRequest() {
        admin.withTopic("orders", true);

        TopicDescriptor topic = provisioner.ensureTopic("orders", false);

        assertThat(topic.partitioningEnabled()).isTrue();
        assertThat(admin.createCalls()).isZero();
    }

    @Test
    void transientLookupFailures_areRetriedThenSucceed() {
        admin.withTopic("orders", false)
                .failGets(new BackendTimeoutException("orders", "slow"), new CommunicationException("orders", "reset"));

        TopicDescriptor topic = provisioner.ensureTopic("orders", false);

        assertThat(topic.name()).isEqualTo("orders");
        assertThat(admin.getCalls()).isEqualTo(3);
    }

    @Test
    void lookupStillFailingAfterFiveAttempts_surfacesTransientFailure() {
        for (int i = 0; i < 5; i++) {
            admin.failGets(new BackendTimeoutException("orders", "slow " + i));
        }

        Outcome<TopicDescriptor> result = provisioner.provision("orders", false);

        Failure failure = ((Outcome.Fail<TopicDescriptor>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.TRANSIENT);
        assertThat(failure.message()).contains("slow 4");
        assertThat(admin.getCalls()).isEqualTo(5);
        assertThat(admin.createCalls()).isZero();
    }

    @Test
    void transientCreateFailures_areRetriedUntilCreated() {
        admin.failCreates(
                new ServerBusyException("orders", "throttled", Duration.ofSeconds(1)),
                new CommunicationException("orders", "reset"),
                new BackendTimeoutException("orders", "slow"));

        TopicDescriptor topic = provisioner.ensureTopic("orders", false);

        assertThat(topic.name()).isEqualTo("orders");
        assertThat(admin.createCalls()).isEqualTo(4);
        assertThat(admin.successfulCreates()).isEqualTo(1);
    }

    @Test
    void permanentCreateFailure_isNotRetried() {
        admin.failCreates(new UnauthorizedException("orders", "Manage claim required"));

        Outcome<TopicDescriptor> result = provisioner.provision("orders", false);

        assertThat(((Outcome.Fail<TopicDescriptor>) result).is(FailureType.PERMANENT)).isTrue();
        assertThat(admin.createCalls()).isEqualTo(1);
        assertThat(transitions).endsWith(CREATING, FAILED);
    }

    @Test
    void lostCreationRace_refetchesWinnersTopic() {
        FakeTopicAdmin backend = new FakeTopicAdmin();
        backend.beforeCreate(() -> backend.withTopic("orders", false));
        TopicProvisioner racing = provisionerFor(backend);

        TopicDescriptor topic = racing.ensureTopic("orders", false);

        assertThat(topic).isEqualTo(TopicDescriptor.of("orders", false));
        assertThat(backend.successfulCreates()).isZero();
        assertThat(backend.getCalls()).isEqualTo(2);
        assertThat(transitions).containsExactly(CHECKING, NOT_FOUND, CREATING, CONFLICT_EXISTS, READY);
    }

    @Test
    void lostCreationRace_toIncompatibleTopic_isInvariantViolation() {
        FakeTopicAdmin backend = new FakeTopicAdmin();
        backend.beforeCreate(() -> backend.withTopic("orders", false));
        TopicProvisioner racing = provisionerFor(backend);

        Outcome<TopicDescriptor> result = racing.provision("orders", true);

        assertThat(((Outcome.Fail<TopicDescriptor>) result).is(FailureType.INVARIANT_VIOLATION)).isTrue();
        assertThat(transitions).endsWith(CONFLICT_EXISTS, FAILED);
    }

    @Test
    void topicVanishingAfterConflict_isTransientFailure() {
        FakeTopicAdmin backend = new FakeTopicAdmin();
        backend.beforeCreate(() -> backend.withTopic("orders", false));
        backend.forgetTopicsOnConflict();
        TopicProvisioner racing = provisionerFor(backend);

        Outcome<TopicDescriptor> result = racing.provision("orders", false);

        Failure failure = ((Outcome.Fail<TopicDescriptor>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.TRANSIENT);
        assertThat(failure.id()).isEqualTo(FailureId.of("provisioning", "topic_vanished"));
        assertThat(failure.cause().type()).isEqualTo(FailureType.ENTITY_NOT_FOUND);
    }

    @Test
    void concurrentProvisioners_createTopicExactlyOnce() throws Exception {
        int processes = 8;
        CyclicBarrier start = new CyclicBarrier(processes);
        ExecutorService pool = Executors.newFixedThreadPool(processes);
        try {
            List<Future<TopicDescriptor>> results = new ArrayList<>();
            for (int i = 0; i < processes; i++) {
                TopicProvisioner process = provisionerFor(admin);
                results.add(pool.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    return process.ensureTopic("orders", true);
                }));
            }
            for (Future<TopicDescriptor> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo(TopicDescriptor.of("orders", true));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(admin.successfulCreates()).isEqualTo(1);
    }

    @Test
    void cancelledToken_stopsProvisioning() {
        CancellationToken token = CancellationToken.create();
        token.cancel("shutting down");

        Outcome<TopicDescriptor> result = provisioner.provision("orders", false, token);

        assertThat(((Outcome.Fail<TopicDescriptor>) result).is(FailureType.CANCELLED)).isTrue();
        assertThat(admin.getCalls()).isZero();
        assertThat(transitions).containsExactly(CHECKING, FAILED);
    }

    @Test
    void creationBudget_boundsUnlimitedCreateRetries() {
        admin.failCreates(new CommunicationException("orders", "reset"));
        TopicProvisioner bounded = TopicProvisioner.builder(admin)
                .creationPolicy(new RetryPolicyConfig(RetryPolicyConfig.UNBOUNDED, Duration.ofSeconds(30), Duration.ofSeconds(30)))
                .creationBudget(Duration.ofSeconds(1))
                .sleeper((delay, token) -> false)
                .build();

        Outcome<TopicDescriptor> result = bounded.provision("orders", false);

        assertThat(((Outcome.Fail<TopicDescriptor>) result).is(FailureType.CANCELLED)).isTrue();
        assertThat(admin.createCalls()).isEqualTo(1);
    }

    @Test
    void run_isSingleUse() {
        ProvisioningRun run = provisioner.newRun(TopicDescriptor.of("orders", false), CancellationToken.none());

        Outcome<TopicDescriptor> result = run.run();

        assertThat(run.state()).isEqualTo(READY);
        assertThat(run.state().isTerminal()).isTrue();
        assertThat(run.result()).isSameAs(result);
        assertThatThrownBy(run::run)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already started");
    }

    @Test
    void newRun_startsUnknown() {
        ProvisioningRun run = provisioner.newRun(TopicDescriptor.of("orders", false), CancellationToken.none());

        assertThat(run.state()).isEqualTo(UNKNOWN);
        assertThat(run.result()).isNull();
        assertThat(admin.getCalls()).isZero();
    }

    @Test
    void defectInBackend_propagates() {
        FakeTopicAdmin buggy = new FakeTopicAdmin() {
            @Override
            public TopicDescriptor getTopic(String name) {
                throw new IllegalStateException("bug");
            }
        };
        TopicProvisioner broken = provisionerFor(buggy);

        assertThatThrownBy(() -> broken.ensureTopic("orders", false))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("bug");
    }
}
