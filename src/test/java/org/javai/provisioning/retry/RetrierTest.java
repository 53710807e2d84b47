package org.javai.provisioning.retry;

import org.javai.provisioning.*;
import org.javai.provisioning.boundary.Boundary;
import org.javai.provisioning.boundary.ExistenceCheckFailureClassifier;
import org.javai.provisioning.ops.OpReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class RetrierTest {

    private List<Failure> reportedFailures;
    private List<RetryAttempt> reportedRetries;
    private List<RetryExhausted> reportedExhausted;
    private List<Failure> reportedCancellations;
    private List<Duration> sleeps;
    private OpReporter reporter;
    private Retrier.Sleeper recordingSleeper;

    record RetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {}
    record RetryExhausted(Failure failure, int totalAttempts, String policyId) {}

    @BeforeEach
    void setUp() {
        reportedFailures = new ArrayList<>();
        reportedRetries = new ArrayList<>();
        reportedExhausted = new ArrayList<>();
        reportedCancellations = new ArrayList<>();
        sleeps = new ArrayList<>();

        reporter = new OpReporter() {
            @Override
            public void report(Failure failure) {
                reportedFailures.add(failure);
            }

            @Override
            public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
                reportedRetries.add(new RetryAttempt(failure, attemptNumber, delay, policyId));
            }

            @Override
            public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
                reportedExhausted.add(new RetryExhausted(failure, totalAttempts, policyId));
            }

            @Override
            public void reportCancelled(Failure failure, int totalAttempts, String policyId) {
                reportedCancellations.add(failure);
            }
        };

        // Record delays instead of sleeping
        recordingSleeper = (delay, token) -> {
            sleeps.add(delay);
            return false;
        };
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private Retrier retrier(RetryPolicyConfig config) {
        return Retrier.builder()
                .policy(config.toPolicy("test"))
                .reporter(reporter)
                .sleeper(recordingSleeper)
                .build();
    }

    @Test
    void execute_success_returnsOkWithoutRetry() {
        Retrier retrier = retrier(RetryPolicyConfig.existenceCheckDefaults());

        Outcome<String> result = retrier.execute("Op", () -> Outcome.ok("success"));

        assertThat(result.getOrThrow()).isEqualTo("success");
        assertThat(reportedRetries).isEmpty();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void execute_transientEveryTime_invokesExactlyMaxAttemptsThenSurfacesLastFailure() {
        Retrier retrier = retrier(new RetryPolicyConfig(5, Duration.ofMillis(100), Duration.ofSeconds(2)));
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String> result = retrier.execute("Op", () ->
                Outcome.fail(transientFailure("attempt " + attempts.incrementAndGet())));

        assertThat(attempts.get()).isEqualTo(5);
        assertThat(result).isInstanceOf(Outcome.Fail.class);
        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.TRANSIENT);
        assertThat(failure.message()).isEqualTo("attempt 5");
        assertThat(reportedRetries).hasSize(4);
        assertThat(reportedExhausted).singleElement()
                .satisfies(e -> assertThat(e.totalAttempts()).isEqualTo(5));
    }

    @Test
    void execute_succeedsOnFourthAttempt_returnsSuccess() {
        Retrier retrier = retrier(new RetryPolicyConfig(5, Duration.ofMillis(100), Duration.ofSeconds(2)));
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String> result = retrier.execute("Op", () -> attempts.incrementAndGet() < 4
                ? Outcome.fail(transientFailure("not yet"))
                : Outcome.ok("created"));

        assertThat(result.getOrThrow()).isEqualTo("created");
        assertThat(attempts.get()).isEqualTo(4);
        assertThat(reportedExhausted).isEmpty();
    }

    @Test
    void execute_delaysDoubleAndAreCappedAtMaxBackoff() {
        Retrier retrier = retrier(new RetryPolicyConfig(6, Duration.ofMillis(100), Duration.ofMillis(500)));

        retrier.execute("Op", () -> Outcome.fail(transientFailure("busy")));

        assertThat(sleeps).containsExactly(
                Duration.ofMillis(100),
                Duration.ofMillis(200),
                Duration.ofMillis(400),
                Duration.ofMillis(500),
                Duration.ofMillis(500));
        assertThat(reportedRetries).extracting(RetryAttempt::attemptNumber).containsExactly(1, 2, 3, 4, 5);
        assertThat(reportedRetries).extracting(RetryAttempt::policyId).containsOnly("test");
    }

    @Test
    void execute_retryAfterHint_lengthensDelayButNotBeyondMax() {
        Retrier retrier = retrier(new RetryPolicyConfig(3, Duration.ofMillis(100), Duration.ofSeconds(2)));
        AtomicInteger attempts = new AtomicInteger();

        retrier.execute("Op", () -> {
            Duration hint = attempts.incrementAndGet() == 1 ? Duration.ofMillis(700) : Duration.ofSeconds(30);
            return Outcome.fail(withRetryAfter(transientFailure("busy"), hint));
        });

        assertThat(sleeps).containsExactly(Duration.ofMillis(700), Duration.ofSeconds(2));
    }

    @Test
    void execute_permanentFailure_returnedAfterOneAttemptWithoutExhaustionReport() {
        Retrier retrier = retrier(RetryPolicyConfig.creationDefaults());
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String> result = retrier.execute("Op", () -> {
            attempts.incrementAndGet();
            return Outcome.fail(Failure.permanentFailure(FailureId.of("backend", "unauthorized"), "denied", "Op", null));
        });

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(((Outcome.Fail<String>) result).is(FailureType.PERMANENT)).isTrue();
        assertThat(reportedRetries).isEmpty();
        assertThat(reportedExhausted).isEmpty();
    }

    @Test
    void execute_structuralSignal_passesThroughUnchanged() {
        Retrier retrier = retrier(RetryPolicyConfig.existenceCheckDefaults());
        Failure notFound = new Failure(FailureId.of("backend", "entity_not_found"), "missing",
                FailureType.ENTITY_NOT_FOUND, null, null, "Op", Instant.now(), null, null);
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String> result = retrier.execute("Op", () -> {
            attempts.incrementAndGet();
            return Outcome.fail(notFound);
        });

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(((Outcome.Fail<String>) result).failure()).isSameAs(notFound);
    }

    @Test
    void execute_tokenAlreadyCancelled_makesNoAttempt() {
        Retrier retrier = retrier(RetryPolicyConfig.creationDefaults());
        CancellationToken token = CancellationToken.create();
        token.cancel("shutting down");
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String> result = retrier.execute("Op", () -> {
            attempts.incrementAndGet();
            return Outcome.ok("never");
        }, token);

        assertThat(attempts.get()).isZero();
        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.CANCELLED);
        assertThat(failure.message()).contains("shutting down");
        assertThat(reportedCancellations).hasSize(1);
    }

    @Test
    void execute_cancelledDuringBackoff_returnsCancelledWithLastFailureAsCause() {
        CancellationToken token = CancellationToken.create();
        Retrier retrier = Retrier.builder()
                .policy(RetryPolicyConfig.creationDefaults().toPolicy("test"))
                .reporter(reporter)
                .sleeper((delay, t) -> {
                    t.cancel("stop");
                    return true;
                })
                .build();

        Outcome<String> result = retrier.execute("Op", () -> Outcome.fail(transientFailure("busy")), token);

        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.CANCELLED);
        assertThat(failure.message()).isEqualTo("stop");
        assertThat(failure.cause()).isNotNull();
        assertThat(failure.cause().message()).isEqualTo("busy");
        assertThat(reportedExhausted).isEmpty();
    }

    @Test
    void execute_cancelFromAnotherThread_wakesRealBackoffWait() throws Exception {
        CancellationToken token = CancellationToken.create();
        Retrier retrier = Retrier.builder()
                .policy(new RetryPolicyConfig(RetryPolicyConfig.UNBOUNDED, Duration.ofMinutes(1), Duration.ofMinutes(1)).toPolicy("test"))
                .reporter(reporter)
                .build();
        CountDownLatch firstAttempt = new CountDownLatch(1);
        AtomicReference<Outcome<String>> result = new AtomicReference<>();

        Thread worker = new Thread(() -> result.set(retrier.execute("Op", () -> {
            firstAttempt.countDown();
            return Outcome.fail(transientFailure("busy"));
        }, token)));
        worker.start();

        assertThat(firstAttempt.await(5, TimeUnit.SECONDS)).isTrue();
        token.cancel("shutdown");
        worker.join(5_000);

        assertThat(worker.isAlive()).isFalse();
        assertThat(((Outcome.Fail<String>) result.get()).is(FailureType.CANCELLED)).isTrue();
    }

    @Test
    void execute_budgetShorterThanNextDelay_returnsCancelled() {
        Retrier retrier = Retrier.builder()
                .policy(new RetryPolicyConfig(RetryPolicyConfig.UNBOUNDED, Duration.ofSeconds(10), Duration.ofSeconds(10)).toPolicy("test"))
                .reporter(reporter)
                .budget(Duration.ofSeconds(1))
                .sleeper(recordingSleeper)
                .build();
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String> result = retrier.execute("Op", () -> {
            attempts.incrementAndGet();
            return Outcome.fail(transientFailure("busy"));
        });

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.CANCELLED);
        assertThat(failure.message()).contains("budget");
    }

    @Test
    void execute_interruptedWhileWaiting_returnsCancelledAndRestoresInterruptFlag() {
        Retrier retrier = Retrier.builder()
                .policy(RetryPolicyConfig.creationDefaults().toPolicy("test"))
                .reporter(reporter)
                .sleeper((delay, token) -> {
                    throw new InterruptedException();
                })
                .build();

        Outcome<String> result = retrier.execute("Op", () -> Outcome.fail(transientFailure("busy")));

        assertThat(((Outcome.Fail<String>) result).is(FailureType.CANCELLED)).isTrue();
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void execute_withBoundary_classifiesCheckedExceptions() {
        Retrier retrier = retrier(new RetryPolicyConfig(3, Duration.ofMillis(10), Duration.ofMillis(10)));
        Boundary boundary = Boundary.of(new ExistenceCheckFailureClassifier(), reporter);
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String> result = retrier.execute("Op", boundary, () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("reset");
            }
            return "done";
        }, CancellationToken.none());

        assertThat(result.getOrThrow()).isEqualTo("done");
        assertThat(reportedFailures).hasSize(2);
    }

    @Test
    void builder_requiresPolicy() {
        assertThatThrownBy(() -> Retrier.builder().build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void builder_rejectsNonPositiveBudget() {
        assertThatThrownBy(() -> Retrier.builder().budget(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Failure transientFailure(String message) {
        return Failure.transientFailure(FailureId.of("backend", "timeout"), message, "Op", null);
    }

    private static Failure withRetryAfter(Failure f, Duration retryAfter) {
        return new Failure(f.id(), f.message(), f.type(), f.exception(), retryAfter,
                f.operation(), f.occurredAt(), f.tags(), f.cause());
    }
}
