package org.javai.provisioning;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a backend call or a provisioning run: {@link Ok} with a value or {@link Fail} with a {@link Failure}.
 *
 * <p>Retry policies and the provisioning state machine branch on {@link Failure#type()} of a {@code Fail};
 * they never inspect exceptions.</p>
 *
 * @param <T> type carried on success
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return Outcome.ok(Objects.requireNonNull(mapper, "mapper").apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return Objects.requireNonNull(mapper, "mapper").apply(value);
        }
    }

    record Fail<T>(Failure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        /**
         * @throws OutcomeFailedException always, carrying this failure
         */
        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return retype();
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return retype();
        }

        public boolean is(FailureType type) {
            return failure.type() == type;
        }

        private <U> Fail<U> retype() {
            return new Fail<>(failure);
        }
    }

    boolean isOk();

    default boolean isFail() {
        return !isOk();
    }

    /** The value of an {@code Ok}; a {@code Fail} throws {@link OutcomeFailedException}. */
    T getOrThrow();

    T getOrElse(T defaultValue);

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }
}
