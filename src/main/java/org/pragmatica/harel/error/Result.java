package org.pragmatica.harel.error;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a fallible operation: either a value or the {@link Cause} of the failure.
 *
 * <p>Lexing, parsing and validation report expected failures through this type instead of exceptions.
 * <pre>{@code
 * var chart = StatechartParser.parse(source)
 *                             .flatMap(parsed -> Validator.validate(parsed).toResult());
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Cause cause) {
        return new Failure<>(cause);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Apply one of the mappers depending on the outcome.
     */
    <R> R fold(Function<? super Cause, ? extends R> failureMapper, Function<? super T, ? extends R> successMapper);

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return fold(Result::<R>failure, value -> Result.<R>success(mapper.apply(value)));
    }

    default <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        return fold(Result::<R>failure, mapper);
    }

    default Result<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<T> onFailure(Consumer<? super Cause> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.cause());
        }
        return this;
    }

    /**
     * Value of a successful result.
     *
     * @throws IllegalStateException if the result is a failure
     */
    default T unwrap() {
        return fold(cause -> {
                        throw new IllegalStateException("Unwrap of failed result: " + cause.message());
                    },
                    value -> value);
    }

    /**
     * Cause of a failed result.
     *
     * @throws IllegalStateException if the result is a success
     */
    default Cause cause() {
        return fold(cause -> cause,
                    value -> {
                        throw new IllegalStateException("Successful result has no cause");
                    });
    }

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> failureMapper, Function<? super T, ? extends R> successMapper) {
            return successMapper.apply(value);
        }
    }

    record Failure<T>(Cause cause) implements Result<T> {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> failureMapper, Function<? super T, ? extends R> successMapper) {
            return failureMapper.apply(cause);
        }
    }
}
