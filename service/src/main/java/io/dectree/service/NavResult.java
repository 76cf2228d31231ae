// file: service/src/main/java/io/dectree/service/NavResult.java
package io.dectree.service;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a navigation, lookup or analysis call.
 * <p>
 * Expected failures (unknown name, no current node, ...) are values, not
 * exceptions, so front ends can render them without try/catch.
 */
public sealed interface NavResult<T> permits NavResult.Ok, NavResult.Failure {

    record Ok<T>(T value) implements NavResult<T> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failure<T>(ErrorKind kind, String message) implements NavResult<T> {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }
    }

    static <T> NavResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> NavResult<T> failure(ErrorKind kind, String message) {
        return new Failure<>(kind, message);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    /** Success value; throws IllegalStateException on a failure. */
    default T value() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        Failure<T> f = (Failure<T>) this;
        throw new IllegalStateException(f.kind() + ": " + f.message());
    }

    /** Error kind of a failure, or null on success. */
    default ErrorKind errorKind() {
        return this instanceof Failure<T> f ? f.kind() : null;
    }

    default <U> NavResult<U> map(Function<? super T, ? extends U> fn) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(fn.apply(ok.value()));
        }
        Failure<T> f = (Failure<T>) this;
        return new Failure<>(f.kind(), f.message());
    }
}
