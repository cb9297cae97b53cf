package com.meteoharvest.core.result;

import com.meteoharvest.core.error.IngestionException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of one unit of ingestion work. Callers branch on the variant instead of catching.
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(IngestionException error) {
        return new Failure<>(error);
    }

    <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper);

    record Success<T>(T value) implements Outcome<T> {
        public Success {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
            return mapper.apply(value);
        }
    }

    record Failure<T>(IngestionException error) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(error, "error is required");
        }

        @Override
        public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
            return new Failure<>(error);
        }
    }
}
