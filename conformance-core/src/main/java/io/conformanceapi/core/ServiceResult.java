package io.conformanceapi.core;

import java.util.Objects;

/**
 * Value-or-error union returned by every API operation.
 *
 * <p>On the wire a result is {@code {"value": ...}} or {@code {"error": {...}}}. A {@link Value} holding
 * {@code null} is representable so that a broken implementation can be detected downstream; it is never a
 * valid result.
 *
 * @param <T> the success payload type
 */
public sealed interface ServiceResult<T> permits ServiceResult.Value, ServiceResult.Failure {

    static <T> ServiceResult<T> value(T value) {
        return new Value<>(value);
    }

    static <T> ServiceResult<T> failure(ServiceError error) {
        return new Failure<>(error);
    }

    static <T> ServiceResult<T> failure(String code, String message) {
        return new Failure<>(ServiceError.of(code, message));
    }

    /** Success arm. */
    record Value<T>(T value) implements ServiceResult<T> {}

    /** Error arm. */
    record Failure<T>(ServiceError error) implements ServiceResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }
}
