package com.ayende.backend.core.result;

import java.util.Map;
import java.util.function.Function;

/**
 * Outcome of a state-changing operation: either the value, or a {@link ValidationError}
 * with a human readable message and optional structured details (e.g. the point shortfall).
 */
public record OperationResult<T>(T value, ValidationError error, String message, Map<String, Object> details) {

    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(value, null, null, Map.of());
    }

    public static <T> OperationResult<T> denied(ValidationError error, String message) {
        return new OperationResult<>(null, error, message, Map.of());
    }

    public static <T> OperationResult<T> denied(ValidationError error, String message, Map<String, Object> details) {
        return new OperationResult<>(null, error, message, details);
    }

    public boolean isOk() {
        return error == null;
    }

    public <R> OperationResult<R> map(Function<T, R> mapper) {
        if (!isOk()) {
            return new OperationResult<>(null, error, message, details);
        }
        return ok(mapper.apply(value));
    }
}
