package com.dbbaskette.codeguardian.service.result;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a service operation: either a value or a {@link ServiceError}, never both.
 */
public record OperationResult<T>(T value, ServiceError error) {

    public OperationResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value or error must be set");
        }
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> OperationResult<T> failure(ErrorKind kind, String message, Map<String, String> details) {
        return new OperationResult<>(null, new ServiceError(kind, message, details));
    }

    public static <T> OperationResult<T> validation(String message, String field) {
        return failure(ErrorKind.VALIDATION, message, field == null ? Map.of() : Map.of("field", field));
    }

    public static <T> OperationResult<T> notFound(String resourceType, Object resourceId) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("resource_type", resourceType);
        String message;
        if (resourceId != null) {
            details.put("resource_id", String.valueOf(resourceId));
            message = resourceType + " with ID " + resourceId + " not found";
        } else {
            message = resourceType + " not found";
        }
        return failure(ErrorKind.NOT_FOUND, message, details);
    }

    public static <T> OperationResult<T> conflict(String message) {
        return failure(ErrorKind.CONFLICT, message, Map.of());
    }

    public static <T> OperationResult<T> externalService(String serviceName, String message) {
        return failure(ErrorKind.EXTERNAL_SERVICE, message, Map.of("service", serviceName));
    }

    public static <T> OperationResult<T> internal(String message) {
        return failure(ErrorKind.INTERNAL, message, Map.of());
    }

    public boolean isSuccess() {
        return error == null;
    }

    public ErrorKind errorKind() {
        return error == null ? null : error.kind();
    }

    public <U> OperationResult<U> map(Function<? super T, ? extends U> mapper) {
        if (!isSuccess()) {
            return new OperationResult<>(null, error);
        }
        return success(mapper.apply(value));
    }

    public <U> OperationResult<U> flatMap(Function<? super T, OperationResult<U>> mapper) {
        if (!isSuccess()) {
            return new OperationResult<>(null, error);
        }
        return mapper.apply(value);
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T orElseThrow() {
        if (!isSuccess()) {
            throw new IllegalStateException(error.kind() + ": " + error.message());
        }
        return value;
    }
}
