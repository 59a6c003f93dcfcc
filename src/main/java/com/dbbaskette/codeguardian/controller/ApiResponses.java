package com.dbbaskette.codeguardian.controller;

import com.dbbaskette.codeguardian.config.WebConfig;
import com.dbbaskette.codeguardian.service.result.ErrorKind;
import com.dbbaskette.codeguardian.service.result.OperationResult;
import com.dbbaskette.codeguardian.service.result.ServiceError;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps {@link OperationResult}s onto HTTP responses.
 */
final class ApiResponses {

    private ApiResponses() {}

    static <T> ResponseEntity<ApiResponse<T>> from(OperationResult<T> result, HttpStatus successStatus,
                                                   Function<T, String> message) {
        if (result.isSuccess()) {
            return ResponseEntity.status(successStatus)
                    .body(ApiResponse.ok(result.value(), message.apply(result.value())));
        }
        return error(result.error());
    }

    static <T> ResponseEntity<ApiResponse<T>> from(OperationResult<T> result, String message) {
        return from(result, HttpStatus.OK, value -> message);
    }

    static <T> ResponseEntity<ApiResponse<T>> error(ServiceError error) {
        Map<String, String> details = new LinkedHashMap<>(error.details());
        if (error.kind() == ErrorKind.INTERNAL) {
            String correlationId = MDC.get(WebConfig.CORRELATION_MDC_KEY);
            if (correlationId != null) {
                details.put("correlation_id", correlationId);
            }
        }
        return ResponseEntity.status(status(error.kind()))
                .body(ApiResponse.error(error.kind().code(), error.message(), details));
    }

    static HttpStatus status(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case EXTERNAL_SERVICE -> HttpStatus.BAD_GATEWAY;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
