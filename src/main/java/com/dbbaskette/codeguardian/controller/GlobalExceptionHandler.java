package com.dbbaskette.codeguardian.controller;

import com.dbbaskette.codeguardian.config.WebConfig;
import com.dbbaskette.codeguardian.service.result.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "Invalid request";
        Map<String, String> details = fieldError != null ? Map.of("field", fieldError.getField()) : Map.of();
        return respond(ErrorKind.VALIDATION, message, details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return respond(ErrorKind.VALIDATION, "Request body is missing or malformed", Map.of());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return respond(ErrorKind.VALIDATION, "Invalid value for " + e.getName(), Map.of("field", e.getName()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResource(NoResourceFoundException e) {
        return respond(ErrorKind.NOT_FOUND, "Resource not found", Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneral(Exception e) {
        String correlationId = MDC.get(WebConfig.CORRELATION_MDC_KEY);
        log.error("Unhandled exception [correlationId={}]", correlationId, e);
        Map<String, String> details = correlationId != null ? Map.of("correlation_id", correlationId) : Map.of();
        return respond(ErrorKind.INTERNAL, "An unexpected error occurred", details);
    }

    private ResponseEntity<ApiResponse<Void>> respond(ErrorKind kind, String message, Map<String, String> details) {
        return ResponseEntity.status(ApiResponses.status(kind))
                .body(ApiResponse.error(kind.code(), message, details));
    }
}
