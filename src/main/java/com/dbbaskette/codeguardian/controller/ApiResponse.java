package com.dbbaskette.codeguardian.controller;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Uniform JSON envelope for every API response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, String message, T data, ErrorBody error) {

    public record ErrorBody(String errorCode, String message, Map<String, String> details) {}

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, message, data, null);
    }

    public static <T> ApiResponse<T> error(String errorCode, String message, Map<String, String> details) {
        return new ApiResponse<>(false, null, null, new ErrorBody(errorCode, message, details));
    }
}
