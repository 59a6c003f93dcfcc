package com.dbbaskette.codeguardian.service.result;

/**
 * Error variants an operation can return. Each maps to one HTTP status at the controller edge.
 */
public enum ErrorKind {
    VALIDATION("VALIDATION_ERROR"),
    NOT_FOUND("NOT_FOUND"),
    CONFLICT("CONFLICT_ERROR"),
    EXTERNAL_SERVICE("EXTERNAL_SERVICE_ERROR"),
    INTERNAL("INTERNAL_ERROR");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() { return code; }
}
