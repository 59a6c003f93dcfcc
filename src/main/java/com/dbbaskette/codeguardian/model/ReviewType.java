package com.dbbaskette.codeguardian.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ReviewType {
    FULL_REVIEW("full_review"),
    INCREMENTAL("incremental"),
    SECURITY_SCAN("security_scan");

    private final String label;

    ReviewType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }

    public static Optional<ReviewType> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(FULL_REVIEW);
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.label.equals(normalized))
                .findFirst();
    }
}
