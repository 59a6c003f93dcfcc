package com.dbbaskette.codeguardian.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum CommentFeedback {
    HELPFUL("helpful"),
    NOT_HELPFUL("not_helpful"),
    APPLIED("applied");

    private final String label;

    CommentFeedback(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }

    public static Optional<CommentFeedback> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(f -> f.label.equals(normalized))
                .findFirst();
    }
}
