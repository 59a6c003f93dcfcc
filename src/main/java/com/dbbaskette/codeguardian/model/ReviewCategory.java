package com.dbbaskette.codeguardian.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReviewCategory {
    SECURITY("security"),
    PERFORMANCE("performance"),
    MAINTAINABILITY("maintainability"),
    STYLE("style"),
    BEST_PRACTICE("best_practice"),
    BUG("bug"),
    DOCUMENTATION("documentation"),
    GENERAL("general");

    private final String label;

    ReviewCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }

    /**
     * Exact label match (case-insensitive, '-' and ' ' read as '_'); anything else is GENERAL.
     */
    public static ReviewCategory fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return GENERAL;
        }
        String normalized = value.trim().toLowerCase().replace('-', '_').replace(' ', '_');
        for (ReviewCategory category : values()) {
            if (category.label.equals(normalized)) {
                return category;
            }
        }
        return GENERAL;
    }
}
