package com.dbbaskette.codeguardian.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of finding severities. {@link #rank()} orders fixes: critical first.
 */
public enum Severity {
    CRITICAL("critical", 0),
    HIGH("high", 1),
    MEDIUM("medium", 2),
    LOW("low", 3);

    private final String label;
    private final int rank;

    Severity(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String getLabel() { return label; }

    public int rank() { return rank; }

    /**
     * Unknown or missing labels are treated as medium.
     */
    public static Severity fromLabel(String value) {
        if (value == null) {
            return MEDIUM;
        }
        String normalized = value.trim().toLowerCase();
        for (Severity severity : values()) {
            if (severity.label.equals(normalized)) {
                return severity;
            }
        }
        return MEDIUM;
    }
}
