package com.example.reportflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SlaSeverity {

    NONE("None"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    SlaSeverity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Severity for a positive number of days past the SLA deadline.
     */
    public static SlaSeverity forBreachDays(long breachDays) {
        if (breachDays <= 7) {
            return LOW;
        }
        if (breachDays <= 14) {
            return MEDIUM;
        }
        if (breachDays <= 30) {
            return HIGH;
        }
        return CRITICAL;
    }
}
