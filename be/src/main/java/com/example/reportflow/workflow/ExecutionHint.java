package com.example.reportflow.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Optional tag on an edge. Advisory only: execution order and results never depend on it.
 */
public enum ExecutionHint {

    SEQUENTIAL("sequential"),
    PARALLEL_ELIGIBLE("parallel-eligible");

    private final String label;

    ExecutionHint(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ExecutionHint fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return SEQUENTIAL;
        }
        for (ExecutionHint hint : values()) {
            if (hint.label.equalsIgnoreCase(label.trim()) || hint.name().equalsIgnoreCase(label.trim())) {
                return hint;
            }
        }
        throw new IllegalArgumentException("Unknown execution hint: " + label);
    }
}
