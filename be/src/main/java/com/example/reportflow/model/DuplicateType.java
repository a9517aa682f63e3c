package com.example.reportflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DuplicateType {

    EXACT(100),
    FUZZY(75);

    private final int confidence;

    DuplicateType(int confidence) {
        this.confidence = confidence;
    }

    public int confidence() {
        return confidence;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
