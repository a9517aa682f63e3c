package com.example.reportflow.node;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeCategory {

    CALCULATION,
    AGGREGATION,
    TRANSFORMATION;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
