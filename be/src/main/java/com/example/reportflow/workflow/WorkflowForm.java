package com.example.reportflow.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Shape of a workflow definition: a linear pipeline or a node/edge graph.
 */
public enum WorkflowForm {
    PIPELINE,
    GRAPH;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowForm fromLabel(String label) {
        if (label == null) {
            return null;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
