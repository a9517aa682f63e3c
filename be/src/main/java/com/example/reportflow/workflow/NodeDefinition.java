package com.example.reportflow.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of a workflow: its id, the registered type to run and the declared parameters.
 * {@code position} is display metadata and is passed through untouched.
 */
public record NodeDefinition(String id, String type, Map<String, Object> parameters, Map<String, Object> position) {

    public NodeDefinition {
        parameters = copy(parameters);
        position = copy(position);
    }

    public NodeDefinition(String id, String type, Map<String, Object> parameters) {
        this(id, type, parameters, null);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        // values may legitimately be null, so Map.copyOf is not an option
        return source == null || source.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
