package com.example.reportflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input of a graph node with several predecessors: each predecessor's output keyed by its
 * node id, in edge declaration order. Only nodes that explicitly merge accept it.
 */
public record FanInInput(Map<String, Object> outputsBySource) {

    public FanInInput {
        Objects.requireNonNull(outputsBySource, "outputsBySource");
        outputsBySource = Collections.unmodifiableMap(new LinkedHashMap<>(outputsBySource));
    }

    public Object outputOf(String sourceId) {
        return outputsBySource.get(sourceId);
    }

    public int size() {
        return outputsBySource.size();
    }
}
