package com.example.reportflow.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Linear workflow: step ids in execution order and the node definition of each step.
 */
public record PipelineDefinition(String name, List<String> steps, Map<String, NodeDefinition> nodeDefs) {

    public PipelineDefinition {
        steps = steps != null ? List.copyOf(steps) : List.of();
        nodeDefs = nodeDefs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(nodeDefs)) : Map.of();
    }

    public NodeDefinition step(String stepId) {
        return nodeDefs.get(stepId);
    }
}
