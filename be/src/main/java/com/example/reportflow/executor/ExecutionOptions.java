package com.example.reportflow.executor;

import com.example.reportflow.node.NodeParameters;
import com.example.reportflow.workflow.NodeDefinition;

import lombok.Builder;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied settings of one run.
 *
 * @param overrides      parameter overrides keyed by node (or step) id; override values win
 * @param timeout        overall deadline, or {@code null} for none
 * @param terminalNodeId graph node whose output is the result; defaults to the last node in
 *                       execution order
 */
@Builder
public record ExecutionOptions(Map<String, Map<String, Object>> overrides, Duration timeout, String terminalNodeId) {

    private static final ExecutionOptions DEFAULTS = new ExecutionOptions(null, null, null);

    public ExecutionOptions {
        overrides = overrides == null || overrides.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    public static ExecutionOptions defaults() {
        return DEFAULTS;
    }

    public ExecutionOptions withTimeout(Duration newTimeout) {
        return new ExecutionOptions(overrides, newTimeout, terminalNodeId);
    }

    /**
     * The node's declared parameters merged with the override for its id.
     */
    public NodeParameters parametersFor(String nodeId, NodeDefinition definition) {
        return NodeParameters.of(definition.parameters()).mergedWith(overrides.get(nodeId));
    }
}
