package com.example.reportflow.workflow;

import java.util.List;

/**
 * Workflow as a node/edge graph. Node declaration order breaks ties in the execution order.
 */
public record GraphDefinition(String name, List<NodeDefinition> nodes, List<EdgeDefinition> edges) {

    public GraphDefinition {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
