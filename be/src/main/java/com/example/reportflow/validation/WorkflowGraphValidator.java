package com.example.reportflow.validation;

import com.example.reportflow.registry.NodeNotFoundException;
import com.example.reportflow.registry.NodeRegistry;
import com.example.reportflow.workflow.EdgeDefinition;
import com.example.reportflow.workflow.GraphDefinition;
import com.example.reportflow.workflow.NodeDefinition;
import com.example.reportflow.workflow.PipelineDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates workflow definitions before execution: required fields, unique ids, reference
 * integrity and registered node types. Cycles are detected when the execution plan is built.
 */
public final class WorkflowGraphValidator {

    private WorkflowGraphValidator() {
    }

    /**
     * Validates a graph. Throws {@link WorkflowStructureException} with all structural errors,
     * then {@link NodeNotFoundException} for the first node whose type is not registered.
     */
    public static void validateGraph(GraphDefinition graph, NodeRegistry registry) {
        List<ValidationError> errors = new ArrayList<>();
        if (graph == null || graph.nodes().isEmpty()) {
            errors.add(new ValidationError("nodes", "at least one node is required"));
            throw new WorkflowStructureException(errors);
        }

        Set<String> nodeIds = new HashSet<>();
        for (int i = 0; i < graph.nodes().size(); i++) {
            NodeDefinition node = graph.nodes().get(i);
            String prefix = "nodes[" + i + "]";
            if (node == null) {
                errors.add(new ValidationError(prefix, "node must not be null"));
                continue;
            }
            validateNode(prefix, node, errors);
            if (node.id() != null && !node.id().isBlank() && !nodeIds.add(node.id())) {
                errors.add(new ValidationError(prefix + ".id", "duplicate node id: " + node.id()));
            }
        }

        Set<String> edgeKeys = new HashSet<>();
        for (int i = 0; i < graph.edges().size(); i++) {
            EdgeDefinition edge = graph.edges().get(i);
            String prefix = "edges[" + i + "]";
            if (edge == null) {
                errors.add(new ValidationError(prefix, "edge must not be null"));
                continue;
            }
            if (!nodeIds.contains(edge.source())) {
                errors.add(new ValidationError(prefix + ".source", "source must reference an existing node id: " + edge.source()));
            }
            if (!nodeIds.contains(edge.target())) {
                errors.add(new ValidationError(prefix + ".target", "target must reference an existing node id: " + edge.target()));
            }
            if (!edgeKeys.add(edge.source() + "->" + edge.target())) {
                errors.add(new ValidationError(prefix, "duplicate edge " + edge.source() + " -> " + edge.target()));
            }
        }

        if (!errors.isEmpty()) {
            throw new WorkflowStructureException(errors);
        }
        graph.nodes().forEach(node -> requireRegistered(node, registry));
    }

    /**
     * Validates a pipeline. Throws {@link WorkflowStructureException} with all structural errors,
     * then {@link NodeNotFoundException} for the first step whose type is not registered.
     */
    public static void validatePipeline(PipelineDefinition pipeline, NodeRegistry registry) {
        List<ValidationError> errors = new ArrayList<>();
        if (pipeline == null || pipeline.steps().isEmpty()) {
            errors.add(new ValidationError("steps", "at least one step is required"));
            throw new WorkflowStructureException(errors);
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < pipeline.steps().size(); i++) {
            String stepId = pipeline.steps().get(i);
            String prefix = "steps[" + i + "]";
            if (stepId == null || stepId.isBlank()) {
                errors.add(new ValidationError(prefix, "step id is required"));
                continue;
            }
            if (!seen.add(stepId)) {
                errors.add(new ValidationError(prefix, "duplicate step id: " + stepId));
            }
            NodeDefinition definition = pipeline.step(stepId);
            if (definition == null) {
                errors.add(new ValidationError("node_defs[" + stepId + "]", "no node definition for step " + stepId));
            } else if (definition.type() == null || definition.type().isBlank()) {
                errors.add(new ValidationError("node_defs[" + stepId + "].type", "node type is required"));
            }
        }

        if (!errors.isEmpty()) {
            throw new WorkflowStructureException(errors);
        }
        for (String stepId : pipeline.steps()) {
            requireRegistered(pipeline.step(stepId), registry);
        }
    }

    private static void validateNode(String prefix, NodeDefinition node, List<ValidationError> errors) {
        if (node.id() == null || node.id().isBlank()) {
            errors.add(new ValidationError(prefix + ".id", "node id is required"));
        }
        if (node.type() == null || node.type().isBlank()) {
            errors.add(new ValidationError(prefix + ".type", "node type is required"));
        }
    }

    private static void requireRegistered(NodeDefinition node, NodeRegistry registry) {
        if (!registry.isRegistered(node.type())) {
            throw new NodeNotFoundException(node.type());
        }
    }

    /**
     * Ids of overrides that do not name a node of the workflow; callers log these.
     */
    public static List<String> unknownOverrideIds(Map<String, ?> overrides, Set<String> nodeIds) {
        if (overrides == null) {
            return List.of();
        }
        return overrides.keySet().stream().filter(id -> !nodeIds.contains(id)).sorted().toList();
    }
}
