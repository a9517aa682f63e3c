package com.example.reportflow.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when the edges of a graph workflow contain a cycle. The whole graph is rejected.
 */
@Getter
public class CyclicWorkflowException extends WorkflowStructureException {

    /** Nodes the topological sort could not order, in declaration order. */
    private final List<String> unresolvedNodeIds;

    public CyclicWorkflowException(List<String> unresolvedNodeIds) {
        super("Workflow graph contains a cycle through " + unresolvedNodeIds,
                List.of(new ValidationError("edges", "cycle detected among nodes " + unresolvedNodeIds)));
        this.unresolvedNodeIds = List.copyOf(unresolvedNodeIds);
    }
}
