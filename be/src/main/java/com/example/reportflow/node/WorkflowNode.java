package com.example.reportflow.node;

/**
 * A registered unit of computation, resolved by its type identifier.
 * <p>
 * Implementations behave as pure functions: the same input and parameters always produce the
 * same output, and no state survives between invocations. A node that cannot complete throws;
 * its output is only consumed after a successful return.
 * </p>
 */
public interface WorkflowNode {

    /**
     * Runs the node.
     *
     * @param input      the workflow input or the routed output of the predecessor node(s)
     * @param parameters the node's declared parameters merged with run-time overrides
     * @return the output handed to successor nodes
     */
    Object run(Object input, NodeParameters parameters);

    /**
     * Descriptive metadata used for discovery and validation, never for dispatch.
     */
    NodeMetadata metadata();
}
