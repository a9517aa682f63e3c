package com.example.reportflow.registry;

import com.example.reportflow.node.NodeCategory;
import com.example.reportflow.node.NodeMetadata;
import com.example.reportflow.node.WorkflowNode;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Catalog of node implementations by type identifier. Used by the executors to resolve the
 * {@code type} of each node definition.
 */
public interface NodeRegistry {

    /**
     * Registers a factory for a type.
     *
     * @throws DuplicateNodeTypeException if the type is already registered
     */
    void register(String type, Supplier<? extends WorkflowNode> factory);

    /**
     * Returns a fresh node instance; instances are never shared between invocations.
     *
     * @throws NodeNotFoundException if the type is not registered
     */
    WorkflowNode resolve(String type);

    boolean isRegistered(String type);

    /**
     * Registered types, sorted.
     */
    Set<String> registeredTypes();

    /**
     * Metadata of every registered node, sorted by type.
     */
    List<NodeMetadata> catalog();

    /**
     * Metadata grouped by category, categories and entries sorted.
     */
    Map<NodeCategory, List<NodeMetadata>> catalogByCategory();
}
