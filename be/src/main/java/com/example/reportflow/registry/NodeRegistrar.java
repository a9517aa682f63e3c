package com.example.reportflow.registry;

/**
 * Contributes node types to the registry at start-up. Every bean of this type is applied once.
 */
@FunctionalInterface
public interface NodeRegistrar {

    void registerNodes(NodeRegistry registry);
}
