package com.example.reportflow.registry;

import lombok.Getter;

/**
 * Thrown when a node type identifier is not registered.
 */
@Getter
public class NodeNotFoundException extends RuntimeException {

    private final String nodeType;

    public NodeNotFoundException(String nodeType) {
        super("Unknown node type: " + nodeType);
        this.nodeType = nodeType;
    }
}
