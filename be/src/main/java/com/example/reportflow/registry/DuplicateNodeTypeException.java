package com.example.reportflow.registry;

import lombok.Getter;

/**
 * Thrown when a node type is registered twice.
 */
@Getter
public class DuplicateNodeTypeException extends RuntimeException {

    private final String nodeType;

    public DuplicateNodeTypeException(String nodeType) {
        super("Node type already registered: " + nodeType);
        this.nodeType = nodeType;
    }
}
