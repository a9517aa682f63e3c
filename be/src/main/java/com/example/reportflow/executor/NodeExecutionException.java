package com.example.reportflow.executor;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown when a node fails during a run. Carries the failing node, the trace of the nodes that
 * completed before it and their outputs, for diagnostics only.
 */
@Getter
public class NodeExecutionException extends RuntimeException {

    private final String nodeId;
    private final String nodeType;
    private final List<TraceEntry> trace;
    private final Map<String, Object> partialOutputs;

    public NodeExecutionException(String nodeId, String nodeType, List<TraceEntry> trace, Map<String, Object> partialOutputs, Throwable cause) {
        super("Node '" + nodeId + "' (" + nodeType + ") failed: " + cause.getMessage(), cause);
        this.nodeId = nodeId;
        this.nodeType = nodeType;
        this.trace = List.copyOf(trace);
        this.partialOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(partialOutputs));
    }
}
