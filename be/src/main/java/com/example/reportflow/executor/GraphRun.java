package com.example.reportflow.executor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Successful graph run.
 *
 * @param terminalNodeId node whose output is {@code output}
 * @param nodeOutputs    output of every node, in execution order
 * @param trace          trace in execution order, independent of completion timing
 * @param executionOrder topological order the nodes were scheduled in
 */
public record GraphRun(
        String name,
        String terminalNodeId,
        Object output,
        Map<String, Object> nodeOutputs,
        List<TraceEntry> trace,
        List<String> executionOrder
) {
    public GraphRun {
        nodeOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(nodeOutputs));
        trace = List.copyOf(trace);
        executionOrder = List.copyOf(executionOrder);
    }
}
