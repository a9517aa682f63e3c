package com.example.reportflow.executor;

import lombok.Getter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown when a run exceeds its deadline. No node is started after the deadline; outputs of
 * nodes that completed are kept.
 */
@Getter
public class WorkflowTimeoutException extends RuntimeException {

    private final Duration timeout;
    private final List<TraceEntry> trace;
    private final Map<String, Object> partialOutputs;

    public WorkflowTimeoutException(Duration timeout, List<TraceEntry> trace, Map<String, Object> partialOutputs) {
        super("Workflow exceeded timeout of " + timeout.toMillis() + " ms after " + trace.size() + " completed node(s)");
        this.timeout = timeout;
        this.trace = List.copyOf(trace);
        this.partialOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(partialOutputs));
    }
}
