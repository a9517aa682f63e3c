package com.example.reportflow.executor;

import java.util.List;

/**
 * Successful pipeline run: the last step's output and the trace in step order.
 */
public record PipelineRun(String name, Object output, List<TraceEntry> trace) {

    public PipelineRun {
        trace = List.copyOf(trace);
    }
}
