package com.example.reportflow.executor;

import com.example.reportflow.node.NodeParameters;
import com.example.reportflow.node.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invokes one node and measures it.
 */
final class NodeRunner {

    private static final Logger log = LoggerFactory.getLogger(NodeRunner.class);

    record Outcome(Object output, TraceEntry traceEntry) {
    }

    private NodeRunner() {
    }

    static Outcome run(String nodeId, String type, WorkflowNode node, Object input, NodeParameters parameters) {
        log.debug("Running node id={} type={} parameters={}", nodeId, type, parameters);
        long start = System.nanoTime();
        Object output = node.run(input, parameters);
        double durationMs = (System.nanoTime() - start) / 1_000_000.0;
        TraceEntry entry = new TraceEntry(nodeId, type, durationMs, PayloadSizes.sizeOf(input), PayloadSizes.sizeOf(output));
        log.debug("Node id={} completed in {} ms outputSize={}", nodeId, String.format("%.3f", durationMs), entry.outputSize());
        return new Outcome(output, entry);
    }
}
