package com.example.reportflow.executor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Write-once store of node outputs and trace entries for one graph run. Safe for concurrent
 * writers; snapshots are ordered by execution rank, never by completion time.
 */
final class NodeOutputs {

    // wraps the output so that null outputs can be stored
    private record Slot(Object output, TraceEntry traceEntry) {
    }

    private final ExecutionPlan plan;
    private final Map<Integer, Slot> slots = new ConcurrentHashMap<>();

    NodeOutputs(ExecutionPlan plan) {
        this.plan = plan;
    }

    void record(int index, Object output, TraceEntry traceEntry) {
        Slot previous = slots.putIfAbsent(index, new Slot(output, traceEntry));
        if (previous != null) {
            throw new IllegalStateException("Output of node '" + plan.node(index).id() + "' already recorded");
        }
    }

    boolean isRecorded(int index) {
        return slots.containsKey(index);
    }

    Object outputOf(int index) {
        Slot slot = slots.get(index);
        if (slot == null) {
            throw new IllegalStateException("Node '" + plan.node(index).id() + "' has not completed");
        }
        return slot.output();
    }

    Map<String, Object> outputsInOrder() {
        return outputsBefore(plan.size());
    }

    List<TraceEntry> traceInOrder() {
        return traceBefore(plan.size());
    }

    /**
     * Outputs of the recorded nodes ranked strictly before {@code rank}.
     */
    Map<String, Object> outputsBefore(int rank) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        int[] order = plan.order();
        for (int r = 0; r < rank; r++) {
            Slot slot = slots.get(order[r]);
            if (slot != null) {
                outputs.put(plan.node(order[r]).id(), slot.output());
            }
        }
        return outputs;
    }

    List<TraceEntry> traceBefore(int rank) {
        List<TraceEntry> trace = new ArrayList<>();
        int[] order = plan.order();
        for (int r = 0; r < rank; r++) {
            Slot slot = slots.get(order[r]);
            if (slot != null) {
                trace.add(slot.traceEntry());
            }
        }
        return trace;
    }
}
