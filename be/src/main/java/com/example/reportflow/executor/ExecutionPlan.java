package com.example.reportflow.executor;

import com.example.reportflow.validation.CyclicWorkflowException;
import com.example.reportflow.workflow.EdgeDefinition;
import com.example.reportflow.workflow.GraphDefinition;
import com.example.reportflow.workflow.NodeDefinition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Topological schedule of a graph workflow.
 * <p>
 * Nodes are addressed by their declaration index. The order is computed with Kahn's algorithm;
 * among nodes that are ready at the same time the one declared first is scheduled first, so the
 * order is deterministic. {@link #readySets()} partitions the order into waves of nodes whose
 * predecessors all belong to earlier waves.
 * </p>
 */
public final class ExecutionPlan {

    private final List<NodeDefinition> nodes;
    private final Map<String, Integer> indexById;
    private final int[][] predecessors;
    private final int[] order;
    private final int[] rank;
    private final List<int[]> waves;

    private ExecutionPlan(List<NodeDefinition> nodes, Map<String, Integer> indexById, int[][] predecessors,
                          int[] order, int[] rank, List<int[]> waves) {
        this.nodes = nodes;
        this.indexById = indexById;
        this.predecessors = predecessors;
        this.order = order;
        this.rank = rank;
        this.waves = waves;
    }

    /**
     * Builds the plan for a structurally valid graph.
     *
     * @throws CyclicWorkflowException if the edges contain a cycle
     */
    public static ExecutionPlan of(GraphDefinition graph) {
        List<NodeDefinition> nodes = graph.nodes();
        int n = nodes.size();
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < n; i++) {
            indexById.put(nodes.get(i).id(), i);
        }

        List<List<Integer>> successorLists = new ArrayList<>(n);
        List<List<Integer>> predecessorLists = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            successorLists.add(new ArrayList<>());
            predecessorLists.add(new ArrayList<>());
        }
        int[] inDegree = new int[n];
        for (EdgeDefinition edge : graph.edges()) {
            Integer source = indexById.get(edge.source());
            Integer target = indexById.get(edge.target());
            if (source == null || target == null) {
                throw new IllegalArgumentException("Edge references an unknown node: " + edge.source() + " -> " + edge.target());
            }
            successorLists.get(source).add(target);
            predecessorLists.get(target).add(source);
            inDegree[target]++;
        }

        int[] order = new int[n];
        int[] rank = new int[n];
        int[] waveOf = new int[n];
        int processed = 0;
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        while (!ready.isEmpty()) {
            int current = ready.poll();
            rank[current] = processed;
            order[processed++] = current;
            for (int successor : successorLists.get(current)) {
                waveOf[successor] = Math.max(waveOf[successor], waveOf[current] + 1);
                if (--inDegree[successor] == 0) {
                    ready.add(successor);
                }
            }
        }
        if (processed < n) {
            List<String> unresolved = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if (inDegree[i] > 0) {
                    unresolved.add(nodes.get(i).id());
                }
            }
            throw new CyclicWorkflowException(unresolved);
        }

        int[][] predecessors = new int[n][];
        for (int i = 0; i < n; i++) {
            predecessors[i] = predecessorLists.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return new ExecutionPlan(nodes, indexById, predecessors, order, rank, buildWaves(order, waveOf));
    }

    private static List<int[]> buildWaves(int[] order, int[] waveOf) {
        List<List<Integer>> byWave = new ArrayList<>();
        for (int index : order) {
            while (byWave.size() <= waveOf[index]) {
                byWave.add(new ArrayList<>());
            }
            byWave.get(waveOf[index]).add(index);
        }
        List<int[]> waves = new ArrayList<>(byWave.size());
        for (List<Integer> wave : byWave) {
            waves.add(wave.stream().mapToInt(Integer::intValue).toArray());
        }
        return waves;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String nodeId) {
        return indexById.containsKey(nodeId);
    }

    public List<String> executionOrder() {
        List<String> ids = new ArrayList<>(order.length);
        for (int index : order) {
            ids.add(nodes.get(index).id());
        }
        return ids;
    }

    /**
     * Waves of independently executable nodes, each wave in execution order.
     */
    public List<List<String>> readySets() {
        List<List<String>> sets = new ArrayList<>(waves.size());
        for (int[] wave : waves) {
            List<String> ids = new ArrayList<>(wave.length);
            for (int index : wave) {
                ids.add(nodes.get(index).id());
            }
            sets.add(List.copyOf(ids));
        }
        return sets;
    }

    /**
     * Predecessor ids in edge declaration order.
     */
    public List<String> predecessorsOf(String nodeId) {
        List<String> ids = new ArrayList<>();
        for (int index : predecessors[indexOf(nodeId)]) {
            ids.add(nodes.get(index).id());
        }
        return ids;
    }

    public int rankOf(String nodeId) {
        return rank[indexOf(nodeId)];
    }

    public String lastNodeId() {
        return nodes.get(order[order.length - 1]).id();
    }

    NodeDefinition node(int index) {
        return nodes.get(index);
    }

    int[] order() {
        return order;
    }

    List<int[]> waves() {
        return waves;
    }

    int[] predecessors(int index) {
        return predecessors[index];
    }

    int rank(int index) {
        return rank[index];
    }

    private int indexOf(String nodeId) {
        Integer index = indexById.get(nodeId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown node id: " + nodeId);
        }
        return index;
    }
}
