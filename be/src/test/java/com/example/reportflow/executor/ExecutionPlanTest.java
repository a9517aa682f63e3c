package com.example.reportflow.executor;

import com.example.reportflow.validation.CyclicWorkflowException;
import com.example.reportflow.workflow.EdgeDefinition;
import com.example.reportflow.workflow.GraphDefinition;
import com.example.reportflow.workflow.NodeDefinition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ExecutionPlan")
class ExecutionPlanTest {

    private static GraphDefinition graph(List<String> ids, EdgeDefinition... edges) {
        return new GraphDefinition("g",
                ids.stream().map(id -> new NodeDefinition(id, "TagNode", Map.of())).toList(),
                Arrays.asList(edges));
    }

    @Test
    @DisplayName("orders nodes topologically, breaking ties by declaration order")
    void order() {
        ExecutionPlan plan = ExecutionPlan.of(graph(List.of("d", "b", "a", "c"),
                new EdgeDefinition("a", "c"), new EdgeDefinition("b", "c"), new EdgeDefinition("c", "d")));

        assertEquals(List.of("b", "a", "c", "d"), plan.executionOrder());
        assertEquals("d", plan.lastNodeId());
        assertEquals(2, plan.rankOf("c"));
    }

    @Test
    @DisplayName("independent nodes keep declaration order")
    void noEdges() {
        ExecutionPlan plan = ExecutionPlan.of(graph(List.of("x", "y", "z")));

        assertEquals(List.of("x", "y", "z"), plan.executionOrder());
        assertEquals(List.of(List.of("x", "y", "z")), plan.readySets());
    }

    @Test
    @DisplayName("partitions into ready sets by longest path from a source")
    void readySets() {
        ExecutionPlan plan = ExecutionPlan.of(graph(List.of("src", "left", "right", "merge", "tail", "side"),
                new EdgeDefinition("src", "left"),
                new EdgeDefinition("src", "right"),
                new EdgeDefinition("left", "merge"),
                new EdgeDefinition("right", "merge"),
                new EdgeDefinition("merge", "tail"),
                new EdgeDefinition("src", "tail")));

        assertEquals(List.of(
                List.of("src", "side"),
                List.of("left", "right"),
                List.of("merge"),
                List.of("tail")), plan.readySets());
        assertEquals(List.of("merge", "src"), plan.predecessorsOf("tail"));
    }

    @Test
    @DisplayName("predecessors follow edge declaration order")
    void predecessorOrder() {
        ExecutionPlan plan = ExecutionPlan.of(graph(List.of("a", "b", "m"),
                new EdgeDefinition("b", "m"), new EdgeDefinition("a", "m")));

        assertEquals(List.of("b", "a"), plan.predecessorsOf("m"));
    }

    @Test
    @DisplayName("rejects a cycle and names the unresolved nodes")
    void cycle() {
        CyclicWorkflowException ex = assertThrows(CyclicWorkflowException.class, () -> ExecutionPlan.of(graph(
                List.of("start", "a", "b", "c"),
                new EdgeDefinition("start", "a"),
                new EdgeDefinition("a", "b"),
                new EdgeDefinition("b", "c"),
                new EdgeDefinition("c", "a"))));

        assertEquals(List.of("a", "b", "c"), ex.getUnresolvedNodeIds());
        assertThat(ex.getErrors()).hasSize(1);
        assertEquals("edges", ex.getErrors().get(0).field());
    }

    @Test
    @DisplayName("rejects a self loop")
    void selfLoop() {
        assertThrows(CyclicWorkflowException.class, () -> ExecutionPlan.of(graph(List.of("a"), new EdgeDefinition("a", "a"))));
    }
}
