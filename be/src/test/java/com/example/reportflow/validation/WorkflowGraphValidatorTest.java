package com.example.reportflow.validation;

import com.example.reportflow.registry.BuiltInNodes;
import com.example.reportflow.registry.NodeNotFoundException;
import com.example.reportflow.registry.NodeRegistry;
import com.example.reportflow.workflow.EdgeDefinition;
import com.example.reportflow.workflow.GraphDefinition;
import com.example.reportflow.workflow.NodeDefinition;
import com.example.reportflow.workflow.PipelineDefinition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("WorkflowGraphValidator")
class WorkflowGraphValidatorTest {

    private final NodeRegistry registry = BuiltInNodes.registry(Clock.systemUTC());

    private static NodeDefinition node(String id, String type) {
        return new NodeDefinition(id, type, Map.of());
    }

    @Nested
    @DisplayName("graph")
    class Graph {

        @Test
        @DisplayName("passes for registered types and edges between existing nodes")
        void valid() {
            GraphDefinition graph = new GraphDefinition("g",
                    List.of(node("a", "OutstandingCalculatorNode"), node("b", "SortNode")),
                    List.of(new EdgeDefinition("a", "b")));
            assertDoesNotThrow(() -> WorkflowGraphValidator.validateGraph(graph, registry));
        }

        @Test
        @DisplayName("fails when there are no nodes")
        void empty() {
            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class,
                    () -> WorkflowGraphValidator.validateGraph(new GraphDefinition("g", List.of(), List.of()), registry));
            assertEquals("nodes", ex.getErrors().get(0).field());
        }

        @Test
        @DisplayName("collects missing ids, duplicate ids and dangling edges together")
        void collectsErrors() {
            GraphDefinition graph = new GraphDefinition("g",
                    List.of(node("a", "SortNode"), node("a", "SortNode"), node(null, "SortNode"), node("c", " ")),
                    List.of(new EdgeDefinition("a", "ghost"), new EdgeDefinition("a", "c"), new EdgeDefinition("a", "c")));

            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class,
                    () -> WorkflowGraphValidator.validateGraph(graph, registry));

            assertThat(ex.getErrors()).extracting(ValidationError::field).containsExactly(
                    "nodes[1].id", "nodes[2].id", "nodes[3].type", "edges[0].target", "edges[2]");
        }

        @Test
        @DisplayName("reports the first unregistered type after structure passes")
        void unknownType() {
            GraphDefinition graph = new GraphDefinition("g",
                    List.of(node("a", "SortNode"), node("b", "MysteryNode"), node("c", "OtherMystery")), List.of());

            NodeNotFoundException ex = assertThrows(NodeNotFoundException.class,
                    () -> WorkflowGraphValidator.validateGraph(graph, registry));
            assertEquals("MysteryNode", ex.getNodeType());
        }
    }

    @Nested
    @DisplayName("pipeline")
    class Pipeline {

        @Test
        @DisplayName("passes when every step has a registered definition")
        void valid() {
            PipelineDefinition pipeline = new PipelineDefinition("p", List.of("s1", "s2"),
                    Map.of("s1", node("s1", "OutstandingCalculatorNode"), "s2", node("s2", "SummaryNode")));
            assertDoesNotThrow(() -> WorkflowGraphValidator.validatePipeline(pipeline, registry));
        }

        @Test
        @DisplayName("fails for no steps, missing definitions and duplicate steps")
        void invalid() {
            assertThrows(WorkflowStructureException.class,
                    () -> WorkflowGraphValidator.validatePipeline(new PipelineDefinition("p", List.of(), Map.of()), registry));

            Map<String, NodeDefinition> defs = new LinkedHashMap<>();
            defs.put("s1", node("s1", "SortNode"));
            PipelineDefinition pipeline = new PipelineDefinition("p", List.of("s1", "s1", "s2"), defs);

            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class,
                    () -> WorkflowGraphValidator.validatePipeline(pipeline, registry));
            assertThat(ex.getErrors()).extracting(ValidationError::field).containsExactly("steps[1]", "node_defs[s2]");
        }

        @Test
        @DisplayName("reports an unregistered step type")
        void unknownType() {
            PipelineDefinition pipeline = new PipelineDefinition("p", List.of("s1"), Map.of("s1", node("s1", "NoSuchNode")));

            NodeNotFoundException ex = assertThrows(NodeNotFoundException.class,
                    () -> WorkflowGraphValidator.validatePipeline(pipeline, registry));
            assertEquals("NoSuchNode", ex.getNodeType());
        }
    }

    @Test
    @DisplayName("lists override ids that name no node")
    void unknownOverrides() {
        assertEquals(List.of("ghost", "phantom"),
                WorkflowGraphValidator.unknownOverrideIds(Map.of("phantom", Map.of(), "a", Map.of(), "ghost", Map.of()), Set.of("a")));
        assertEquals(List.of(), WorkflowGraphValidator.unknownOverrideIds(null, Set.of("a")));
    }
}
