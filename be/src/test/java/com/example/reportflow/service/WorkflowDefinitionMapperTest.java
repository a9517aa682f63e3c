package com.example.reportflow.service;

import com.example.reportflow.api.v1.dto.NodeDefDto;
import com.example.reportflow.api.v1.dto.WorkflowEdgeDto;
import com.example.reportflow.api.v1.dto.WorkflowNodeDto;
import com.example.reportflow.api.v1.dto.WorkflowTemplateDto;
import com.example.reportflow.workflow.ExecutionHint;
import com.example.reportflow.workflow.GraphDefinition;
import com.example.reportflow.workflow.WorkflowForm;
import com.example.reportflow.workflow.WorkflowTemplate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("WorkflowDefinitionMapper")
class WorkflowDefinitionMapperTest {

    @Test
    @DisplayName("maps graph nodes, positions and edge hints")
    void graph() {
        GraphDefinition graph = WorkflowDefinitionMapper.toGraph("g",
                List.of(new WorkflowNodeDto("a", "SortNode", Map.of("sort_by", List.of()), Map.of("x", 10, "y", 20)),
                        new WorkflowNodeDto("b", "SummaryNode", null, null)),
                List.of(new WorkflowEdgeDto("a", "b", "parallel-eligible"), new WorkflowEdgeDto("b", "a", null)));

        assertEquals(Map.of("x", 10, "y", 20), graph.nodes().get(0).position());
        assertEquals(Map.of(), graph.nodes().get(1).parameters());
        assertEquals(ExecutionHint.PARALLEL_ELIGIBLE, graph.edges().get(0).hint());
        assertEquals(ExecutionHint.SEQUENTIAL, graph.edges().get(1).hint());
    }

    @Test
    @DisplayName("infers the form from the fields present")
    void infersForm() {
        WorkflowTemplate pipeline = WorkflowDefinitionMapper.toTemplate(new WorkflowTemplateDto("p", null, null,
                List.of("s"), Map.of("s", new NodeDefDto("SortNode", Map.of())), null, null));
        WorkflowTemplate graph = WorkflowDefinitionMapper.toTemplate(new WorkflowTemplateDto("g", null, null,
                null, null, List.of(new WorkflowNodeDto("n", "SortNode", null, null)), null));

        assertEquals(WorkflowForm.PIPELINE, pipeline.form());
        assertEquals("SortNode", pipeline.pipeline().step("s").type());
        assertEquals(WorkflowForm.GRAPH, graph.form());
    }

    @Test
    @DisplayName("converts a template back to its serialized form")
    void toDto() {
        WorkflowTemplateDto source = new WorkflowTemplateDto("g", "demo", WorkflowForm.GRAPH, null, null,
                List.of(new WorkflowNodeDto("a", "SortNode", Map.of(), Map.of()), new WorkflowNodeDto("b", "SummaryNode", Map.of(), Map.of())),
                List.of(new WorkflowEdgeDto("a", "b", "sequential")));

        WorkflowTemplateDto dto = WorkflowDefinitionMapper.toDto(WorkflowDefinitionMapper.toTemplate(source));

        assertEquals(source, dto);
        assertNull(dto.steps());
    }

    @Test
    @DisplayName("requires a name")
    void requiresName() {
        assertThrows(IllegalArgumentException.class, () -> WorkflowDefinitionMapper.toTemplate(
                new WorkflowTemplateDto(" ", null, WorkflowForm.PIPELINE, List.of(), Map.of(), null, null)));
    }
}
