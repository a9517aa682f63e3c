package com.example.reportflow.service;

import com.example.reportflow.api.v1.dto.NodeDefDto;
import com.example.reportflow.api.v1.dto.WorkflowEdgeDto;
import com.example.reportflow.api.v1.dto.WorkflowNodeDto;
import com.example.reportflow.api.v1.dto.WorkflowTemplateDto;
import com.example.reportflow.workflow.EdgeDefinition;
import com.example.reportflow.workflow.ExecutionHint;
import com.example.reportflow.workflow.GraphDefinition;
import com.example.reportflow.workflow.NodeDefinition;
import com.example.reportflow.workflow.PipelineDefinition;
import com.example.reportflow.workflow.WorkflowForm;
import com.example.reportflow.workflow.WorkflowTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between API/template DTOs and workflow definitions.
 */
public final class WorkflowDefinitionMapper {

    private WorkflowDefinitionMapper() {
    }

    public static PipelineDefinition toPipeline(String name, List<String> steps, Map<String, NodeDefDto> nodeDefs) {
        Map<String, NodeDefinition> definitions = new LinkedHashMap<>();
        if (nodeDefs != null) {
            nodeDefs.forEach((stepId, def) -> {
                if (def != null) {
                    definitions.put(stepId, new NodeDefinition(stepId, def.type(), def.parameters()));
                }
            });
        }
        return new PipelineDefinition(name, steps, definitions);
    }

    public static GraphDefinition toGraph(String name, List<WorkflowNodeDto> nodes, List<WorkflowEdgeDto> edges) {
        List<NodeDefinition> nodeDefinitions = nodes == null ? List.of() : nodes.stream()
                .map(node -> new NodeDefinition(node.id(), node.type(), node.parameters(), node.position()))
                .toList();
        List<EdgeDefinition> edgeDefinitions = edges == null ? List.of() : edges.stream()
                .map(edge -> new EdgeDefinition(edge.source(), edge.target(), ExecutionHint.fromLabel(edge.hint())))
                .toList();
        return new GraphDefinition(name, nodeDefinitions, edgeDefinitions);
    }

    /**
     * Builds a template; the form is inferred from the fields present when not given.
     */
    public static WorkflowTemplate toTemplate(WorkflowTemplateDto dto) {
        if (dto.name() == null || dto.name().isBlank()) {
            throw new IllegalArgumentException("Workflow template name is required");
        }
        WorkflowForm form = dto.form() != null ? dto.form() : (dto.nodes() != null ? WorkflowForm.GRAPH : WorkflowForm.PIPELINE);
        if (form == WorkflowForm.GRAPH) {
            return WorkflowTemplate.ofGraph(dto.name(), dto.description(), toGraph(dto.name(), dto.nodes(), dto.edges()));
        }
        return WorkflowTemplate.ofPipeline(dto.name(), dto.description(), toPipeline(dto.name(), dto.steps(), dto.nodeDefs()));
    }

    public static WorkflowTemplateDto toDto(WorkflowTemplate template) {
        if (template.form() == WorkflowForm.GRAPH) {
            GraphDefinition graph = template.graph();
            List<WorkflowNodeDto> nodes = graph.nodes().stream()
                    .map(node -> new WorkflowNodeDto(node.id(), node.type(), node.parameters(), node.position()))
                    .toList();
            List<WorkflowEdgeDto> edges = graph.edges().stream()
                    .map(edge -> new WorkflowEdgeDto(edge.source(), edge.target(), edge.hint().label()))
                    .toList();
            return new WorkflowTemplateDto(template.name(), template.description(), template.form(), null, null, nodes, edges);
        }
        PipelineDefinition pipeline = template.pipeline();
        Map<String, NodeDefDto> nodeDefs = new LinkedHashMap<>();
        pipeline.nodeDefs().forEach((stepId, def) -> nodeDefs.put(stepId, new NodeDefDto(def.type(), def.parameters())));
        return new WorkflowTemplateDto(template.name(), template.description(), template.form(), pipeline.steps(), nodeDefs, null, null);
    }
}
