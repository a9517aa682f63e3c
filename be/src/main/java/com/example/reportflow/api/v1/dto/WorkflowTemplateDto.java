package com.example.reportflow.api.v1.dto;

import com.example.reportflow.workflow.WorkflowForm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Serialized workflow template, as stored in the template files and returned by
 * GET /api/v1/workflows/templates/{name}. Pipeline templates use {@code steps} and
 * {@code node_defs}; graph templates use {@code nodes} and {@code edges}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowTemplateDto(
        String name,
        String description,
        WorkflowForm form,
        List<String> steps,
        @JsonProperty("node_defs") Map<String, NodeDefDto> nodeDefs,
        List<WorkflowNodeDto> nodes,
        List<WorkflowEdgeDto> edges
) {
}
