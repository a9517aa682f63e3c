package com.example.reportflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/workflows/graph/run.
 */
public record GraphRunRequest(
        String name,
        @NotEmpty @Valid List<WorkflowNodeDto> nodes,
        @Valid List<WorkflowEdgeDto> edges,
        Object input,
        Map<String, Map<String, Object>> overrides,
        @JsonProperty("terminal_node_id") String terminalNodeId,
        @JsonProperty("timeout_ms") @Positive Long timeoutMs
) {
}
