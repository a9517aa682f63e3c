package com.example.reportflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Positive;

import java.util.Map;

/**
 * Request body for POST /api/v1/workflows/templates/{name}/run. All fields are optional.
 */
public record TemplateRunRequest(
        Object input,
        Map<String, Map<String, Object>> overrides,
        @JsonProperty("terminal_node_id") String terminalNodeId,
        @JsonProperty("timeout_ms") @Positive Long timeoutMs
) {
}
