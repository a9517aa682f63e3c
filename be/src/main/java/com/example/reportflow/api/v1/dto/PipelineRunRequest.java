package com.example.reportflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/workflows/pipeline/run.
 */
public record PipelineRunRequest(
        String name,
        @NotEmpty List<String> steps,
        @JsonProperty("node_defs") @NotNull @Valid Map<String, NodeDefDto> nodeDefs,
        Object input,
        Map<String, Map<String, Object>> overrides,
        @JsonProperty("timeout_ms") @Positive Long timeoutMs
) {
}
