package com.example.reportflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.constraints.NotBlank;

/**
 * Edge of a graph workflow; {@code hint} is {@code sequential} (default) or {@code parallel-eligible}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowEdgeDto(
        @NotBlank String source,
        @NotBlank String target,
        String hint
) {
}
