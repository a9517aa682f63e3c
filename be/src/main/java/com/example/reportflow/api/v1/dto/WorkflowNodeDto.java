package com.example.reportflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * One node of a graph workflow. {@code position} is display metadata and is passed through.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record WorkflowNodeDto(
        @NotBlank String id,
        @NotBlank String type,
        @JsonAlias("params") Map<String, Object> parameters,
        Map<String, Object> position
) {
}
