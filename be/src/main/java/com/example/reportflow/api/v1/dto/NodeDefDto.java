package com.example.reportflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Node definition of one pipeline step.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record NodeDefDto(
        @NotBlank @JsonAlias("node_type") String type,
        @JsonAlias("params") Map<String, Object> parameters
) {
}
