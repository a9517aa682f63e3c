package com.example.reportflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Why a run failed: {@code node_execution} or {@code timeout}, the failing node for node
 * failures, and the error message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDetail(
        String type,
        @JsonProperty("failed_node_id") String failedNodeId,
        @JsonProperty("node_type") String nodeType,
        String message
) {
    public static final String NODE_EXECUTION = "node_execution";
    public static final String TIMEOUT = "timeout";
}
