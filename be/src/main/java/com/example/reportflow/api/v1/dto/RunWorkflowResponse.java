package com.example.reportflow.api.v1.dto;

import com.example.reportflow.executor.TraceEntry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Result of a workflow run. On error {@code output} is absent and {@code node_outputs} holds
 * what completed before the failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunWorkflowResponse(
        RunStatus status,
        Object output,
        @JsonProperty("node_outputs") Map<String, Object> nodeOutputs,
        List<TraceEntry> trace,
        @JsonProperty("error_detail") ErrorDetail errorDetail
) {
    public static RunWorkflowResponse success(Object output, Map<String, Object> nodeOutputs, List<TraceEntry> trace) {
        return new RunWorkflowResponse(RunStatus.SUCCESS, output, nodeOutputs, trace, null);
    }

    public static RunWorkflowResponse error(ErrorDetail detail, Map<String, Object> nodeOutputs, List<TraceEntry> trace) {
        return new RunWorkflowResponse(RunStatus.ERROR, null, nodeOutputs, trace, detail);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }
}
