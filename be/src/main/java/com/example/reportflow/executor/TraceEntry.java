package com.example.reportflow.executor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution metadata of one node in one run. Sizes count records where the payload carries
 * them.
 */
public record TraceEntry(
        @JsonProperty("node_id") String nodeId,
        String type,
        @JsonProperty("duration_ms") double durationMs,
        @JsonProperty("input_size") int inputSize,
        @JsonProperty("output_size") int outputSize
) {
}
