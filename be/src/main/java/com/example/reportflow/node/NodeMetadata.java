package com.example.reportflow.node;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Static description of a node type: display name, category and the declared input/output
 * shapes (field name to description).
 */
public record NodeMetadata(
        String type,
        String name,
        NodeCategory category,
        String description,
        @JsonProperty("input_shape") Map<String, String> inputShape,
        @JsonProperty("output_shape") Map<String, String> outputShape
) {
    public NodeMetadata {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(category, "category");
        name = name != null ? name : type;
        description = description != null ? description : "";
        inputShape = inputShape != null ? Map.copyOf(inputShape) : Map.of();
        outputShape = outputShape != null ? Map.copyOf(outputShape) : Map.of();
    }
}
