package com.example.reportflow.workflow;

/**
 * Directed dependency: {@code target} consumes the output of {@code source}.
 */
public record EdgeDefinition(String source, String target, ExecutionHint hint) {

    public EdgeDefinition {
        hint = hint != null ? hint : ExecutionHint.SEQUENTIAL;
    }

    public EdgeDefinition(String source, String target) {
        this(source, target, ExecutionHint.SEQUENTIAL);
    }
}
