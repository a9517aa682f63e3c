package com.example.reportflow.workflow;

import java.util.Objects;

/**
 * Named, reusable workflow definition. Exactly one of {@code pipeline} and {@code graph} is set,
 * according to {@code form}.
 */
public record WorkflowTemplate(String name, String description, WorkflowForm form, PipelineDefinition pipeline, GraphDefinition graph) {

    public WorkflowTemplate {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(form, "form");
        if (form == WorkflowForm.PIPELINE && (pipeline == null || graph != null)) {
            throw new IllegalArgumentException("Pipeline template '" + name + "' must carry only a pipeline definition");
        }
        if (form == WorkflowForm.GRAPH && (graph == null || pipeline != null)) {
            throw new IllegalArgumentException("Graph template '" + name + "' must carry only a graph definition");
        }
    }

    public static WorkflowTemplate ofPipeline(String name, String description, PipelineDefinition pipeline) {
        return new WorkflowTemplate(name, description, WorkflowForm.PIPELINE, pipeline, null);
    }

    public static WorkflowTemplate ofGraph(String name, String description, GraphDefinition graph) {
        return new WorkflowTemplate(name, description, WorkflowForm.GRAPH, null, graph);
    }
}
