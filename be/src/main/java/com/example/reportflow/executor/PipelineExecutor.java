package com.example.reportflow.executor;

import com.example.reportflow.node.NodeParameters;
import com.example.reportflow.node.WorkflowNode;
import com.example.reportflow.registry.NodeRegistry;
import com.example.reportflow.validation.WorkflowGraphValidator;
import com.example.reportflow.workflow.NodeDefinition;
import com.example.reportflow.workflow.PipelineDefinition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a linear workflow: each step receives the previous step's output, the first step the
 * workflow input. The first failing step aborts the run.
 */
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final NodeRegistry registry;

    public PipelineExecutor(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public PipelineRun run(PipelineDefinition pipeline, Object input) {
        return run(pipeline, input, ExecutionOptions.defaults());
    }

    /**
     * Validates and runs the pipeline.
     *
     * @throws com.example.reportflow.validation.WorkflowStructureException if the pipeline is invalid
     * @throws com.example.reportflow.registry.NodeNotFoundException if a step type is not registered
     * @throws NodeExecutionException if a step fails
     * @throws WorkflowTimeoutException if the deadline passes
     */
    public PipelineRun run(PipelineDefinition pipeline, Object input, ExecutionOptions options) {
        ExecutionOptions runOptions = options != null ? options : ExecutionOptions.defaults();
        WorkflowGraphValidator.validatePipeline(pipeline, registry);
        List<String> unknown = WorkflowGraphValidator.unknownOverrideIds(runOptions.overrides(), new HashSet<>(pipeline.steps()));
        if (!unknown.isEmpty()) {
            log.warn("Ignoring overrides for unknown step ids {}", unknown);
        }

        log.info("Running pipeline name={} steps={}", pipeline.name(), pipeline.steps());
        Deadline deadline = Deadline.after(runOptions.timeout());
        List<TraceEntry> trace = new ArrayList<>();
        Map<String, Object> stepOutputs = new LinkedHashMap<>();
        Object data = input;
        for (String stepId : pipeline.steps()) {
            if (deadline.isExpired()) {
                throw new WorkflowTimeoutException(deadline.timeout(), trace, stepOutputs);
            }
            NodeDefinition definition = pipeline.step(stepId);
            NodeRunner.Outcome outcome;
            try {
                NodeParameters parameters = runOptions.parametersFor(stepId, definition);
                WorkflowNode node = registry.resolve(definition.type());
                outcome = NodeRunner.run(stepId, definition.type(), node, data, parameters);
            } catch (RuntimeException e) {
                log.warn("Pipeline step id={} type={} failed: {}", stepId, definition.type(), e.getMessage());
                throw new NodeExecutionException(stepId, definition.type(), trace, stepOutputs, e);
            }
            trace.add(outcome.traceEntry());
            stepOutputs.put(stepId, outcome.output());
            data = outcome.output();
        }
        log.info("Pipeline completed name={} steps={}", pipeline.name(), trace.size());
        return new PipelineRun(pipeline.name(), data, trace);
    }
}
