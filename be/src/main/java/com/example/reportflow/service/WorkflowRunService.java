package com.example.reportflow.service;

import com.example.reportflow.api.v1.dto.ErrorDetail;
import com.example.reportflow.api.v1.dto.RunWorkflowResponse;
import com.example.reportflow.config.ExecutorProperties;
import com.example.reportflow.executor.ExecutionOptions;
import com.example.reportflow.executor.GraphExecutor;
import com.example.reportflow.executor.GraphRun;
import com.example.reportflow.executor.NodeExecutionException;
import com.example.reportflow.executor.PipelineExecutor;
import com.example.reportflow.executor.PipelineRun;
import com.example.reportflow.executor.WorkflowTimeoutException;
import com.example.reportflow.workflow.GraphDefinition;
import com.example.reportflow.workflow.PipelineDefinition;
import com.example.reportflow.workflow.WorkflowForm;
import com.example.reportflow.workflow.WorkflowTemplate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

/**
 * Runs pipeline and graph workflows and turns run failures into error results.
 * <p>
 * Invalid definitions and unknown node types are not run failures: those exceptions propagate
 * to the caller before any node has run.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowRunService {

    private final PipelineExecutor pipelineExecutor;
    private final GraphExecutor graphExecutor;
    private final WorkflowTemplateCatalog templateCatalog;
    private final ExecutorProperties executorProperties;

    public RunWorkflowResponse runPipeline(PipelineDefinition pipeline, Object input, ExecutionOptions options) {
        ExecutionOptions runOptions = withDefaultTimeout(options);
        log.info("Run pipeline name={} steps={} timeout={}", pipeline.name(), pipeline.steps().size(), runOptions.timeout());
        try {
            PipelineRun run = pipelineExecutor.run(pipeline, input, runOptions);
            return RunWorkflowResponse.success(run.output(), null, run.trace());
        } catch (NodeExecutionException e) {
            return nodeFailure(pipeline.name(), e);
        } catch (WorkflowTimeoutException e) {
            return timeout(pipeline.name(), e);
        }
    }

    public RunWorkflowResponse runGraph(GraphDefinition graph, Object input, ExecutionOptions options) {
        ExecutionOptions runOptions = withDefaultTimeout(options);
        log.info("Run graph name={} nodes={} edges={} timeout={}", graph.name(), graph.nodes().size(), graph.edges().size(), runOptions.timeout());
        try {
            GraphRun run = graphExecutor.run(graph, input, runOptions);
            return RunWorkflowResponse.success(run.output(), run.nodeOutputs(), run.trace());
        } catch (NodeExecutionException e) {
            return nodeFailure(graph.name(), e);
        } catch (WorkflowTimeoutException e) {
            return timeout(graph.name(), e);
        }
    }

    /**
     * @throws com.example.reportflow.api.WorkflowTemplateNotFoundException if no template has this name
     */
    public RunWorkflowResponse runTemplate(String name, Object input, ExecutionOptions options) {
        WorkflowTemplate template = templateCatalog.get(name);
        log.info("Run template name={} form={}", name, template.form());
        if (template.form() == WorkflowForm.GRAPH) {
            return runGraph(template.graph(), input, options);
        }
        return runPipeline(template.pipeline(), input, options);
    }

    private ExecutionOptions withDefaultTimeout(ExecutionOptions options) {
        ExecutionOptions runOptions = options != null ? options : ExecutionOptions.defaults();
        if (runOptions.timeout() == null && executorProperties.getDefaultTimeout() != null) {
            return runOptions.withTimeout(executorProperties.getDefaultTimeout());
        }
        return runOptions;
    }

    private static RunWorkflowResponse nodeFailure(String workflowName, NodeExecutionException e) {
        log.warn("Workflow name={} failed at node id={} type={}: {}", workflowName, e.getNodeId(), e.getNodeType(), e.getCause().getMessage());
        ErrorDetail detail = new ErrorDetail(ErrorDetail.NODE_EXECUTION, e.getNodeId(), e.getNodeType(), e.getMessage());
        return RunWorkflowResponse.error(detail, e.getPartialOutputs(), e.getTrace());
    }

    private static RunWorkflowResponse timeout(String workflowName, WorkflowTimeoutException e) {
        log.warn("Workflow name={} timed out after {} completed node(s)", workflowName, e.getTrace().size());
        ErrorDetail detail = new ErrorDetail(ErrorDetail.TIMEOUT, null, null, e.getMessage());
        return RunWorkflowResponse.error(detail, e.getPartialOutputs(), e.getTrace());
    }
}
