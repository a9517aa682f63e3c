package com.example.reportflow.api.v1;

import com.example.reportflow.api.v1.dto.GraphRunRequest;
import com.example.reportflow.api.v1.dto.PipelineRunRequest;
import com.example.reportflow.api.v1.dto.RunWorkflowResponse;
import com.example.reportflow.api.v1.dto.TemplateListItem;
import com.example.reportflow.api.v1.dto.TemplateRunRequest;
import com.example.reportflow.api.v1.dto.WorkflowTemplateDto;
import com.example.reportflow.executor.ExecutionOptions;
import com.example.reportflow.service.WorkflowDefinitionMapper;
import com.example.reportflow.service.WorkflowRunService;
import com.example.reportflow.service.WorkflowTemplateCatalog;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * REST controller for running workflows.
 * <p>
 * Exposes {@code /api/v1/workflows} for ad-hoc pipeline runs (POST /pipeline/run), ad-hoc graph
 * runs (POST /graph/run) and named templates (GET /templates, GET /templates/{name},
 * POST /templates/{name}/run). A run that fails in a node or times out answers 422 with the
 * error result.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private static final int UNPROCESSABLE = 422;

    private final WorkflowRunService runService;
    private final WorkflowTemplateCatalog templateCatalog;

    @PostMapping("/pipeline/run")
    public ResponseEntity<RunWorkflowResponse> runPipeline(@Valid @RequestBody PipelineRunRequest request) {
        log.info("Running pipeline name={} steps={}", request.name(), request.steps());
        var pipeline = WorkflowDefinitionMapper.toPipeline(request.name(), request.steps(), request.nodeDefs());
        var options = options(request.overrides(), null, request.timeoutMs());
        return toResponse(runService.runPipeline(pipeline, request.input(), options));
    }

    @PostMapping("/graph/run")
    public ResponseEntity<RunWorkflowResponse> runGraph(@Valid @RequestBody GraphRunRequest request) {
        log.info("Running graph name={} nodeCount={} edgeCount={}", request.name(), request.nodes().size(),
                request.edges() != null ? request.edges().size() : 0);
        var graph = WorkflowDefinitionMapper.toGraph(request.name(), request.nodes(), request.edges());
        var options = options(request.overrides(), request.terminalNodeId(), request.timeoutMs());
        return toResponse(runService.runGraph(graph, request.input(), options));
    }

    @GetMapping("/templates")
    public ResponseEntity<List<TemplateListItem>> listTemplates() {
        log.debug("Listing workflow templates");
        return ResponseEntity.ok(templateCatalog.findAll().stream()
                .map(t -> new TemplateListItem(t.name(), t.description(), t.form()))
                .toList());
    }

    @GetMapping("/templates/{name}")
    public ResponseEntity<WorkflowTemplateDto> getTemplate(@PathVariable String name) {
        log.info("Getting workflow template name={}", name);
        return ResponseEntity.ok(WorkflowDefinitionMapper.toDto(templateCatalog.get(name)));
    }

    @PostMapping("/templates/{name}/run")
    public ResponseEntity<RunWorkflowResponse> runTemplate(@PathVariable String name,
                                                           @Valid @RequestBody(required = false) TemplateRunRequest request) {
        TemplateRunRequest body = request != null ? request : new TemplateRunRequest(null, null, null, null);
        log.info("Running workflow template name={}", name);
        var options = options(body.overrides(), body.terminalNodeId(), body.timeoutMs());
        return toResponse(runService.runTemplate(name, body.input(), options));
    }

    private static ExecutionOptions options(Map<String, Map<String, Object>> overrides, String terminalNodeId, Long timeoutMs) {
        return ExecutionOptions.builder()
                .overrides(overrides)
                .terminalNodeId(terminalNodeId)
                .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : null)
                .build();
    }

    private static ResponseEntity<RunWorkflowResponse> toResponse(RunWorkflowResponse response) {
        if (response.isSuccess()) {
            return ResponseEntity.ok(response);
        }
        return ResponseEntity.status(UNPROCESSABLE).body(response);
    }
}
