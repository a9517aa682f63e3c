package com.example.reportflow.config;

import com.example.reportflow.api.v1.dto.WorkflowTemplateDto;
import com.example.reportflow.executor.ExecutionPlan;
import com.example.reportflow.registry.NodeNotFoundException;
import com.example.reportflow.registry.NodeRegistry;
import com.example.reportflow.service.WorkflowDefinitionMapper;
import com.example.reportflow.service.WorkflowTemplateCatalog;
import com.example.reportflow.validation.WorkflowGraphValidator;
import com.example.reportflow.validation.WorkflowStructureException;
import com.example.reportflow.workflow.WorkflowForm;
import com.example.reportflow.workflow.WorkflowTemplate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads workflow templates from classpath resources into the catalog at startup.
 * A template that cannot be read or is invalid is logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowTemplatesLoader implements ApplicationRunner {

    private final TemplateProperties properties;
    private final WorkflowTemplateCatalog catalog;
    private final NodeRegistry nodeRegistry;
    private final JsonMapper jsonMapper;

    @Override
    public void run(ApplicationArguments args) {
        for (String location : properties.getLocations()) {
            loadTemplate(location);
        }
        log.info("Loaded {} workflow template(s)", catalog.size());
    }

    void loadTemplate(String path) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Workflow template resource not found: {}", path);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            WorkflowTemplateDto dto = jsonMapper.readValue(in, WorkflowTemplateDto.class);
            WorkflowTemplate template = WorkflowDefinitionMapper.toTemplate(dto);
            validate(template);
            catalog.register(template);
            log.info("Loaded workflow template: {}", template.name());
        } catch (JacksonException e) {
            log.error("Failed to parse workflow template {}: {}", path, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read workflow template {}: {}", path, e.getMessage());
        } catch (WorkflowStructureException e) {
            log.error("Invalid workflow template {}: {} {}", path, e.getMessage(), e.getErrors());
        } catch (NodeNotFoundException | IllegalArgumentException e) {
            log.error("Invalid workflow template {}: {}", path, e.getMessage());
        }
    }

    private void validate(WorkflowTemplate template) {
        if (template.form() == WorkflowForm.GRAPH) {
            WorkflowGraphValidator.validateGraph(template.graph(), nodeRegistry);
            ExecutionPlan.of(template.graph());
        } else {
            WorkflowGraphValidator.validatePipeline(template.pipeline(), nodeRegistry);
        }
    }
}
