package com.example.reportflow.service;

import com.example.reportflow.api.WorkflowTemplateNotFoundException;
import com.example.reportflow.workflow.WorkflowTemplate;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory catalog of named workflow templates. Registering an existing name replaces it.
 */
@Component
@Slf4j
public class WorkflowTemplateCatalog {

    private final Map<String, WorkflowTemplate> templates = new ConcurrentSkipListMap<>();

    public void register(WorkflowTemplate template) {
        WorkflowTemplate previous = templates.put(template.name(), template);
        if (previous != null) {
            log.info("Replaced workflow template name={}", template.name());
        } else {
            log.debug("Registered workflow template name={} form={}", template.name(), template.form());
        }
    }

    public Optional<WorkflowTemplate> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(templates.get(name));
    }

    /**
     * @throws WorkflowTemplateNotFoundException if no template has this name
     */
    public WorkflowTemplate get(String name) {
        return find(name).orElseThrow(() -> new WorkflowTemplateNotFoundException(name));
    }

    /**
     * All templates sorted by name.
     */
    public List<WorkflowTemplate> findAll() {
        return List.copyOf(templates.values());
    }

    public int size() {
        return templates.size();
    }
}
