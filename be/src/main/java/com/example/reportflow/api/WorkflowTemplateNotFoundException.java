package com.example.reportflow.api;

import lombok.Getter;

/**
 * Thrown when no workflow template has the requested name.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowTemplateNotFoundException extends RuntimeException {

    private final String templateName;

    public WorkflowTemplateNotFoundException(String templateName) {
        super("Workflow template not found: " + templateName);
        this.templateName = templateName;
    }
}
