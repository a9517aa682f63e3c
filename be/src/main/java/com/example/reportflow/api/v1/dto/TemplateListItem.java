package com.example.reportflow.api.v1.dto;

import com.example.reportflow.workflow.WorkflowForm;

/**
 * Summary of a workflow template for list responses.
 */
public record TemplateListItem(String name, String description, WorkflowForm form) {
}
