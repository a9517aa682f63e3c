package com.example.reportflow.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a workflow definition is structurally invalid (missing or duplicate ids, edges to
 * unknown nodes, cycles). Raised before any node runs.
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by
 * {@link com.example.reportflow.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowStructureException extends RuntimeException {

    private final List<ValidationError> errors;

    public WorkflowStructureException(List<ValidationError> errors) {
        this("Workflow structure is invalid: " + (errors != null ? errors.size() + " error(s)" : ""), errors);
    }

    protected WorkflowStructureException(String message, List<ValidationError> errors) {
        super(message);
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
