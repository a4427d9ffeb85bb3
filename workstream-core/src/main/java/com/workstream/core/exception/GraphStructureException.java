package com.workstream.core.exception;

import com.workstream.core.graph.GraphValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a workflow graph is structurally invalid (cycle, unknown reference)
 * or is handed to an executor without having passed validation.
 */
public class GraphStructureException extends WorkstreamException {

    public static final String ERROR_CODE = "GRAPH_STRUCTURE_INVALID";

    private final List<GraphValidationError> errors;

    public GraphStructureException(String message) {
        this(ERROR_CODE, message);
    }

    public GraphStructureException(List<GraphValidationError> errors) {
        super(ERROR_CODE, String.format(
            "Workflow graph is invalid: %s",
            errors.stream().map(GraphValidationError::message).collect(Collectors.joining("; "))
        ));
        this.errors = List.copyOf(errors);
    }

    protected GraphStructureException(String errorCode, String message) {
        super(errorCode, message);
        this.errors = List.of();
    }

    public List<GraphValidationError> getErrors() {
        return errors;
    }
}
