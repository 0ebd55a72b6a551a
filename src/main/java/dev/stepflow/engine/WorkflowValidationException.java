package dev.stepflow.engine;

import java.util.List;

/**
 * A workflow definition violates one or more constraints; nothing was run.
 */
public class WorkflowValidationException extends RuntimeException {

    private final List<String> errors;

    public WorkflowValidationException(List<String> errors) {
        super("Invalid workflow: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
