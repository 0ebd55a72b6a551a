package dev.stepflow.model;

/**
 * Lifecycle occurrences reported for a step execution.
 */
public enum EventKind {
    RUN_REQUESTED,
    RUN_STARTED,
    RUN_ERROR,
    /** Carries the process exit status as payload. */
    RUN_FAIL,
    RUN_WAIT_ERROR,
    RUN_TIMEOUT,
    RUN_SUCCESS;

    public boolean isTerminal() {
        return switch (this) {
            case RUN_ERROR, RUN_FAIL, RUN_WAIT_ERROR, RUN_TIMEOUT, RUN_SUCCESS -> true;
            case RUN_REQUESTED, RUN_STARTED -> false;
        };
    }
}
