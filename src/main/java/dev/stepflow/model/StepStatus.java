package dev.stepflow.model;

/**
 * Execution status of a single step.
 *
 * Transitions:
 *   IDLE    → PENDING (claimed by the scheduler)
 *   PENDING → RUNNING (dispatched task starts the command)
 *   RUNNING → SUCCESS (exit status 0, no timeout)
 *   RUNNING → FAILED  (non-zero exit, launch or wait failure, timeout)
 *
 * The one backwards edge is PENDING → IDLE, taken when a stop or cancellation
 * arrives before a claimed step was dispatched. Its command never started.
 */
public enum StepStatus {
    IDLE,
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isDone() {
        return this == SUCCESS || this == FAILED;
    }
}
