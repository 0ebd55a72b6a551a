package dev.stepflow.model;

/**
 * What a failed step does to the rest of the run.
 */
public enum FailurePolicy {

    /** Any failure raises the stop flag: no new step is dispatched, running steps finish. */
    STOP,

    /** Independent steps keep being dispatched; dependents of a failed step are never scheduled. */
    CONTINUE
}
