package dev.stepflow.runner;

/**
 * Normal completion of a step's process. A non-zero exit is an outcome, not an error.
 */
public record RunOutcome(int exitStatus) {

    public static RunOutcome success() {
        return new RunOutcome(0);
    }

    public boolean succeeded() {
        return exitStatus == 0;
    }
}
