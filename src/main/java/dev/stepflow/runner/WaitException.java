package dev.stepflow.runner;

/**
 * Monitoring a started process failed for a reason other than its exit status.
 */
public class WaitException extends StepExecutionException {

    public WaitException(String step, String reason, Throwable cause) {
        super(step, "Step '%s' failed while waiting: %s".formatted(step, reason), cause);
    }
}
