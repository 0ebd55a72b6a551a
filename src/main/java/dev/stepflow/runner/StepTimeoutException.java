package dev.stepflow.runner;

import java.time.Duration;

/**
 * Deadline exceeded: the step ran longer than its timeout and was terminated.
 */
public class StepTimeoutException extends StepExecutionException {

    private final Duration timeout;

    public StepTimeoutException(String step, Duration timeout) {
        super(step, "Step '%s' exceeded its timeout of %s".formatted(step, timeout), null);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
