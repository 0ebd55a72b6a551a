package dev.stepflow.runner;

/**
 * The step's process could not be started, e.g. the executable does not exist.
 */
public class LaunchException extends StepExecutionException {

    public LaunchException(String step, String command, Throwable cause) {
        super(step, "Step '%s' could not start '%s'".formatted(step, command), cause);
    }
}
