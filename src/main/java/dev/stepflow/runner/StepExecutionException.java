package dev.stepflow.runner;

/**
 * A step could not run to a normal exit.
 */
public abstract class StepExecutionException extends Exception {

    private final String step;

    protected StepExecutionException(String step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    public String step() {
        return step;
    }
}
