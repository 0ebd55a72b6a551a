package dev.stepflow.engine;

/**
 * The run's cancellation signal fired: no further steps are dispatched.
 */
public class RunCancelledException extends Exception {

    public RunCancelledException(String message) {
        super(message);
    }

    public RunCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
