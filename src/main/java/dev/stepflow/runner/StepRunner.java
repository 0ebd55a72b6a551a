package dev.stepflow.runner;

import java.time.Duration;

/**
 * Executes a single step's command and classifies how it ended.
 */
public interface StepRunner {

    /**
     * Run a command to completion.
     *
     * @param step    name of the step, used as the event source
     * @param command command line; first whitespace-delimited token is the executable
     * @param timeout budget for the whole run, launch included
     * @return the exit status of a process that ran to completion within the timeout
     * @throws LaunchException      the process could not be started
     * @throws WaitException        monitoring the process failed
     * @throws StepTimeoutException the timeout elapsed before the process ended
     */
    RunOutcome run(String step, String command, Duration timeout) throws StepExecutionException;

    /** Called once before the first step of a run. */
    default void start() throws NotificationException {}

    /** Called once after the last step of a run has finished. */
    default void stop() {}
}
