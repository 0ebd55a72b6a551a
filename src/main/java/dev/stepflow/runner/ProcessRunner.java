package dev.stepflow.runner;

import dev.stepflow.model.Event;
import dev.stepflow.model.EventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a step's command as an external process and reports its lifecycle.
 *
 * Per call the notifier sees {@code RUN_REQUESTED}, then {@code RUN_STARTED} or
 * {@code RUN_ERROR}, then exactly one of {@code RUN_SUCCESS}, {@code RUN_FAIL},
 * {@code RUN_WAIT_ERROR} or {@code RUN_TIMEOUT}.
 */
public class ProcessRunner implements StepRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    // How long to wait for output to drain once the process has exited.
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final Sink sink;
    private final Notifier notifier;
    private final AtomicLong sequence = new AtomicLong();

    public ProcessRunner(Sink sink, Notifier notifier) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
    }

    @Override
    public RunOutcome run(String step, String command, Duration timeout) throws StepExecutionException {
        push(step, EventKind.RUN_REQUESTED, null);

        long startedAt = System.nanoTime();
        // Saturates instead of overflowing for very large timeouts.
        long timeoutNanos = TimeUnit.NANOSECONDS.convert(timeout);

        Process process;
        try {
            process = new ProcessBuilder(tokenize(command)).start();
        } catch (IOException | RuntimeException e) {
            push(step, EventKind.RUN_ERROR, null);
            throw new LaunchException(step, command, e);
        }
        push(step, EventKind.RUN_STARTED, null);
        log.debug("Step '{}' started as pid {}", step, process.pid());

        OutputPump stdout = OutputPump.start(step, "stdout", process.getInputStream(), sink.stdout());
        OutputPump stderr = OutputPump.start(step, "stderr", process.getErrorStream(), sink.stderr());
        closeStdin(step, process);

        boolean exited;
        try {
            long remaining = timeoutNanos - (System.nanoTime() - startedAt);
            exited = remaining > 0 && process.waitFor(remaining, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            push(step, EventKind.RUN_WAIT_ERROR, null);
            throw new WaitException(step, "interrupted", e);
        }

        // Checked before the exit status: a late exit still counts as a timeout.
        if (!exited || System.nanoTime() - startedAt > timeoutNanos) {
            kill(process);
            push(step, EventKind.RUN_TIMEOUT, null);
            throw new StepTimeoutException(step, timeout);
        }

        try {
            stdout.await(DRAIN_TIMEOUT);
            stderr.await(DRAIN_TIMEOUT);
        } catch (IOException e) {
            push(step, EventKind.RUN_WAIT_ERROR, null);
            throw new WaitException(step, "copying process output failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            push(step, EventKind.RUN_WAIT_ERROR, null);
            throw new WaitException(step, "interrupted", e);
        }

        int exitStatus = process.exitValue();
        if (exitStatus != 0) {
            push(step, EventKind.RUN_FAIL, exitStatus);
            return new RunOutcome(exitStatus);
        }
        push(step, EventKind.RUN_SUCCESS, null);
        return RunOutcome.success();
    }

    @Override
    public void start() throws NotificationException {
        notifier.start();
    }

    @Override
    public void stop() {
        notifier.stop();
    }

    /**
     * Split a command line into executable and arguments on runs of whitespace.
     * No quoting, expansion or substitution is applied.
     */
    public static List<String> tokenize(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Empty command");
        }
        return Arrays.asList(command.trim().split("\\s+"));
    }

    private void push(String step, EventKind kind, Integer exitStatus) {
        Event event = new Event(sequence.incrementAndGet(), step, kind, exitStatus, Instant.now());
        try {
            notifier.push(event);
        } catch (NotificationException | RuntimeException e) {
            log.warn("Notifier rejected event {}: {}", event, e.getMessage(), e);
        }
    }

    private static void closeStdin(String step, Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of step '{}': {}", step, e.getMessage());
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
