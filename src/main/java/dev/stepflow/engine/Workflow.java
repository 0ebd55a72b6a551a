package dev.stepflow.engine;

import dev.stepflow.model.FailurePolicy;
import dev.stepflow.model.RunConfig;
import dev.stepflow.model.RunSummary;
import dev.stepflow.model.StepDefinition;
import dev.stepflow.model.StepStatus;
import dev.stepflow.model.WorkflowDefinition;
import dev.stepflow.runner.LaunchException;
import dev.stepflow.runner.NotificationException;
import dev.stepflow.runner.RunOutcome;
import dev.stepflow.runner.StepExecutionException;
import dev.stepflow.runner.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Dependency-aware, concurrency-bounded scheduler for a set of steps.
 *
 * One coordinating thread claims steps in declaration order and hands them to
 * worker threads, at most {@link RunConfig#concurrency()} at a time. The stop
 * flag, step statuses, the in-flight count and the scan-and-claim pair are all
 * guarded by a single lock; the admission gate is never acquired while holding it.
 *
 * A workflow runs once. Failures never preempt running steps: a stop (from a
 * failure, {@link #stop()} or cancellation) only prevents new dispatches, and
 * {@link #run} always waits for every dispatched step before returning.
 */
public final class Workflow {

    private static final Logger log = LoggerFactory.getLogger(Workflow.class);

    private final String version;
    private final Map<String, String> metadata;
    private final List<Step> steps;
    private final Map<String, Step> stepsByName;
    private final RunConfig config;
    private final StepRunner runner;
    private final StepStatusView statusView;

    private final ReentrantLock guard = new ReentrantLock();
    private final Condition stateChanged = guard.newCondition();
    private final AtomicBoolean started = new AtomicBoolean();
    private boolean stopRequested;
    private int inFlight;
    private StepExecutionException failure;

    private Workflow(String version, Map<String, String> metadata, List<Step> steps,
                     RunConfig config, StepRunner runner) {
        this.version = version;
        this.metadata = metadata;
        this.steps = Collections.unmodifiableList(steps);
        this.config = config;
        this.runner = runner;
        this.statusView = index -> this.steps.get(index).status();

        var byName = new LinkedHashMap<String, Step>();
        steps.forEach(step -> byName.put(step.name(), step));
        this.stepsByName = Collections.unmodifiableMap(byName);
    }

    /**
     * Validate a definition and resolve its dependencies into a runnable workflow.
     *
     * @throws WorkflowValidationException listing every violated constraint
     */
    public static Workflow create(WorkflowDefinition definition, RunConfig config, StepRunner runner) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(runner, "runner");

        List<String> errors = WorkflowValidator.validate(definition);
        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(errors);
        }

        List<StepDefinition> definitions = definition.steps();
        Map<String, Integer> indexByName = new HashMap<>();
        for (int i = 0; i < definitions.size(); i++) {
            indexByName.put(definitions.get(i).name(), i);
        }

        var steps = new ArrayList<Step>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            StepDefinition def = definitions.get(i);
            List<Integer> dependencies = def.dependsOn().stream().map(indexByName::get).toList();
            steps.add(new Step(i, def.name(), def.command(), dependencies));
        }
        return new Workflow(definition.version(), definition.metadata(), steps, config, runner);
    }

    public String version() { return version; }
    public Map<String, String> metadata() { return metadata; }
    public List<Step> steps() { return steps; }
    public RunConfig config() { return config; }

    public Step step(String name) {
        Step step = stepsByName.get(name);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step: " + name);
        }
        return step;
    }

    /**
     * Run without an external cancellation signal.
     *
     * @see #run(CancellationSignal)
     */
    public RunSummary run() throws StepExecutionException, RunCancelledException {
        return run(CancellationSignal.create());
    }

    /**
     * Run every step whose dependencies succeed, until all are done or a stop is requested.
     *
     * Non-zero exits and launch failures are only visible in the returned
     * summary. Wait failures and timeouts are rethrown once every dispatched
     * step has finished.
     *
     * @throws StepExecutionException the first wait failure or timeout of the run
     * A signal that fires once every step has been dispatched does not abort the
     * run: the remaining steps finish and their outcome decides the result.
     *
     * @throws RunCancelledException  the signal fired while a step was still waiting
     *                                for dispatch; no further steps were dispatched
     * @throws IllegalStateException  the workflow has already been run
     */
    public RunSummary run(CancellationSignal signal) throws StepExecutionException, RunCancelledException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Workflow has already been run");
        }
        try {
            runner.start();
        } catch (NotificationException e) {
            throw new IllegalStateException("Could not start event delivery", e);
        }

        log.info("Running {} step(s) with concurrency {}", steps.size(), config.concurrency());
        AdmissionGate gate = new AdmissionGate(config.concurrency());
        ExecutorService workers = Executors.newFixedThreadPool(config.concurrency(), workerThreads());

        RunCancelledException cancelled = null;
        try (CancellationSignal.Subscription ignored = signal.onCancel(this::wake)) {
            dispatchLoop(gate, workers, signal);
        } catch (RunCancelledException e) {
            cancelled = e;
            stop();
            log.warn("{}, waiting for running steps to finish", e.getMessage());
        } finally {
            awaitInFlight();
            workers.shutdown();
            runner.stop();
        }

        RunSummary summary = summary();
        log.info("Run finished: {} succeeded, {} failed, {} not run",
            count(summary, StepStatus.SUCCESS), summary.failedSteps().size(), summary.unscheduledSteps().size());

        if (cancelled != null) {
            throw cancelled;
        }
        StepExecutionException error = firstFailure();
        if (error != null) {
            throw error;
        }
        return summary;
    }

    /**
     * Request a cooperative stop: no new step is dispatched, running steps finish.
     */
    public void stop() {
        guard.lock();
        try {
            stopRequested = true;
            stateChanged.signalAll();
        } finally {
            guard.unlock();
        }
    }

    public boolean isStopRequested() {
        guard.lock();
        try {
            return stopRequested;
        } finally {
            guard.unlock();
        }
    }

    /** Current status of every step, in declaration order. */
    public RunSummary summary() {
        var statuses = new LinkedHashMap<String, StepStatus>();
        guard.lock();
        try {
            steps.forEach(step -> statuses.put(step.name(), step.status()));
        } finally {
            guard.unlock();
        }
        return new RunSummary(statuses);
    }

    private void dispatchLoop(AdmissionGate gate, ExecutorService workers, CancellationSignal signal)
        throws RunCancelledException {
        while (true) {
            Step step = claimNext(signal);
            if (step == null) {
                return;
            }

            try {
                gate.acquire(1, signal);
            } catch (RunCancelledException e) {
                abandon(step);
                throw e;
            }

            // A stop raised while waiting for admission still prevents this dispatch.
            if (!beginDispatch(step)) {
                gate.release(1);
                return;
            }
            log.debug("Dispatching step '{}'", step.name());
            workers.execute(() -> execute(step, gate));
        }
    }

    /**
     * Claim the first runnable step in declaration order, suspending until a
     * running step finishes when none is runnable yet.
     *
     * @return the claimed step, now PENDING, or null when the loop should end
     */
    private Step claimNext(CancellationSignal signal) throws RunCancelledException {
        guard.lock();
        try {
            while (true) {
                if (signal.isCancelled()) {
                    if (hasIdleSteps()) {
                        signal.throwIfCancelled();
                    }
                    // Only dispatched steps remain; run() waits for them.
                    return null;
                }
                if (stopRequested) {
                    log.info("Stop requested, no further steps will be dispatched");
                    return null;
                }
                if (allDone()) {
                    return null;
                }
                for (Step step : steps) {
                    if (step.shouldRun(statusView)) {
                        step.reserve();
                        log.debug("Claimed step '{}'", step.name());
                        return step;
                    }
                }
                if (inFlight == 0) {
                    logUnschedulable();
                    return null;
                }
                awaitStateChange(signal);
            }
        } finally {
            guard.unlock();
        }
    }

    private boolean hasIdleSteps() {
        return steps.stream().anyMatch(step -> step.status() == StepStatus.IDLE);
    }

    private void awaitStateChange(CancellationSignal signal) throws RunCancelledException {
        try {
            if (signal.hasDeadline()) {
                stateChanged.awaitNanos(signal.remainingNanos());
            } else {
                stateChanged.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Interrupted while waiting for running steps", e);
        }
    }

    private boolean beginDispatch(Step step) {
        guard.lock();
        try {
            if (stopRequested) {
                step.abandonReservation();
                return false;
            }
            inFlight++;
            return true;
        } finally {
            guard.unlock();
        }
    }

    private void abandon(Step step) {
        guard.lock();
        try {
            step.abandonReservation();
        } finally {
            guard.unlock();
        }
    }

    private void execute(Step step, AdmissionGate gate) {
        boolean succeeded = false;
        StepExecutionException error = null;
        try {
            markRunning(step);
            RunOutcome outcome = runner.run(step.name(), step.command(), config.stepTimeout());
            succeeded = outcome.succeeded();
        } catch (StepExecutionException e) {
            error = e;
        } catch (RuntimeException e) {
            log.error("Unhandled error running step '{}'", step.name(), e);
        } finally {
            try {
                finish(step, succeeded, error);
            } finally {
                gate.release(1);
                taskDone();
            }
        }
    }

    private void markRunning(Step step) {
        guard.lock();
        try {
            step.markRunning();
        } finally {
            guard.unlock();
        }
    }

    private void finish(Step step, boolean succeeded, StepExecutionException error) {
        guard.lock();
        try {
            if (step.status() == StepStatus.RUNNING) {
                step.complete(succeeded);
            } else {
                log.error("Step '{}' finished while {}", step.name(), step.status());
            }
            if (succeeded) {
                log.info("Step '{}' succeeded", step.name());
                return;
            }

            if (error != null) {
                log.warn("Step '{}' failed: {}", step.name(), error.getMessage());
            } else {
                log.warn("Step '{}' failed", step.name());
            }
            if (config.failurePolicy() == FailurePolicy.STOP && !stopRequested) {
                stopRequested = true;
                log.info("Stopping after failure of step '{}'", step.name());
            }
            // Launch failures are recorded on the step only; waits and timeouts surface from run().
            if (error != null && !(error instanceof LaunchException)) {
                if (failure == null) {
                    failure = error;
                } else {
                    failure.addSuppressed(error);
                }
            }
        } finally {
            guard.unlock();
        }
    }

    private void taskDone() {
        guard.lock();
        try {
            inFlight--;
            stateChanged.signalAll();
        } finally {
            guard.unlock();
        }
    }

    private void awaitInFlight() {
        guard.lock();
        try {
            while (inFlight > 0) {
                stateChanged.awaitUninterruptibly();
            }
        } finally {
            guard.unlock();
        }
    }

    private void wake() {
        guard.lock();
        try {
            stateChanged.signalAll();
        } finally {
            guard.unlock();
        }
    }

    private StepExecutionException firstFailure() {
        guard.lock();
        try {
            return failure;
        } finally {
            guard.unlock();
        }
    }

    private boolean allDone() {
        for (Step step : steps) {
            if (!step.isDone()) {
                return false;
            }
        }
        return true;
    }

    private void logUnschedulable() {
        // Idle steps downstream of a failure, directly or through other idle steps.
        Set<Integer> blocked = new HashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Step step : steps) {
                if (step.status() != StepStatus.IDLE || blocked.contains(step.index())) {
                    continue;
                }
                for (int dependency : step.dependencies()) {
                    if (statusView.statusOf(dependency) == StepStatus.FAILED || blocked.contains(dependency)) {
                        changed = blocked.add(step.index());
                        break;
                    }
                }
            }
        }

        List<String> downstream = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        for (Step step : steps) {
            if (step.status() == StepStatus.IDLE) {
                (blocked.contains(step.index()) ? downstream : unresolved).add(step.name());
            }
        }
        if (!downstream.isEmpty()) {
            log.info("Not running steps downstream of a failure: {}", downstream);
        }
        if (!unresolved.isEmpty()) {
            log.warn("Steps can never become runnable, check for a dependency cycle: {}", unresolved);
        }
    }

    private static long count(RunSummary summary, StepStatus status) {
        return summary.statuses().values().stream().filter(s -> s == status).count();
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, "stepflow-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
