package dev.stepflow.engine;

import dev.stepflow.model.StepStatus;

import java.util.List;

/**
 * Runtime state of one step: its command, the arena indices of its
 * dependencies and its current status.
 *
 * Status changes are made by {@link Workflow} while holding its guard;
 * reads from other threads see the latest value.
 */
public final class Step {

    private final int index;
    private final String name;
    private final String command;
    private final List<Integer> dependencies;
    private volatile StepStatus status = StepStatus.IDLE;

    Step(int index, String name, String command, List<Integer> dependencies) {
        this.index = index;
        this.name = name;
        this.command = command;
        this.dependencies = List.copyOf(dependencies);
    }

    public int index() { return index; }
    public String name() { return name; }
    public String command() { return command; }
    public List<Integer> dependencies() { return dependencies; }
    public StepStatus status() { return status; }

    public boolean isDone() {
        return status.isDone();
    }

    /**
     * True when the step is idle and every dependency has succeeded.
     */
    public boolean shouldRun(StepStatusView siblings) {
        if (status != StepStatus.IDLE) {
            return false;
        }
        for (int dependency : dependencies) {
            if (siblings.statusOf(dependency) != StepStatus.SUCCESS) {
                return false;
            }
        }
        return true;
    }

    void reserve() {
        transition(StepStatus.IDLE, StepStatus.PENDING);
    }

    /** Give back a reservation whose command never started. */
    void abandonReservation() {
        transition(StepStatus.PENDING, StepStatus.IDLE);
    }

    void markRunning() {
        transition(StepStatus.PENDING, StepStatus.RUNNING);
    }

    void complete(boolean succeeded) {
        transition(StepStatus.RUNNING, succeeded ? StepStatus.SUCCESS : StepStatus.FAILED);
    }

    private void transition(StepStatus from, StepStatus to) {
        if (status != from) {
            throw new IllegalStateException(
                "Step '%s' cannot move to %s from %s (expected %s)".formatted(name, to, status, from));
        }
        status = to;
    }

    @Override
    public String toString() {
        return name + "[" + status + "]";
    }
}
