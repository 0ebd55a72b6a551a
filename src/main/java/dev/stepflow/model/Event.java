package dev.stepflow.model;

import java.time.Instant;

/**
 * Immutable lifecycle notification for one step execution.
 */
public record Event(
    long sequence,
    String step,
    EventKind kind,
    Integer exitStatus, // nullable — only set for RUN_FAIL
    Instant emittedAt
) {

    public boolean hasExitStatus() {
        return exitStatus != null;
    }

    @Override
    public String toString() {
        return hasExitStatus()
            ? "#%d %s %s(%d)".formatted(sequence, step, kind, exitStatus)
            : "#%d %s %s".formatted(sequence, step, kind);
    }
}
