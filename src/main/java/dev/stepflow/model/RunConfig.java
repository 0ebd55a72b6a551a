package dev.stepflow.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Caller-supplied run settings. Never read from the workflow document.
 */
public record RunConfig(
    int concurrency,
    Duration stepTimeout,
    FailurePolicy failurePolicy
) {
    public static final int DEFAULT_CONCURRENCY = 4;
    public static final Duration DEFAULT_STEP_TIMEOUT = Duration.ofMinutes(10);
    public static final FailurePolicy DEFAULT_FAILURE_POLICY = FailurePolicy.STOP;

    public RunConfig {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive, got " + concurrency);
        }
        Objects.requireNonNull(stepTimeout, "stepTimeout");
        if (stepTimeout.isZero() || stepTimeout.isNegative()) {
            throw new IllegalArgumentException("stepTimeout must be positive, got " + stepTimeout);
        }
        Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    public static RunConfig defaults() {
        return new RunConfig(DEFAULT_CONCURRENCY, DEFAULT_STEP_TIMEOUT, DEFAULT_FAILURE_POLICY);
    }

    public RunConfig withConcurrency(int concurrency) {
        return new RunConfig(concurrency, stepTimeout, failurePolicy);
    }

    public RunConfig withStepTimeout(Duration stepTimeout) {
        return new RunConfig(concurrency, stepTimeout, failurePolicy);
    }

    public RunConfig withFailurePolicy(FailurePolicy failurePolicy) {
        return new RunConfig(concurrency, stepTimeout, failurePolicy);
    }
}
