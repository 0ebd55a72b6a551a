package dev.stepflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final status of every step after a run, in declaration order.
 */
public record RunSummary(Map<String, StepStatus> statuses) {

    public RunSummary {
        statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }

    public StepStatus statusOf(String step) {
        StepStatus status = statuses.get(step);
        if (status == null) {
            throw new IllegalArgumentException("Unknown step: " + step);
        }
        return status;
    }

    /** True only when every step reached SUCCESS. */
    public boolean succeeded() {
        return statuses.values().stream().allMatch(s -> s == StepStatus.SUCCESS);
    }

    public List<String> failedSteps() {
        return stepsWith(StepStatus.FAILED);
    }

    /** Steps that were never dispatched. */
    public List<String> unscheduledSteps() {
        return stepsWith(StepStatus.IDLE);
    }

    private List<String> stepsWith(StepStatus status) {
        return statuses.entrySet().stream()
            .filter(e -> e.getValue() == status)
            .map(Map.Entry::getKey)
            .toList();
    }
}
