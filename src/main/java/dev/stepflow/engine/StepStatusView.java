package dev.stepflow.engine;

import dev.stepflow.model.StepStatus;

/**
 * Read-only access to sibling step statuses by arena index.
 */
@FunctionalInterface
public interface StepStatusView {

    StepStatus statusOf(int index);
}
