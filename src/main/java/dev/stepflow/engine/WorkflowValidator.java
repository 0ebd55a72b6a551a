package dev.stepflow.engine;

import dev.stepflow.model.StepDefinition;
import dev.stepflow.model.WorkflowDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates workflow definitions before a {@link Workflow} is built from them.
 * Dependency cycles are not detected.
 */
public final class WorkflowValidator {

    private WorkflowValidator() {}

    /**
     * Validate a workflow definition. Returns an empty list if valid,
     * or one message per violated constraint.
     */
    public static List<String> validate(WorkflowDefinition definition) {
        var errors = new ArrayList<String>();

        if (!WorkflowDefinition.SUPPORTED_VERSION.equals(definition.version())) {
            errors.add("Unsupported workflow version '%s' (supported: '%s')"
                .formatted(definition.version(), WorkflowDefinition.SUPPORTED_VERSION));
        }

        Set<String> declared = new HashSet<>();
        List<StepDefinition> steps = definition.steps();
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            if (step == null) {
                errors.add("Step #%d is empty".formatted(i + 1));
                continue;
            }
            if (step.name() == null || step.name().isBlank()) {
                errors.add("Step #%d has missing or empty name".formatted(i + 1));
            } else if (!declared.add(step.name())) {
                errors.add("Duplicate step name '%s'".formatted(step.name()));
            }
        }

        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            if (step == null) {
                continue;
            }
            String label = step.name() == null || step.name().isBlank()
                ? "#" + (i + 1) : "'" + step.name() + "'";

            if (step.command() == null || step.command().isBlank()) {
                errors.add("Step %s has missing or empty command".formatted(label));
            }

            for (String dependency : step.dependsOn()) {
                if (dependency == null || dependency.isBlank()) {
                    errors.add("Step %s has an empty depends_on entry".formatted(label));
                } else if (!declared.contains(dependency)) {
                    errors.add("Step %s depends on unknown step '%s'".formatted(label, dependency));
                }
            }
        }

        return errors;
    }
}
