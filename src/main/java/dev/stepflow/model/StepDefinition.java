package dev.stepflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One entry of a workflow document's {@code steps} list.
 */
public record StepDefinition(
    String name,
    String command,
    @JsonProperty("depends_on") List<String> dependsOn
) {
    public StepDefinition {
        dependsOn = dependsOn == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(dependsOn));
    }
}
