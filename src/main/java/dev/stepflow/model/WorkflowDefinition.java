package dev.stepflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deserialized workflow document. Structure only; see
 * {@code WorkflowValidator} for the constraints checked before a run.
 */
public record WorkflowDefinition(
    String version,
    Map<String, String> metadata,
    List<StepDefinition> steps
) {
    public static final String SUPPORTED_VERSION = "1";

    public WorkflowDefinition {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        steps = steps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(steps));
    }
}
