package dev.stepflow.engine;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.stepflow.model.WorkflowDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads workflow documents. YAML is the native format; JSON documents parse too.
 * Parsing checks structure only, see {@link WorkflowValidator} for the rest.
 */
public final class WorkflowLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private WorkflowLoader() {}

    /**
     * Load a workflow definition from a file.
     */
    public static WorkflowDefinition loadFromFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(MAPPER.readValue(in, WorkflowDefinition.class));
        }
    }

    /**
     * Load a workflow definition from a string.
     */
    public static WorkflowDefinition loadFromString(String document) throws IOException {
        return read(MAPPER.readValue(document, WorkflowDefinition.class));
    }

    /**
     * Load a workflow definition from a reader.
     */
    public static WorkflowDefinition loadFromReader(Reader reader) throws IOException {
        return read(MAPPER.readValue(reader, WorkflowDefinition.class));
    }

    private static WorkflowDefinition read(WorkflowDefinition definition) throws IOException {
        if (definition == null) {
            throw new IOException("Empty workflow document");
        }
        return definition;
    }
}
