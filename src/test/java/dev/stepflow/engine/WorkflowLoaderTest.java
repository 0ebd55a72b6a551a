package dev.stepflow.engine;

import dev.stepflow.model.RunConfig;
import dev.stepflow.model.StepDefinition;
import dev.stepflow.model.WorkflowDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowLoaderTest {

    private static final String BUILD_YAML = """
        version: "1"
        metadata:
          owner: platform-team
          repo: billing
        steps:
          - name: fetch
            command: git fetch --all
          - name: build
            command: make build
            depends_on: [fetch]
          - name: test
            command: make test
            depends_on:
              - build
        """;

    @Test
    void loadsWorkflowFromYamlString() throws IOException {
        WorkflowDefinition definition = WorkflowLoader.loadFromString(BUILD_YAML);

        assertThat(definition.version()).isEqualTo("1");
        assertThat(definition.metadata())
            .containsEntry("owner", "platform-team")
            .containsEntry("repo", "billing");
        assertThat(definition.steps()).extracting(StepDefinition::name)
            .containsExactly("fetch", "build", "test");

        StepDefinition fetch = definition.steps().get(0);
        assertThat(fetch.command()).isEqualTo("git fetch --all");
        assertThat(fetch.dependsOn()).isEmpty();
        assertThat(definition.steps().get(2).dependsOn()).containsExactly("build");
    }

    @Test
    void loadsWorkflowFromJsonString() throws IOException {
        String json = """
            {
              "version": "1",
              "steps": [
                { "name": "a", "command": "true" },
                { "name": "b", "command": "true", "depends_on": ["a"] }
              ]
            }
            """;

        WorkflowDefinition definition = WorkflowLoader.loadFromString(json);

        assertThat(definition.metadata()).isEmpty();
        assertThat(definition.steps().get(1).dependsOn()).containsExactly("a");
    }

    @Test
    void numericVersionIsReadAsString() throws IOException {
        WorkflowDefinition definition = WorkflowLoader.loadFromString("""
            version: 1
            steps:
              - name: a
                command: "true"
            """);

        assertThat(definition.version()).isEqualTo("1");
    }

    @Test
    void loadsFromFileAndReader(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("build.yaml");
        Files.writeString(file, BUILD_YAML);

        assertThat(WorkflowLoader.loadFromFile(file)).isEqualTo(WorkflowLoader.loadFromString(BUILD_YAML));
        assertThat(WorkflowLoader.loadFromReader(new StringReader(BUILD_YAML)).steps()).hasSize(3);
    }

    @Test
    void rejectsUnknownFields() {
        String yaml = """
            version: "1"
            steps:
              - name: a
                command: "true"
                dependsOn: [b]
            """;

        assertThatThrownBy(() -> WorkflowLoader.loadFromString(yaml))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("dependsOn");
    }

    @Test
    void rejectsMalformedDocument() {
        assertThatThrownBy(() -> WorkflowLoader.loadFromString("steps: [unclosed"))
            .isInstanceOf(IOException.class);
    }

    @Test
    void loadingTwiceYieldsIndependentWorkflows() throws IOException {
        Workflow first = Workflow.create(WorkflowLoader.loadFromString(BUILD_YAML),
            RunConfig.defaults(), new ScriptedRunner());
        Workflow second = Workflow.create(WorkflowLoader.loadFromString(BUILD_YAML),
            RunConfig.defaults(), new ScriptedRunner());

        assertThat(first).isNotSameAs(second);
        assertThat(first.steps()).extracting(Step::name).containsExactly("fetch", "build", "test");
        assertThat(second.steps()).extracting(Step::dependencies)
            .containsExactlyElementsOf(first.steps().stream().map(Step::dependencies).toList());
        assertThat(first.step("test")).isNotSameAs(second.step("test"));
    }
}
