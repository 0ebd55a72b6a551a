package dev.stepflow.cli;

import ch.qos.logback.classic.Level;
import dev.stepflow.engine.CancellationSignal;
import dev.stepflow.engine.RunCancelledException;
import dev.stepflow.engine.Step;
import dev.stepflow.engine.Workflow;
import dev.stepflow.engine.WorkflowLoader;
import dev.stepflow.engine.WorkflowValidationException;
import dev.stepflow.model.FailurePolicy;
import dev.stepflow.model.RunConfig;
import dev.stepflow.model.RunSummary;
import dev.stepflow.model.WorkflowDefinition;
import dev.stepflow.runner.LoggingNotifier;
import dev.stepflow.runner.ProcessRunner;
import dev.stepflow.runner.Sink;
import dev.stepflow.runner.StepExecutionException;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI entry point: load a workflow file and run it.
 */
@Command(
    name = "stepflow",
    mixinStandardHelpOptions = true,
    version = "stepflow 0.1.0",
    description = "Run a workflow of external commands, respecting dependencies and a concurrency limit."
)
public class StepflowCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_STEP_FAILED = 1;
    static final int EXIT_INVALID_WORKFLOW = 2;
    static final int EXIT_CANCELLED = 3;

    @Parameters(index = "0", description = "Workflow file (YAML or JSON)")
    private Path workflowFile;

    @Option(names = {"-j", "--concurrency"}, defaultValue = "" + RunConfig.DEFAULT_CONCURRENCY,
        description = "Maximum number of steps running at once (default: ${DEFAULT-VALUE})")
    private int concurrency;

    @Option(names = {"-t", "--timeout"}, defaultValue = "600",
        description = "Per-step timeout in seconds (default: ${DEFAULT-VALUE})")
    private long timeoutSeconds;

    @Option(names = "--deadline", description = "Cancel the run after this many seconds")
    private Long deadlineSeconds;

    @Option(names = "--continue-on-failure",
        description = "Keep running independent steps after a failure")
    private boolean continueOnFailure;

    @Option(names = "--dry-run", description = "Validate and print the plan without executing")
    private boolean dryRun;

    @Option(names = "--verbose", description = "Log scheduling decisions")
    private boolean verbose;

    private final PrintStream out;
    private final PrintStream err;

    public StepflowCli() {
        this(System.out, System.err);
    }

    StepflowCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.stepflow")).setLevel(Level.DEBUG);
        }

        RunConfig config;
        try {
            config = new RunConfig(concurrency, Duration.ofSeconds(timeoutSeconds),
                continueOnFailure ? FailurePolicy.CONTINUE : FailurePolicy.STOP);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID_WORKFLOW;
        }
        if (deadlineSeconds != null && deadlineSeconds < 0) {
            err.println("Error: deadline must not be negative, got " + deadlineSeconds);
            return EXIT_INVALID_WORKFLOW;
        }

        Workflow workflow;
        try {
            WorkflowDefinition definition = WorkflowLoader.loadFromFile(workflowFile);
            workflow = Workflow.create(definition, config, new ProcessRunner(Sink.console(), new LoggingNotifier()));
        } catch (IOException e) {
            err.println("Error: cannot read " + workflowFile + ": " + e.getMessage());
            return EXIT_INVALID_WORKFLOW;
        } catch (WorkflowValidationException e) {
            err.println("Error: invalid workflow " + workflowFile);
            e.errors().forEach(message -> err.println("  - " + message));
            return EXIT_INVALID_WORKFLOW;
        }

        if (dryRun) {
            printPlan(workflow);
            return EXIT_OK;
        }

        CancellationSignal signal = deadlineSeconds == null
            ? CancellationSignal.create()
            : CancellationSignal.withTimeout(Duration.ofSeconds(deadlineSeconds));
        try {
            RunSummary summary = workflow.run(signal);
            printSummary(summary);
            return summary.succeeded() ? EXIT_OK : EXIT_STEP_FAILED;
        } catch (StepExecutionException e) {
            err.println("Error: " + e.getMessage());
            printSummary(workflow.summary());
            return EXIT_STEP_FAILED;
        } catch (RunCancelledException e) {
            err.println("Error: " + e.getMessage());
            printSummary(workflow.summary());
            return EXIT_CANCELLED;
        }
    }

    private void printPlan(Workflow workflow) {
        out.println("Workflow version " + workflow.version() + ", " + workflow.steps().size() + " step(s):");
        workflow.metadata().forEach((key, value) -> out.println("  # " + key + ": " + value));
        for (Step step : workflow.steps()) {
            String dependsOn = step.dependencies().stream()
                .map(index -> workflow.steps().get(index).name())
                .collect(Collectors.joining(", "));
            out.println("  " + step.name() + ": " + step.command()
                + (dependsOn.isEmpty() ? "" : "  (after " + dependsOn + ")"));
        }
    }

    private void printSummary(RunSummary summary) {
        out.println("Summary:");
        summary.statuses().forEach((step, status) -> out.println("  " + step + ": " + status));
    }
}
