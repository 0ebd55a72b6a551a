package dev.stepflow;

import dev.stepflow.cli.StepflowCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new StepflowCli()).execute(args);
        System.exit(exitCode);
    }
}
