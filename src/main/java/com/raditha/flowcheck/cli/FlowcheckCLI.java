package com.raditha.flowcheck.cli;

import com.raditha.flowcheck.util.SourceParseException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the control-flow equivalence checker.
 * <p>
 * Usage:
 * java -jar flowcheck.jar check [options] original.java candidate.java
 * java -jar flowcheck.jar cfg [--func name] [-o out.dot] File.java
 * java -jar flowcheck.jar fix --issues issues.json [--mode batch] File.java
 * <p>
 * Configuration priority: CLI arguments > flowcheck.yml > defaults
 */
@Command(name = "flowcheck", mixinStandardHelpOptions = true, version = "flowcheck v1.0.0",
        description = "Control-flow equivalence checker for automated Java fixes",
        subcommands = {CheckCommand.class, CfgCommand.class, FixCommand.class})
@SuppressWarnings("java:S106")
public class FlowcheckCLI implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 2;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Command line with the exit-code mapping used by {@link #main(String[])}.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new FlowcheckCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof SourceParseException) {
                commandLine.getErr().println("Parse error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.getErr().print(failed.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }
}
