package com.raditha.flowcheck.cli;

import com.raditha.flowcheck.config.CheckerConfig;
import com.raditha.flowcheck.equivalence.EquivalenceChecker;
import com.raditha.flowcheck.fix.FixApplier;
import com.raditha.flowcheck.fix.FixMode;
import com.raditha.flowcheck.fix.FixSession;
import com.raditha.flowcheck.fix.Issue;
import com.raditha.flowcheck.fix.IssueLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Applies proposed fixes to a file, keeping only those that preserve control flow.
 * Exits with 1 when any fix was rejected.
 */
@Command(name = "fix", mixinStandardHelpOptions = true,
        description = "Apply proposed fixes after verifying control-flow equivalence")
public class FixCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Java source file to fix", paramLabel = "<file>")
    Path file;

    @Option(names = "--issues", required = true, description = "JSON file with the proposed fixes",
            paramLabel = "<path>")
    Path issuesFile;

    @Option(names = "--mode", description = "Fix mode: interactive, batch or dry-run", paramLabel = "<mode>",
            converter = FixModeConverter.class)
    FixMode mode = FixMode.BATCH;

    @Option(names = "--min-confidence", description = "Skip fixes below this confidence (0.0-1.0)",
            paramLabel = "<n>")
    Double minConfidence;

    @Mixin
    ConfigOptions configOptions = new ConfigOptions();

    @Override
    public Integer call() throws Exception {
        CheckerConfig config = configOptions.load();
        if (minConfidence != null) {
            config = config.withMinConfidence(minConfidence);
        }
        List<Issue> issues = IssueLoader.load(issuesFile);
        FixSession session = new FixApplier(new EquivalenceChecker(config), mode).applyAll(file, issues);
        return session.hasRejections() ? CheckCommand.NOT_EQUIVALENT : 0;
    }

    /**
     * Custom converter for FixMode enum to handle CLI string values.
     */
    public static class FixModeConverter implements ITypeConverter<FixMode> {
        @Override
        public FixMode convert(String value) throws Exception {
            return FixMode.fromString(value);
        }
    }
}
