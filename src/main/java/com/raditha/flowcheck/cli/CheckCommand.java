package com.raditha.flowcheck.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.flowcheck.config.CheckerConfig;
import com.raditha.flowcheck.equivalence.EquivalenceChecker;
import com.raditha.flowcheck.equivalence.EquivalenceVerdict;
import com.raditha.flowcheck.util.SourceParser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Compares two versions of a Java source file.
 * Exit code 0 means equivalent, 1 not equivalent and 5 inconclusive.
 */
@Command(name = "check", mixinStandardHelpOptions = true,
        description = "Check whether a candidate source file is control-flow equivalent to the original")
public class CheckCommand implements Callable<Integer> {

    static final int NOT_EQUIVALENT = 1;
    static final int INCONCLUSIVE = 5;

    private static final ObjectMapper mapper = new ObjectMapper();

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Original source file", paramLabel = "<original>")
    Path original;

    @Parameters(index = "1", description = "Candidate source file", paramLabel = "<candidate>")
    Path candidate;

    @Option(names = "--json", description = "Output the verdict in JSON format")
    boolean jsonOutput = false;

    @Mixin
    ConfigOptions configOptions = new ConfigOptions();

    /**
     * JSON view of a verdict.
     */
    public record VerdictDTO(
            String outcome,
            boolean equivalent,
            List<String> transcript,
            List<DivergenceDTO> divergences,
            List<String> inconclusiveFunctions) {
    }

    public record DivergenceDTO(String function, String stage, String detail) {
    }

    @Override
    public Integer call() throws Exception {
        CheckerConfig config = configOptions.load();
        EquivalenceChecker checker = new EquivalenceChecker(config);
        EquivalenceVerdict verdict = checker.check(SourceParser.parse(original), SourceParser.parse(candidate));

        PrintWriter out = spec.commandLine().getOut();
        if (jsonOutput) {
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDTO(verdict)));
        } else {
            printReport(out, verdict);
        }
        out.flush();

        return switch (verdict.outcome()) {
            case EQUIVALENT -> 0;
            case NOT_EQUIVALENT -> NOT_EQUIVALENT;
            case INCONCLUSIVE -> INCONCLUSIVE;
        };
    }

    private void printReport(PrintWriter out, EquivalenceVerdict verdict) {
        out.println("=".repeat(80));
        out.println("CONTROL-FLOW EQUIVALENCE REPORT");
        out.println("=".repeat(80));
        out.println("Original:  " + original);
        out.println("Candidate: " + candidate);
        out.println();
        verdict.transcript().forEach(out::println);
        out.println("=".repeat(80));
    }

    static VerdictDTO toDTO(EquivalenceVerdict verdict) {
        List<DivergenceDTO> divergences = verdict.divergences().stream()
                .map(d -> new DivergenceDTO(d.function(), d.stage().name(), d.detail()))
                .toList();
        return new VerdictDTO(verdict.outcome().name(), verdict.isEquivalent(), verdict.transcript(),
                divergences, verdict.inconclusiveFunctions());
    }
}
