package com.raditha.flowcheck.equivalence;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.raditha.flowcheck.cfg.CfgBuilder;
import com.raditha.flowcheck.cfg.ControlFlowGraph;
import com.raditha.flowcheck.cfg.NodeKind;
import com.raditha.flowcheck.config.CheckerConfig;
import com.raditha.flowcheck.equivalence.EquivalenceVerdict.Divergence;
import com.raditha.flowcheck.equivalence.EquivalenceVerdict.Outcome;
import com.raditha.flowcheck.paths.PathBudgetExceededException;
import com.raditha.flowcheck.paths.PathCanonicalizer;
import com.raditha.flowcheck.paths.SequenceTrie;
import com.raditha.flowcheck.util.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Decides whether a candidate version of some code is control-flow equivalent to the
 * original.
 * <p>
 * The check runs four stages and a function only moves on to the next stage when the
 * previous one agreed:
 * <ol>
 * <li>function set: both versions declare the same functions and agree on everything
 * outside function bodies</li>
 * <li>structure: per function, equal node counts and node-kind multisets</li>
 * <li>path structure: per function, equal tries of simple-path kind sequences</li>
 * <li>content: per function, equal conditions, loop headers, jumps and statements</li>
 * </ol>
 * When the path search for a function exceeds the configured budget the function is
 * reported as inconclusive, and the overall answer is never "equivalent".
 * <p>
 * Instances hold configuration only and may be shared between threads. The trees
 * passed in are never modified.
 */
public class EquivalenceChecker {
    private static final Logger logger = LoggerFactory.getLogger(EquivalenceChecker.class);

    private final CheckerConfig config;
    private final CfgBuilder cfgBuilder;
    private final PathCanonicalizer canonicalizer;
    private final FunctionExtractor functionExtractor;
    private final ContentExtractor contentExtractor;

    public EquivalenceChecker() {
        this(CheckerConfig.standard());
    }

    public EquivalenceChecker(CheckerConfig config) {
        this.config = config;
        this.cfgBuilder = new CfgBuilder();
        this.canonicalizer = new PathCanonicalizer(config.pathBudget());
        this.functionExtractor = new FunctionExtractor();
        this.contentExtractor = new ContentExtractor();
    }

    public CheckerConfig getConfig() {
        return config;
    }

    /**
     * Parse and compare two compilation units.
     *
     * @throws IllegalArgumentException if either source does not parse
     */
    public EquivalenceVerdict check(String originalSource, String candidateSource) {
        return check(SourceParser.parse(originalSource), SourceParser.parse(candidateSource));
    }

    public EquivalenceVerdict check(CompilationUnit original, CompilationUnit candidate) {
        Map<String, BodyDeclaration<?>> originalFunctions = functionExtractor.extract(original);
        Map<String, BodyDeclaration<?>> candidateFunctions = functionExtractor.extract(candidate);
        Transcript transcript = new Transcript();

        if (!originalFunctions.keySet().equals(candidateFunctions.keySet())) {
            TreeSet<String> missing = new TreeSet<>(originalFunctions.keySet());
            missing.removeAll(candidateFunctions.keySet());
            TreeSet<String> added = new TreeSet<>(candidateFunctions.keySet());
            added.removeAll(originalFunctions.keySet());
            transcript.diverge(null, CheckStage.FUNCTION_SET, String.format(
                    "Function count mismatch: original=%d, candidate=%d, missing=%s, added=%s",
                    originalFunctions.size(), candidateFunctions.size(), missing, added));
            return transcript.verdict();
        }
        String originalSkeleton = functionExtractor.skeleton(original);
        String candidateSkeleton = functionExtractor.skeleton(candidate);
        if (!originalSkeleton.equals(candidateSkeleton)) {
            transcript.diverge(null, CheckStage.FUNCTION_SET,
                    "Declarations outside function bodies differ: "
                            + firstDifferentLine(originalSkeleton, candidateSkeleton));
            return transcript.verdict();
        }
        transcript.pass(null, CheckStage.FUNCTION_SET,
                originalFunctions.size() + " functions on both sides");

        for (Map.Entry<String, BodyDeclaration<?>> entry : originalFunctions.entrySet()) {
            compareFunction(entry.getKey(), entry.getValue(), candidateFunctions.get(entry.getKey()), transcript);
        }
        return transcript.verdict();
    }

    /**
     * Compare a single pair of functions, skipping the function set stage.
     */
    public EquivalenceVerdict checkFunction(String name, BodyDeclaration<?> original,
            BodyDeclaration<?> candidate) {
        Transcript transcript = new Transcript();
        compareFunction(name, original, candidate, transcript);
        return transcript.verdict();
    }

    private void compareFunction(String name, BodyDeclaration<?> original, BodyDeclaration<?> candidate,
            Transcript transcript) {
        ControlFlowGraph originalCfg = cfgBuilder.build(original);
        ControlFlowGraph candidateCfg = cfgBuilder.build(candidate);

        if (!compareStructure(name, originalCfg, candidateCfg, transcript)) {
            return;
        }
        if (!comparePaths(name, originalCfg, candidateCfg, transcript)) {
            return;
        }

        Optional<String> difference = contentExtractor.extract(original)
                .firstDifference(contentExtractor.extract(candidate));
        if (difference.isPresent()) {
            transcript.diverge(name, CheckStage.CONTENT, difference.get());
            return;
        }
        transcript.pass(name, CheckStage.CONTENT, "conditions, loops, jumps and statements match");
        transcript.line(String.format("Function '%s' CFGs are equivalent", name));
    }

    private static String firstDifferentLine(String original, String candidate) {
        String[] originalLines = original.split("\\R");
        String[] candidateLines = candidate.split("\\R");
        int common = Math.min(originalLines.length, candidateLines.length);
        int i = 0;
        while (i < common && originalLines[i].equals(candidateLines[i])) {
            i++;
        }
        String left = i < originalLines.length ? originalLines[i].trim() : "";
        String right = i < candidateLines.length ? candidateLines[i].trim() : "";
        return String.format("original='%s', candidate='%s'", left, right);
    }

    private boolean compareStructure(String name, ControlFlowGraph original, ControlFlowGraph candidate,
            Transcript transcript) {
        if (original.size() != candidate.size()) {
            transcript.diverge(name, CheckStage.STRUCTURE, String.format(
                    "Block count mismatch: original=%d, candidate=%d", original.size(), candidate.size()));
            return false;
        }
        Map<NodeKind, Integer> originalKinds = original.kindHistogram();
        Map<NodeKind, Integer> candidateKinds = candidate.kindHistogram();
        if (!originalKinds.equals(candidateKinds)) {
            transcript.diverge(name, CheckStage.STRUCTURE, String.format(
                    "Node type distribution mismatch: original=%s, candidate=%s", originalKinds, candidateKinds));
            return false;
        }
        transcript.pass(name, CheckStage.STRUCTURE, original.size() + " nodes with matching kinds");
        return true;
    }

    private boolean comparePaths(String name, ControlFlowGraph original, ControlFlowGraph candidate,
            Transcript transcript) {
        SequenceTrie originalTrie;
        SequenceTrie candidateTrie;
        try {
            originalTrie = canonicalizer.canonicalize(original);
            candidateTrie = canonicalizer.canonicalize(candidate);
        } catch (PathBudgetExceededException e) {
            logger.warn("Function {}: {}", name, e.getMessage());
            transcript.inconclusive(name, e.getMessage());
            return false;
        }

        if (config.detailedReport()) {
            transcript.line(String.format("Function '%s' original paths: %s", name, originalTrie));
            transcript.line(String.format("Function '%s' candidate paths: %s", name, candidateTrie));
        }
        if (!originalTrie.equals(candidateTrie)) {
            transcript.diverge(name, CheckStage.PATH_STRUCTURE, String.format(
                    "Path structure mismatch: original has %d path shapes, candidate has %d",
                    originalTrie.sequenceCount(), candidateTrie.sequenceCount()));
            return false;
        }
        if (originalTrie.isEmpty()) {
            transcript.pass(name, CheckStage.PATH_STRUCTURE,
                    "no path reaches the exit on either side, vacuously equal");
        } else {
            transcript.pass(name, CheckStage.PATH_STRUCTURE,
                    originalTrie.sequenceCount() + " path shapes match");
        }
        return true;
    }

    /**
     * Accumulates transcript lines and divergences while a check runs.
     */
    private static final class Transcript {
        private final List<String> lines = new ArrayList<>();
        private final List<Divergence> divergences = new ArrayList<>();
        private final List<String> inconclusive = new ArrayList<>();

        void line(String text) {
            lines.add(text);
        }

        void pass(String function, CheckStage stage, String detail) {
            logger.debug("{} {}: OK ({})", describe(function), stage.label(), detail);
            lines.add(String.format("%s %s: OK (%s)", describe(function), stage.label(), detail));
        }

        void diverge(String function, CheckStage stage, String detail) {
            logger.debug("{} {}: FAILED ({})", describe(function), stage.label(), detail);
            divergences.add(new Divergence(function, stage, detail));
            lines.add(String.format("%s %s: FAILED (%s)", describe(function), stage.label(), detail));
        }

        void inconclusive(String function, String detail) {
            inconclusive.add(function);
            lines.add(String.format("%s %s: INCONCLUSIVE (%s)", describe(function),
                    CheckStage.PATH_STRUCTURE.label(), detail));
        }

        EquivalenceVerdict verdict() {
            Outcome outcome;
            if (!divergences.isEmpty()) {
                outcome = Outcome.NOT_EQUIVALENT;
            } else if (!inconclusive.isEmpty()) {
                outcome = Outcome.INCONCLUSIVE;
            } else {
                outcome = Outcome.EQUIVALENT;
            }
            lines.add("Result: " + outcome);
            return new EquivalenceVerdict(outcome, lines, divergences, inconclusive);
        }

        private static String describe(String function) {
            return function == null ? "All functions" : "Function '" + function + "'";
        }
    }
}
