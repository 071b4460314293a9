package com.raditha.flowcheck.fix;

import com.github.javaparser.ast.CompilationUnit;
import com.raditha.flowcheck.equivalence.EquivalenceChecker;
import com.raditha.flowcheck.equivalence.EquivalenceVerdict;
import com.raditha.flowcheck.util.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies proposed fixes to a source file, letting through only the fixes whose result
 * is control-flow equivalent to the code they replace.
 * <p>
 * Fixes are processed bottom-up so the line numbers of the remaining fixes stay valid.
 * Each fix is verified against the text produced by the fixes already accepted, and
 * the file is written once at the end. If that write fails the original text is put
 * back.
 */
public class FixApplier {
    private static final Logger logger = LoggerFactory.getLogger(FixApplier.class);

    private final EquivalenceChecker checker;
    private final FixMode mode;
    private final DiffGenerator diffGenerator;
    private final BufferedReader input;
    private final PrintStream out;

    public FixApplier(EquivalenceChecker checker, FixMode mode) {
        this(checker, mode, System.in, System.out);
    }

    public FixApplier(EquivalenceChecker checker, FixMode mode, InputStream in, PrintStream out) {
        this.checker = checker;
        this.mode = mode;
        this.diffGenerator = new DiffGenerator();
        this.input = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    /**
     * Verify and apply fixes to a file.
     *
     * @throws IOException              if the file cannot be read or written
     * @throws IllegalArgumentException if the file does not parse before any fix
     */
    public FixSession applyAll(Path file, List<Issue> issues) throws IOException {
        FixSession session = new FixSession();
        String originalText = Files.readString(file);
        String current = originalText;
        CompilationUnit currentUnit = SourceParser.parse(current);
        int lowestAppliedStart = Integer.MAX_VALUE;
        double minConfidence = checker.getConfig().minConfidence();

        out.println("\n=== Fix Session Started ===");
        out.println("File: " + file);
        out.println("Mode: " + mode.toCliString());
        out.println("Fixes to verify: " + issues.size());

        List<Issue> ordered = new ArrayList<>(issues);
        ordered.sort(Comparator.comparingInt(Issue::endLine).thenComparingInt(Issue::startLine).reversed());

        for (Issue issue : ordered) {
            out.println("\nVerifying " + issue.describe());
            if (issue.confidence() < minConfidence) {
                session.addSkipped(issue, String.format("Confidence %.2f below threshold %.2f",
                        issue.confidence(), minConfidence));
                out.println("  Skipped: low confidence");
                continue;
            }
            if (issue.endLine() >= lowestAppliedStart) {
                session.addSkipped(issue, "Overlaps a fix that was already applied");
                out.println("  Skipped: overlaps an earlier fix");
                continue;
            }

            String candidate;
            CompilationUnit candidateUnit;
            try {
                candidate = replaceLines(current, issue);
                candidateUnit = SourceParser.parse(candidate);
            } catch (IllegalArgumentException e) {
                session.addRejected(issue, e.getMessage());
                logger.info("Rejected {}: {}", issue.rule(), e.getMessage());
                out.println("  Rejected: " + e.getMessage());
                continue;
            }

            EquivalenceVerdict verdict = checker.check(currentUnit, candidateUnit);
            if (!verdict.isEquivalent()) {
                String reason = reasonOf(verdict);
                session.addRejected(issue, reason);
                logger.info("Rejected {}: {}", issue.rule(), reason);
                out.println("  Rejected: " + reason);
                continue;
            }

            if (mode == FixMode.INTERACTIVE && !confirm(file, current, candidate)) {
                session.addSkipped(issue, "User rejected");
                continue;
            }

            current = candidate;
            currentUnit = candidateUnit;
            lowestAppliedStart = issue.startLine();
            if (mode == FixMode.DRY_RUN) {
                session.addSkipped(issue, "Dry-run mode");
                out.println("  Verified: not applied (dry-run)");
            } else {
                session.addApplied(issue, "Control flow preserved");
                logger.info("Applied {} at lines {}-{}", issue.rule(), issue.startLine(), issue.endLine());
                out.println("  Verified: applied");
            }
        }

        session.setDiff(diffGenerator.generateUnifiedDiff(file.getFileName().toString(), originalText, current));
        if (mode != FixMode.DRY_RUN && !session.getApplied().isEmpty()) {
            write(file, originalText, current);
            session.setWritten(true);
        }
        if (mode == FixMode.DRY_RUN && !session.getDiff().isEmpty()) {
            printDryRunReport(session);
        }

        out.println("\n=== Session Summary ===");
        out.println("Applied: " + session.getApplied().size());
        out.println("Skipped: " + session.getSkipped().size());
        out.println("Rejected: " + session.getRejected().size());
        return session;
    }

    /**
     * Replace the issue's line range with its suggestion, indenting every non-blank
     * suggestion line like the first replaced line. The result keeps the line separator
     * of the text.
     *
     * @throws IllegalArgumentException if the range lies outside the text
     */
    static String replaceLines(String text, Issue issue) {
        String separator = lineSeparatorOf(text);
        List<String> lines = new ArrayList<>(List.of(text.split(separator, -1)));
        if (issue.endLine() > lines.size()) {
            throw new IllegalArgumentException(String.format(
                    "Line range %d-%d is outside the file (%d lines)", issue.startLine(), issue.endLine(), lines.size()));
        }
        String indent = leadingWhitespace(lines.get(issue.startLine() - 1));

        List<String> replacement = new ArrayList<>();
        if (!issue.suggestion().isEmpty()) {
            for (String line : issue.suggestion().split("\r?\n", -1)) {
                replacement.add(line.isBlank() ? line : indent + line);
            }
        }

        List<String> result = new ArrayList<>(lines.subList(0, issue.startLine() - 1));
        result.addAll(replacement);
        result.addAll(lines.subList(issue.endLine(), lines.size()));
        return String.join(separator, result);
    }

    static String lineSeparatorOf(String text) {
        return text.contains("\r\n") ? "\r\n" : "\n";
    }

    private static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return line.substring(0, i);
    }

    private static String reasonOf(EquivalenceVerdict verdict) {
        if (verdict.isInconclusive()) {
            return "Inconclusive, path budget exceeded for " + String.join(", ", verdict.inconclusiveFunctions());
        }
        return verdict.divergences().stream()
                .map(d -> d.function() == null ? d.detail() : d.function() + ": " + d.detail())
                .collect(Collectors.joining("; "));
    }

    private boolean confirm(Path file, String before, String after) {
        out.println("  === DIFF PREVIEW ===");
        out.println(diffGenerator.generateUnifiedDiff(file.getFileName().toString(), before, after));
        out.println("  " + "=".repeat(70));
        out.print("  Apply this fix? (y/n): ");
        out.flush();
        try {
            String response = input.readLine();
            return response != null && (response.trim().equalsIgnoreCase("y") || response.trim().equalsIgnoreCase("yes"));
        } catch (IOException e) {
            logger.warn("Could not read confirmation: {}", e.getMessage());
            return false;
        }
    }

    private void write(Path file, String originalText, String text) throws IOException {
        try {
            Files.writeString(file, text);
        } catch (IOException e) {
            logger.error("Writing {} failed, restoring original content", file);
            try {
                Files.writeString(file, originalText);
            } catch (IOException restoreEx) {
                e.addSuppressed(restoreEx);
            }
            throw e;
        }
    }

    private void printDryRunReport(FixSession session) {
        out.println("\n" + "=".repeat(80));
        out.println("DRY-RUN REPORT: verified fixes that were not applied");
        out.println("=".repeat(80));
        out.println(session.getDiff());
        out.println("=".repeat(80));
    }
}
