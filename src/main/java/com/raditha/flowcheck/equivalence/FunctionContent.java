package com.raditha.flowcheck.equivalence;

import com.raditha.flowcheck.cfg.NodeKind;
import com.raditha.flowcheck.normalization.CanonicalRenderer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Flow-relevant content of one function, in source order.
 *
 * @param conditions branch conditions, switch selectors, case labels and caught types
 * @param loops      structural parts of every loop
 * @param jumps      break, continue, return, throw and yield statements
 * @param statements canonical text of every other non-compound statement
 */
public record FunctionContent(
        List<String> conditions,
        List<LoopPart> loops,
        List<JumpPart> jumps,
        List<String> statements) {

    public FunctionContent {
        conditions = List.copyOf(conditions);
        loops = List.copyOf(loops);
        jumps = List.copyOf(jumps);
        statements = List.copyOf(statements);
    }

    /**
     * Parts of a loop header. Counting loops use all three slots; iterating loops put the
     * loop variable in {@code init} and the iterated source in {@code condition}; while
     * and do loops only have a condition.
     */
    public record LoopPart(NodeKind kind, String init, String condition, String update) {
    }

    /**
     * @param token {@code break}, {@code continue}, {@code return}, {@code throw} or {@code yield}
     * @param label target label, null when absent
     * @param value returned, thrown or yielded expression, empty when absent
     */
    public record JumpPart(String token, String label, String value) {
        public boolean hasLabel() {
            return label != null;
        }
    }

    /**
     * Compare against the candidate version of the same function.
     *
     * @return description of the first difference, empty when the content matches
     */
    public Optional<String> firstDifference(FunctionContent candidate) {
        Optional<String> difference = compareTexts("Condition", conditions, candidate.conditions);
        if (difference.isPresent()) {
            return difference;
        }
        difference = compareLoops(candidate.loops);
        if (difference.isPresent()) {
            return difference;
        }
        difference = compareJumps(candidate.jumps);
        if (difference.isPresent()) {
            return difference;
        }
        return compareTexts("Statement", statements, candidate.statements);
    }

    private static Optional<String> compareTexts(String what, List<String> original, List<String> candidate) {
        if (original.size() != candidate.size()) {
            return Optional.of(String.format("%s count mismatch: original=%d, candidate=%d",
                    what, original.size(), candidate.size()));
        }
        for (int i = 0; i < original.size(); i++) {
            if (!original.get(i).equals(candidate.get(i))) {
                return Optional.of(mismatch(what, original.get(i), candidate.get(i)));
            }
        }
        return Optional.empty();
    }

    private Optional<String> compareLoops(List<LoopPart> candidate) {
        if (loops.size() != candidate.size()) {
            return Optional.of(String.format("Loop count mismatch: original=%d, candidate=%d",
                    loops.size(), candidate.size()));
        }
        for (int i = 0; i < loops.size(); i++) {
            LoopPart a = loops.get(i);
            LoopPart b = candidate.get(i);
            if (a.kind() != b.kind()) {
                return Optional.of(String.format("Loop type mismatch: original=%s, candidate=%s",
                        a.kind().label(), b.kind().label()));
            }
            if (!a.init().equals(b.init())) {
                return Optional.of(mismatch("Loop init", a.init(), b.init()));
            }
            if (!a.condition().equals(b.condition())) {
                return Optional.of(mismatch("Loop condition", a.condition(), b.condition()));
            }
            if (!a.update().equals(b.update())) {
                return Optional.of(mismatch("Loop update", a.update(), b.update()));
            }
        }
        return Optional.empty();
    }

    private Optional<String> compareJumps(List<JumpPart> candidate) {
        if (jumps.size() != candidate.size()) {
            return Optional.of(String.format("Branch statement count mismatch: original=%d, candidate=%d",
                    jumps.size(), candidate.size()));
        }
        for (int i = 0; i < jumps.size(); i++) {
            JumpPart a = jumps.get(i);
            JumpPart b = candidate.get(i);
            if (!a.token().equals(b.token())) {
                return Optional.of(String.format("Branch token mismatch: original=%s, candidate=%s",
                        a.token(), b.token()));
            }
            if (a.hasLabel() != b.hasLabel()) {
                return Optional.of(String.format("Branch label presence mismatch: original=%s, candidate=%s",
                        a.hasLabel(), b.hasLabel()));
            }
            if (!Objects.equals(a.label(), b.label())) {
                return Optional.of(mismatch("Branch label", a.label(), b.label()));
            }
            if (!a.value().equals(b.value())) {
                return Optional.of(mismatch(capitalize(a.token()) + " value", a.value(), b.value()));
            }
        }
        return Optional.empty();
    }

    private static String mismatch(String what, String original, String candidate) {
        return String.format("%s mismatch: original='%s', candidate='%s'", what,
                CanonicalRenderer.oneLine(original), CanonicalRenderer.oneLine(candidate));
    }

    private static String capitalize(String text) {
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
