package com.raditha.flowcheck.equivalence;

import java.util.List;

/**
 * Outcome of comparing an original and a candidate version of some code.
 *
 * @param outcome      overall answer
 * @param transcript   one line per stage per function, in the order the checks ran
 * @param divergences  every failed stage; empty unless the outcome is NOT_EQUIVALENT
 * @param inconclusiveFunctions functions whose path budget ran out
 */
public record EquivalenceVerdict(
        Outcome outcome,
        List<String> transcript,
        List<Divergence> divergences,
        List<String> inconclusiveFunctions) {

    public EquivalenceVerdict {
        transcript = List.copyOf(transcript);
        divergences = List.copyOf(divergences);
        inconclusiveFunctions = List.copyOf(inconclusiveFunctions);
    }

    public enum Outcome {
        EQUIVALENT,
        NOT_EQUIVALENT,
        /** The search budget ran out before an answer was reached. Treated as a failure. */
        INCONCLUSIVE
    }

    /**
     * A stage that failed for one function.
     *
     * @param function function key, or null for the function set stage
     * @param stage    the stage that failed
     * @param detail   human readable description of the first difference
     */
    public record Divergence(String function, CheckStage stage, String detail) {
    }

    public boolean isEquivalent() {
        return outcome == Outcome.EQUIVALENT;
    }

    public boolean isInconclusive() {
        return outcome == Outcome.INCONCLUSIVE;
    }

    /**
     * The transcript as a single multi-line string.
     */
    public String report() {
        return String.join(System.lineSeparator(), transcript);
    }
}
