package com.raditha.flowcheck.config;

import com.raditha.flowcheck.paths.PathBudget;

/**
 * Configuration for equivalence checking and fix verification.
 *
 * @param maxPaths       maximum number of simple paths enumerated per function
 * @param maxSteps       maximum number of search steps spent per function
 * @param detailedReport include path tries in the transcript
 * @param minConfidence  fixes with a lower confidence are skipped (0.0-1.0)
 */
public record CheckerConfig(
        int maxPaths,
        long maxSteps,
        boolean detailedReport,
        double minConfidence) {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.8;

    public CheckerConfig {
        if (maxPaths < 1) {
            throw new IllegalArgumentException("maxPaths must be >= 1");
        }
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be >= 1");
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0.0 and 1.0");
        }
    }

    /**
     * Standard preset: 10,000 paths per function. Covers ordinary methods with a few
     * dozen branches.
     */
    public static CheckerConfig standard() {
        return new CheckerConfig(10_000, 2_000_000L, false, DEFAULT_MIN_CONFIDENCE);
    }

    /**
     * Quick preset: gives up early on branchy methods, for interactive use.
     */
    public static CheckerConfig quick() {
        return new CheckerConfig(1_000, 200_000L, false, DEFAULT_MIN_CONFIDENCE);
    }

    /**
     * Thorough preset: large budgets for batch runs where an inconclusive answer is costly.
     */
    public static CheckerConfig thorough() {
        return new CheckerConfig(250_000, 50_000_000L, false, DEFAULT_MIN_CONFIDENCE);
    }

    /**
     * Look up a preset by name.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static CheckerConfig preset(String name) {
        return switch (name.toLowerCase()) {
            case "standard" -> standard();
            case "quick" -> quick();
            case "thorough" -> thorough();
            default -> throw new IllegalArgumentException(
                    "Unknown preset: " + name + ". Must be one of: quick, standard, thorough");
        };
    }

    public PathBudget pathBudget() {
        return new PathBudget(maxPaths, maxSteps);
    }

    public CheckerConfig withMaxPaths(int value) {
        return new CheckerConfig(value, maxSteps, detailedReport, minConfidence);
    }

    public CheckerConfig withMaxSteps(long value) {
        return new CheckerConfig(maxPaths, value, detailedReport, minConfidence);
    }

    public CheckerConfig withDetailedReport(boolean value) {
        return new CheckerConfig(maxPaths, maxSteps, value, minConfidence);
    }

    public CheckerConfig withMinConfidence(double value) {
        return new CheckerConfig(maxPaths, maxSteps, detailedReport, value);
    }
}
