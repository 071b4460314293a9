package com.raditha.flowcheck.paths;

/**
 * Thrown when enumerating the simple paths of a graph would exceed its {@link PathBudget}.
 * No partial result is ever produced in that case.
 */
public class PathBudgetExceededException extends Exception {
    private final PathBudget budget;
    private final boolean stepLimit;

    public PathBudgetExceededException(PathBudget budget, boolean stepLimit) {
        super(stepLimit
                ? "Path budget exceeded: more than " + budget.maxSteps() + " search steps"
                : "Path budget exceeded: more than " + budget.maxPaths() + " paths");
        this.budget = budget;
        this.stepLimit = stepLimit;
    }

    public PathBudget getBudget() {
        return budget;
    }

    /**
     * True when the step limit tripped, false when the path limit did.
     */
    public boolean isStepLimit() {
        return stepLimit;
    }
}
