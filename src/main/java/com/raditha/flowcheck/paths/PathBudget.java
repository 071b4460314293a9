package com.raditha.flowcheck.paths;

/**
 * Limits on simple-path enumeration.
 *
 * @param maxPaths maximum number of complete entry-to-exit paths
 * @param maxSteps maximum number of DFS expansions, complete or not
 */
public record PathBudget(int maxPaths, long maxSteps) {

    public PathBudget {
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("maxPaths must be positive");
        }
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive");
        }
    }
}
