package com.raditha.flowcheck.paths;

import com.raditha.flowcheck.cfg.ControlFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Enumerates every simple path from the entry to the exit of a control-flow graph.
 * <p>
 * The search is an explicit-stack depth first traversal: a node is marked as being on
 * the current path when it is pushed and unmarked when the search backtracks past it,
 * so the same node may appear on many paths but never twice on one. A path can only
 * run through a loop body when it leaves the body by a break, return or throw, since
 * the back edge leads to a header that is already on the path.
 * The number of simple paths can grow exponentially with the number of branches,
 * which is what the {@link PathBudget} guards against.
 */
public class PathEnumerator {
    private static final Logger logger = LoggerFactory.getLogger(PathEnumerator.class);

    private final PathBudget budget;

    public PathEnumerator(PathBudget budget) {
        this.budget = budget;
    }

    public PathBudget getBudget() {
        return budget;
    }

    /**
     * @return all simple entry-to-exit paths in discovery order; empty when the exit is
     *         unreachable (for example a body that loops forever)
     * @throws PathBudgetExceededException when the budget runs out before the search ends
     */
    public List<FlowPath> allSimplePaths(ControlFlowGraph cfg) throws PathBudgetExceededException {
        int size = cfg.size();
        int exit = ControlFlowGraph.EXIT_ID;
        boolean[] onPath = new boolean[size];
        int[] path = new int[size];
        int[] cursor = new int[size];
        List<FlowPath> paths = new ArrayList<>();

        path[0] = ControlFlowGraph.ENTRY_ID;
        onPath[ControlFlowGraph.ENTRY_ID] = true;
        int depth = 1;
        long steps = 1;

        while (depth > 0) {
            int top = path[depth - 1];
            if (top == exit) {
                paths.add(new FlowPath(Arrays.copyOf(path, depth)));
                if (paths.size() > budget.maxPaths()) {
                    throw new PathBudgetExceededException(budget, false);
                }
                onPath[top] = false;
                depth--;
                continue;
            }

            List<Integer> successors = cfg.successors(top);
            if (cursor[depth - 1] < successors.size()) {
                int next = successors.get(cursor[depth - 1]++);
                if (!onPath[next]) {
                    if (++steps > budget.maxSteps()) {
                        throw new PathBudgetExceededException(budget, true);
                    }
                    path[depth] = next;
                    cursor[depth] = 0;
                    onPath[next] = true;
                    depth++;
                }
            } else {
                onPath[top] = false;
                depth--;
            }
        }

        logger.debug("Enumerated {} simple paths in {} steps", paths.size(), steps);
        return paths;
    }
}
