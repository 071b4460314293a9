package com.raditha.flowcheck.paths;

import com.raditha.flowcheck.cfg.ControlFlowGraph;
import com.raditha.flowcheck.cfg.NodeKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reduces a control-flow graph to the set of node-kind sequences along its simple paths,
 * folded into a {@link SequenceTrie}. Graphs with the same trie are structurally
 * indistinguishable at the path level.
 */
public class PathCanonicalizer {
    private final PathEnumerator enumerator;

    public PathCanonicalizer(PathBudget budget) {
        this(new PathEnumerator(budget));
    }

    public PathCanonicalizer(PathEnumerator enumerator) {
        this.enumerator = enumerator;
    }

    public List<FlowPath> allSimplePaths(ControlFlowGraph cfg) throws PathBudgetExceededException {
        return enumerator.allSimplePaths(cfg);
    }

    public List<List<NodeKind>> toSequences(ControlFlowGraph cfg, Collection<FlowPath> paths) {
        List<List<NodeKind>> sequences = new ArrayList<>(paths.size());
        for (FlowPath path : paths) {
            List<NodeKind> sequence = new ArrayList<>(path.length());
            for (int i = 0; i < path.length(); i++) {
                sequence.add(cfg.node(path.nodeIdAt(i)).kind());
            }
            sequences.add(sequence);
        }
        return sequences;
    }

    public SequenceTrie buildTrie(Collection<List<NodeKind>> sequences) {
        SequenceTrie trie = new SequenceTrie();
        for (List<NodeKind> sequence : sequences) {
            trie.insert(sequence);
        }
        return trie;
    }

    /**
     * Enumerate, canonicalise and fold in one go.
     */
    public SequenceTrie canonicalize(ControlFlowGraph cfg) throws PathBudgetExceededException {
        return buildTrie(toSequences(cfg, allSimplePaths(cfg)));
    }
}
