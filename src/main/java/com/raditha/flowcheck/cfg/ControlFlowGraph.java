package com.raditha.flowcheck.cfg;

import com.github.javaparser.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Control-flow graph of a single function body.
 * <p>
 * Nodes live in an arena indexed by {@link CfgNode#id()}; node 0 is the entry sentinel
 * and node 1 the exit sentinel. Adjacency lists keep edge insertion order, which makes
 * traversal deterministic for a given tree. Instances are immutable once built.
 */
public final class ControlFlowGraph {
    public static final int ENTRY_ID = 0;
    public static final int EXIT_ID = 1;

    private final List<CfgNode> nodes;
    private final List<List<Integer>> successors;
    private final List<List<Integer>> predecessors;

    private ControlFlowGraph(List<CfgNode> nodes, List<List<Integer>> successors,
            List<List<Integer>> predecessors) {
        this.nodes = nodes;
        this.successors = successors;
        this.predecessors = predecessors;
    }

    public CfgNode entry() {
        return nodes.get(ENTRY_ID);
    }

    public CfgNode exit() {
        return nodes.get(EXIT_ID);
    }

    public CfgNode node(int id) {
        return nodes.get(id);
    }

    /**
     * All nodes including the sentinels, in creation order.
     */
    public List<CfgNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public List<Integer> successors(int id) {
        return successors.get(id);
    }

    public List<Integer> predecessors(int id) {
        return predecessors.get(id);
    }

    public List<CfgNode> successors(CfgNode node) {
        return resolve(successors.get(node.id()));
    }

    public List<CfgNode> predecessors(CfgNode node) {
        return resolve(predecessors.get(node.id()));
    }

    public boolean hasEdge(int from, int to) {
        return successors.get(from).contains(to);
    }

    public int edgeCount() {
        int count = 0;
        for (List<Integer> out : successors) {
            count += out.size();
        }
        return count;
    }

    /**
     * Multiset of node kinds, sentinels included.
     */
    public Map<NodeKind, Integer> kindHistogram() {
        Map<NodeKind, Integer> histogram = new EnumMap<>(NodeKind.class);
        for (CfgNode node : nodes) {
            histogram.merge(node.kind(), 1, Integer::sum);
        }
        return histogram;
    }

    private List<CfgNode> resolve(List<Integer> ids) {
        List<CfgNode> result = new ArrayList<>(ids.size());
        for (int id : ids) {
            result.add(nodes.get(id));
        }
        return result;
    }

    /**
     * Mutable arena used while a graph is being built.
     */
    static final class Builder {
        private final List<CfgNode> nodes = new ArrayList<>();
        private final List<List<Integer>> successors = new ArrayList<>();
        private final List<List<Integer>> predecessors = new ArrayList<>();

        Builder() {
            addNode(NodeKind.ENTRY, null);
            addNode(NodeKind.EXIT, null);
        }

        int addNode(NodeKind kind, Node astNode) {
            int id = nodes.size();
            nodes.add(new CfgNode(id, kind, astNode));
            successors.add(new ArrayList<>());
            predecessors.add(new ArrayList<>());
            return id;
        }

        void addEdge(int from, int to) {
            List<Integer> out = successors.get(from);
            if (!out.contains(to)) {
                out.add(to);
                predecessors.get(to).add(from);
            }
        }

        List<Integer> successorsOf(int id) {
            return successors.get(id);
        }

        ControlFlowGraph build() {
            List<List<Integer>> frozenSucc = new ArrayList<>(successors.size());
            List<List<Integer>> frozenPred = new ArrayList<>(predecessors.size());
            for (int i = 0; i < nodes.size(); i++) {
                frozenSucc.add(List.copyOf(successors.get(i)));
                frozenPred.add(List.copyOf(predecessors.get(i)));
            }
            return new ControlFlowGraph(List.copyOf(nodes),
                    Collections.unmodifiableList(frozenSucc),
                    Collections.unmodifiableList(frozenPred));
        }
    }
}
