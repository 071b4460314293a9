package com.raditha.flowcheck.paths;

import com.raditha.flowcheck.cfg.NodeKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Prefix tree over node-kind sequences.
 * <p>
 * Nodes are held in an arena and refer to their children by index. Two tries are
 * {@link #equals(Object) equal} exactly when they accept the same set of sequences,
 * whatever order those sequences were inserted in.
 */
public final class SequenceTrie {
    private static final int ROOT = 0;

    private final List<TrieNode> arena = new ArrayList<>();
    private int sequenceCount;

    public SequenceTrie() {
        arena.add(new TrieNode());
    }

    /**
     * Add a sequence. Inserting a sequence that is already present changes nothing.
     */
    public void insert(List<NodeKind> sequence) {
        int current = ROOT;
        for (NodeKind kind : sequence) {
            Integer child = arena.get(current).children.get(kind);
            if (child == null) {
                child = arena.size();
                arena.add(new TrieNode());
                arena.get(current).children.put(kind, child);
            }
            current = child;
        }
        TrieNode last = arena.get(current);
        if (!last.terminal) {
            last.terminal = true;
            sequenceCount++;
        }
    }

    public boolean contains(List<NodeKind> sequence) {
        int current = ROOT;
        for (NodeKind kind : sequence) {
            Integer child = arena.get(current).children.get(kind);
            if (child == null) {
                return false;
            }
            current = child;
        }
        return arena.get(current).terminal;
    }

    /**
     * Number of trie nodes, root included.
     */
    public int size() {
        return arena.size();
    }

    /**
     * Number of distinct sequences accepted.
     */
    public int sequenceCount() {
        return sequenceCount;
    }

    public boolean isEmpty() {
        return sequenceCount == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SequenceTrie other)) {
            return false;
        }
        if (size() != other.size() || sequenceCount != other.sequenceCount) {
            return false;
        }
        return nodesEqual(ROOT, other, ROOT);
    }

    private boolean nodesEqual(int index, SequenceTrie other, int otherIndex) {
        TrieNode mine = arena.get(index);
        TrieNode theirs = other.arena.get(otherIndex);
        if (mine.terminal != theirs.terminal || mine.children.size() != theirs.children.size()) {
            return false;
        }
        for (Map.Entry<NodeKind, Integer> child : mine.children.entrySet()) {
            Integer match = theirs.children.get(child.getKey());
            if (match == null || !nodesEqual(child.getValue(), other, match)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hashOf(ROOT);
    }

    private int hashOf(int index) {
        TrieNode node = arena.get(index);
        int hash = node.terminal ? 1 : 0;
        for (Map.Entry<NodeKind, Integer> child : node.children.entrySet()) {
            hash = 31 * hash + child.getKey().hashCode() * 17 + hashOf(child.getValue());
        }
        return hash;
    }

    /**
     * Debug rendering: {@code *} marks the end of a sequence and every child is printed as
     * {@code KIND(...)}, children in declaration order of {@link NodeKind}.
     */
    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        render(ROOT, out);
        return out.toString();
    }

    private void render(int index, StringBuilder out) {
        TrieNode node = arena.get(index);
        if (node.terminal) {
            out.append('*');
        }
        for (Map.Entry<NodeKind, Integer> child : node.children.entrySet()) {
            out.append(child.getKey().name()).append('(');
            render(child.getValue(), out);
            out.append(')');
        }
    }

    private static final class TrieNode {
        private final Map<NodeKind, Integer> children = new EnumMap<>(NodeKind.class);
        private boolean terminal;
    }
}
