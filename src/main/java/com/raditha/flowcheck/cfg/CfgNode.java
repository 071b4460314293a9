package com.raditha.flowcheck.cfg;

import com.github.javaparser.ast.Node;

/**
 * A vertex of a {@link ControlFlowGraph}.
 * <p>
 * Nodes are handles into the graph's arena: {@link #id()} is the arena index and
 * identity is by handle, never by the structure of the wrapped syntax node.
 */
public final class CfgNode {
    private final int id;
    private final NodeKind kind;
    private final Node astNode;

    CfgNode(int id, NodeKind kind, Node astNode) {
        this.id = id;
        this.kind = kind;
        this.astNode = astNode;
    }

    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * The statement, loop clause expression, switch entry or catch clause this node
     * stands for. Null for the entry and exit sentinels.
     */
    public Node astNode() {
        return astNode;
    }

    /**
     * Source line of the wrapped syntax node, or -1 when unknown.
     */
    public int line() {
        if (astNode == null) {
            return -1;
        }
        return astNode.getBegin().map(p -> p.line).orElse(-1);
    }

    public String label() {
        if (kind.isSentinel()) {
            return kind.label();
        }
        return kind.label() + " - line " + line();
    }

    @Override
    public String toString() {
        return "#" + id + " " + label();
    }
}
