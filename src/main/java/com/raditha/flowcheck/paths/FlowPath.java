package com.raditha.flowcheck.paths;

import com.raditha.flowcheck.cfg.CfgNode;
import com.raditha.flowcheck.cfg.ControlFlowGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A simple entry-to-exit path, stored as the node handles it visits.
 */
public final class FlowPath {
    private final int[] nodeIds;

    FlowPath(int[] nodeIds) {
        this.nodeIds = nodeIds;
    }

    public int length() {
        return nodeIds.length;
    }

    public int nodeIdAt(int index) {
        return nodeIds[index];
    }

    public List<CfgNode> nodes(ControlFlowGraph cfg) {
        List<CfgNode> nodes = new ArrayList<>(nodeIds.length);
        for (int id : nodeIds) {
            nodes.add(cfg.node(id));
        }
        return nodes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FlowPath other && Arrays.equals(nodeIds, other.nodeIds);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(nodeIds);
    }

    @Override
    public String toString() {
        return Arrays.toString(nodeIds);
    }
}
