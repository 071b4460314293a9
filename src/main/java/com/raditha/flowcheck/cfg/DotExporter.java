package com.raditha.flowcheck.cfg;

/**
 * Renders a control-flow graph in Graphviz DOT syntax for offline inspection.
 * Nodes are declared once with their label and edges refer to node ids, so two
 * statements that share a kind and a line stay distinct.
 */
public class DotExporter {

    public String export(ControlFlowGraph cfg, String graphName) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph ").append(quote(graphName)).append(" {\n");
        dot.append("    mode=\"hier\";\n");
        dot.append("    splines=\"ortho\";\n");
        dot.append("    node [shape=box];\n");

        for (CfgNode node : cfg.nodes()) {
            dot.append("    n").append(node.id())
                    .append(" [label=").append(quote(node.label())).append("];\n");
        }
        for (CfgNode node : cfg.nodes()) {
            for (int successor : cfg.successors(node.id())) {
                dot.append("    n").append(node.id()).append(" -> n").append(successor).append(";\n");
            }
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
