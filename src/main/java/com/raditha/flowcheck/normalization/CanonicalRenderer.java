package com.raditha.flowcheck.normalization;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.PrinterConfiguration;

import java.util.List;

/**
 * Renders syntax nodes as canonical text for content comparison.
 * <p>
 * Rendering works on a clone: source positions and comments are stripped from the
 * copy and it is printed with the default pretty printer, so two nodes that differ only
 * in layout or comments render identically while any change to an identifier, operator
 * or literal shows up in the text. The caller's tree is never modified.
 */
public class CanonicalRenderer {

    private final DefaultPrettyPrinter printer;

    public CanonicalRenderer() {
        PrinterConfiguration configuration = new DefaultPrinterConfiguration()
                .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS))
                .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_JAVADOC));
        this.printer = new DefaultPrettyPrinter(configuration);
    }

    /**
     * @param node node to render, may be null
     * @return canonical text, or the empty string for null
     */
    public String render(Node node) {
        if (node == null) {
            return "";
        }
        return printer.print(strip(node));
    }

    /**
     * Render several nodes and join them with {@code ", "}, as for the initialisers of a
     * counting loop.
     */
    public String renderAll(List<? extends Node> nodes) {
        StringBuilder text = new StringBuilder();
        for (Node node : nodes) {
            if (text.length() > 0) {
                text.append(", ");
            }
            text.append(render(node));
        }
        return text.toString();
    }

    /**
     * Canonical text folded onto one line, for diagnostics.
     */
    public String renderOneLine(Node node) {
        return oneLine(render(node));
    }

    public static String oneLine(String text) {
        return text.replaceAll("\\R\\s*", " ").trim();
    }

    /**
     * Copy of the node without token ranges, positions or comments.
     */
    Node strip(Node node) {
        Node copy = node.clone();
        for (Node descendant : copy.findAll(Node.class)) {
            descendant.setTokenRange(null);
            descendant.setRange(null);
        }
        for (Comment comment : copy.getAllContainedComments()) {
            comment.remove();
        }
        copy.removeComment();
        return copy;
    }
}
