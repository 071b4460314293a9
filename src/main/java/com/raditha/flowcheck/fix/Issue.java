package com.raditha.flowcheck.fix;

/**
 * A lint finding with a proposed replacement for a range of lines.
 *
 * @param rule       identifier of the rule that produced the finding
 * @param message    human readable description
 * @param startLine  first line to replace, 1-based
 * @param endLine    last line to replace, inclusive
 * @param suggestion replacement text, without the indentation of the replaced lines
 * @param confidence how sure the rule is about the suggestion (0.0-1.0)
 */
public record Issue(
        String rule,
        String message,
        int startLine,
        int endLine,
        String suggestion,
        double confidence) {

    public Issue {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1");
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine must be >= startLine");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        if (suggestion == null) {
            suggestion = "";
        }
    }

    public String describe() {
        return String.format("%s (lines %d-%d): %s", rule, startLine, endLine, message);
    }
}
