package com.raditha.flowcheck.equivalence;

/**
 * Stages of an equivalence check, in the order they run.
 */
public enum CheckStage {
    FUNCTION_SET("function set"),
    STRUCTURE("structure"),
    PATH_STRUCTURE("path structure"),
    CONTENT("content");

    private final String label;

    CheckStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
