package com.raditha.flowcheck.cfg;

/**
 * Syntactic category of a control-flow graph node.
 * The path canonicalizer compares graphs through these tags only, so two statements of
 * the same kind are interchangeable at the path-structure stage.
 */
public enum NodeKind {
    ENTRY("ENTRY"),
    EXIT("EXIT"),
    DECLARATION("declaration"),
    ASSIGNMENT("assignment"),
    INCREMENT("increment statement"),
    CALL("call statement"),
    EXPRESSION("expression statement"),
    IF("if statement"),
    FOR("for loop"),
    FOR_EACH("for-each loop"),
    WHILE("while loop"),
    DO("do-while loop"),
    SWITCH("switch statement"),
    CASE("case clause"),
    /** Covers both break and continue. */
    BRANCH("branch statement"),
    RETURN("return statement"),
    THROW("throw statement"),
    YIELD("yield statement"),
    LABELED("labeled statement"),
    TRY("try statement"),
    CATCH("catch clause"),
    SYNCHRONIZED("synchronized statement"),
    ASSERT("assert statement"),
    CONSTRUCTOR_CALL("constructor call"),
    LOCAL_TYPE("local type declaration"),
    EMPTY("empty statement"),
    OTHER("statement");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    /**
     * Human readable label, used when exporting graphs.
     */
    public String label() {
        return label;
    }

    public boolean isSentinel() {
        return this == ENTRY || this == EXIT;
    }

    public boolean isLoop() {
        return this == FOR || this == FOR_EACH || this == WHILE || this == DO;
    }
}
