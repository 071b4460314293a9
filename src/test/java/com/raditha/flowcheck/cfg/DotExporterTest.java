package com.raditha.flowcheck.cfg;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.raditha.flowcheck.util.SourceParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DotExporterTest {

    private final DotExporter exporter = new DotExporter();

    private ControlFlowGraph build(String source) {
        CompilationUnit cu = SourceParser.parse(source);
        return new CfgBuilder().build(cu.findFirst(MethodDeclaration.class).orElseThrow());
    }

    @Test
    void testLabelsCarryKindAndLine() {
        ControlFlowGraph cfg = build("""
                class T {
                    void main() {
                        int x = 1;
                        for (int i = 0; i < 10; i++) {
                            x++;
                        }
                    }
                }
                """);

        String dot = exporter.export(cfg, "main");

        assertTrue(dot.startsWith("digraph \"main\" {"));
        assertTrue(dot.contains("n0 [label=\"ENTRY\"];"));
        assertTrue(dot.contains("n1 [label=\"EXIT\"];"));
        assertTrue(dot.contains("n2 [label=\"declaration - line 3\"];"));
        assertTrue(dot.contains("n3 [label=\"declaration - line 4\"];"), "loop init");
        assertTrue(dot.contains("n4 [label=\"for loop - line 4\"];"));
        assertTrue(dot.contains("n5 [label=\"increment statement - line 4\"];"), "loop update");
        assertTrue(dot.contains("n6 [label=\"increment statement - line 5\"];"));
        assertTrue(dot.contains("n0 -> n2;"));
        assertTrue(dot.contains("n5 -> n4;"));
        assertTrue(dot.contains("n4 -> n1;"));
        assertTrue(dot.trim().endsWith("}"));
    }

    @Test
    void testEveryEdgeIsExported() {
        ControlFlowGraph cfg = build("class T { void f(boolean b) { if (b) { a(); } else { c(); } } }");

        String dot = exporter.export(cfg, "f");

        long edges = dot.lines().filter(line -> line.contains("->")).count();
        assertEquals(cfg.edgeCount(), edges);
    }

    @Test
    void testGraphNameIsEscaped() {
        ControlFlowGraph cfg = build("class T { void f() {} }");

        String dot = exporter.export(cfg, "T#f(\"x\")");

        assertTrue(dot.startsWith("digraph \"T#f(\\\"x\\\")\" {"));
    }
}
