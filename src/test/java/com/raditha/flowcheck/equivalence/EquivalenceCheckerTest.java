package com.raditha.flowcheck.equivalence;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.raditha.flowcheck.config.CheckerConfig;
import com.raditha.flowcheck.equivalence.EquivalenceVerdict.Divergence;
import com.raditha.flowcheck.equivalence.EquivalenceVerdict.Outcome;
import com.raditha.flowcheck.util.SourceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EquivalenceCheckerTest {

    private EquivalenceChecker checker;

    @BeforeEach
    void setUp() {
        checker = new EquivalenceChecker();
    }

    private static String inClass(String... methods) {
        return "class T {\n" + String.join("\n", methods) + "\n}";
    }

    private EquivalenceVerdict check(String original, String candidate) {
        return checker.check(inClass(original), inClass(candidate));
    }

    private static Divergence onlyDivergence(EquivalenceVerdict verdict) {
        assertEquals(1, verdict.divergences().size(), verdict.report());
        return verdict.divergences().get(0);
    }

    private static String sequentialIfs(int count) {
        StringBuilder body = new StringBuilder("void f(int a) {\n");
        for (int i = 0; i < count; i++) {
            body.append("    if (a > ").append(i).append(") { a++; }\n");
        }
        return body.append("}").toString();
    }

    @Nested
    class Scenarios {

        @Test
        void testRemovingElseAfterReturnIsEquivalent() {
            EquivalenceVerdict verdict = check(
                    "int f(boolean c) { if (c) { return 1; } else { return 2; } }",
                    "int f(boolean c) { if (c) { return 1; } return 2; }");

            assertTrue(verdict.isEquivalent(), verdict.report());
            assertEquals(Outcome.EQUIVALENT, verdict.outcome());
            assertTrue(verdict.divergences().isEmpty());
            assertEquals("Result: EQUIVALENT", verdict.transcript().get(verdict.transcript().size() - 1));
        }

        @Test
        void testRemovingElseWithChangedHoistedCodeIsNotEquivalent() {
            EquivalenceVerdict verdict = check(
                    "int f(boolean c) { if (c) { return 1; } else { a(); return 2; } }",
                    "int f(boolean c) { if (c) { return 1; } b(); return 2; }");

            assertEquals(Outcome.NOT_EQUIVALENT, verdict.outcome());
            Divergence divergence = onlyDivergence(verdict);
            assertEquals(CheckStage.CONTENT, divergence.stage());
            assertEquals("Statement mismatch: original='a();', candidate='b();'", divergence.detail());
            assertTrue(verdict.report().contains("Function 'T#f(boolean)' path structure: OK"), verdict.report());
        }

        @Test
        void testRemovingElseWithSameHoistedCodeIsEquivalent() {
            EquivalenceVerdict verdict = check(
                    "int f(boolean c) { if (c) { return 1; } else { a(); return 2; } }",
                    "int f(boolean c) { if (c) { return 1; } a(); return 2; }");

            assertTrue(verdict.isEquivalent(), verdict.report());
        }

        @Test
        void testSwappedReturnValuesAreNotEquivalent() {
            EquivalenceVerdict verdict = check(
                    "int f(boolean c) { if (c) { return 1; } else { return 2; } }",
                    "int f(boolean c) { if (c) { return 2; } else { return 1; } }");

            assertEquals(Outcome.NOT_EQUIVALENT, verdict.outcome());
            Divergence divergence = onlyDivergence(verdict);
            assertEquals("T#f(boolean)", divergence.function());
            assertEquals(CheckStage.CONTENT, divergence.stage());
            assertTrue(divergence.detail().startsWith("Return value mismatch"), divergence.detail());
        }

        @Test
        void testBreakTurnedIntoContinueFailsOnPaths() {
            EquivalenceVerdict verdict = check(
                    "void f(int n) { for (int i = 0; i < n; i++) { if (i == 3) { break; } work(i); } }",
                    "void f(int n) { for (int i = 0; i < n; i++) { if (i == 3) { continue; } work(i); } }");

            assertEquals(Outcome.NOT_EQUIVALENT, verdict.outcome());
            assertEquals(CheckStage.PATH_STRUCTURE, onlyDivergence(verdict).stage());
            assertTrue(verdict.report().contains("Function 'T#f(int)' structure: OK"), verdict.report());
        }

        @Test
        void testReorderedStatementsAreNotEquivalent() {
            EquivalenceVerdict verdict = check(
                    "void f() { first(); second(); }",
                    "void f() { second(); first(); }");

            assertEquals(Outcome.NOT_EQUIVALENT, verdict.outcome());
            Divergence divergence = onlyDivergence(verdict);
            assertEquals(CheckStage.CONTENT, divergence.stage());
            assertTrue(divergence.detail().startsWith("Statement mismatch"), divergence.detail());
        }

        @Test
        void testSwappedBranchBodiesAreNotEquivalent() {
            EquivalenceVerdict verdict = check(
                    "void f(boolean c) { if (c) { left(); } else { right(); } }",
                    "void f(boolean c) { if (c) { right(); } else { left(); } }");

            Divergence divergence = onlyDivergence(verdict);
            assertEquals(CheckStage.CONTENT, divergence.stage());
            assertEquals("Statement mismatch: original='left();', candidate='right();'", divergence.detail());
        }

        @Test
        void testPathExplosionIsInconclusive() {
            String method = sequentialIfs(20);

            EquivalenceVerdict verdict = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> check(method, method));

            assertEquals(Outcome.INCONCLUSIVE, verdict.outcome());
            assertFalse(verdict.isEquivalent());
            assertTrue(verdict.isInconclusive());
            assertEquals(List.of("T#f(int)"), verdict.inconclusiveFunctions());
            assertTrue(verdict.divergences().isEmpty());
            assertTrue(verdict.report().contains("Path budget exceeded"), verdict.report());
        }

        @Test
        void testTenIfsStayWithinBudget() {
            String method = sequentialIfs(10);

            assertTrue(check(method, method).isEquivalent());
        }
    }

    @Nested
    class Normalization {

        @Test
        void testReflexive() {
            String method = """
                    int f(int[] xs) {
                        int total = 0;
                        outer:
                        for (int i = 0; i < xs.length; i++) {
                            switch (xs[i]) {
                                case 0:
                                    continue outer;
                                case 1:
                                    total++;
                                default:
                                    total += xs[i];
                            }
                            try {
                                check(total);
                            } catch (IllegalStateException e) {
                                throw new RuntimeException(e);
                            }
                        }
                        return total;
                    }
                    """;

            assertTrue(check(method, method).isEquivalent());
        }

        @Test
        void testFormattingAndCommentsAreIgnored() {
            EquivalenceVerdict verdict = check(
                    "int f(int x) { if (x > 0) { return x * 2; } return -x; }",
                    """
                    int f(int x) {
                        // double positive values
                        if (x   >   0) {


                            return x*2;   /* fast path */
                        }
                        return -x;
                    }
                    """);

            assertTrue(verdict.isEquivalent(), verdict.report());
        }

        @Test
        void testEmptyFunctionWithComment() {
            assertTrue(check("void f() {}", "void f() {\n    // nothing to do\n}").isEquivalent());
        }

        @Test
        void testChangedComparisonOperator() {
            EquivalenceVerdict verdict = check(
                    "void f(int x) { if (x > 0) { hit(); } }",
                    "void f(int x) { if (x >= 0) { hit(); } }");

            Divergence divergence = onlyDivergence(verdict);
            assertEquals(CheckStage.CONTENT, divergence.stage());
            assertEquals("Condition mismatch: original='x > 0', candidate='x >= 0'", divergence.detail());
        }

        @Test
        void testChangedBreakCondition() {
            EquivalenceVerdict verdict = check(
                    "void f(int x) { while (true) { if (x > 5) { break; } x++; } }",
                    "void f(int x) { while (true) { if (x > 6) { break; } x++; } }");

            assertEquals(CheckStage.CONTENT, onlyDivergence(verdict).stage());
        }
    }

    @Nested
    class StructuralChanges {

        @Test
        void testAddedBranch() {
            EquivalenceVerdict verdict = check(
                    "void f(int x) { act(x); }",
                    "void f(int x) { if (x > 0) { act(x); } }");

            Divergence divergence = onlyDivergence(verdict);
            assertEquals(CheckStage.STRUCTURE, divergence.stage());
            assertTrue(divergence.detail().startsWith("Block count mismatch"));
        }

        @Test
        void testSameCountDifferentKinds() {
            EquivalenceVerdict verdict = check(
                    "void f(int x) { if (x > 0) { act(x); } }",
                    "void f(int x) { while (x > 0) { act(x); } }");

            Divergence divergence = onlyDivergence(verdict);
            assertEquals(CheckStage.STRUCTURE, divergence.stage());
            assertTrue(divergence.detail().startsWith("Node type distribution mismatch"));
        }

        @Test
        void testCountingLoopVersusIteration() {
            EquivalenceVerdict verdict = check(
                    "void f(int[] xs) { for (int i = 0; i < xs.length; i++) { use(xs[i]); } }",
                    "void f(int[] xs) { for (int x : xs) { use(x); } }");

            assertEquals(Outcome.NOT_EQUIVALENT, verdict.outcome());
        }

        @Test
        void testCodeAfterReturn() {
            EquivalenceVerdict verdict = check(
                    "int f() { return 1; }",
                    "int f() { return 1; cleanup(); }");

            assertEquals(Outcome.NOT_EQUIVALENT, verdict.outcome());
        }

        @Test
        void testSwitchCaseLabelChange() {
            EquivalenceVerdict verdict = check(
                    "void f(int k) { switch (k) { case 1: a(); break; default: b(); } }",
                    "void f(int k) { switch (k) { case 2: a(); break; default: b(); } }");

            Divergence divergence = onlyDivergence(verdict);
            assertEquals(CheckStage.CONTENT, divergence.stage());
            assertTrue(divergence.detail().contains("case 1"), divergence.detail());
        }

        @Test
        void testDroppedLabel() {
            EquivalenceVerdict verdict = check(
                    """
                    void f(int[][] grid) {
                        outer:
                        for (int[] row : grid) {
                            for (int cell : row) {
                                if (cell < 0) { continue outer; }
                                use(cell);
                            }
                        }
                    }
                    """,
                    """
                    void f(int[][] grid) {
                        outer:
                        for (int[] row : grid) {
                            for (int cell : row) {
                                if (cell < 0) { continue; }
                                use(cell);
                            }
                        }
                    }
                    """);

            assertEquals(Outcome.NOT_EQUIVALENT, verdict.outcome());
        }
    }

    @Nested
    class FunctionSet {

        @Test
        void testAddedFunction() {
            EquivalenceVerdict verdict = checker.check(
                    inClass("void f() { a(); }"),
                    inClass("void f() { a(); }", "void g() { b(); }"));

            Divergence divergence = onlyDivergence(verdict);
            assertNull(divergence.function());
            assertEquals(CheckStage.FUNCTION_SET, divergence.stage());
            assertEquals("Function count mismatch: original=1, candidate=2, missing=[], added=[T#g()]",
                    divergence.detail());
            assertEquals(2, verdict.transcript().size(), "no per-function stage runs after a set mismatch");
        }

        @Test
        void testOverloadsAreComparedSeparately() {
            EquivalenceVerdict verdict = checker.check(
                    inClass("void f(int x) { a(x); }", "void f(String s) { b(s); }"),
                    inClass("void f(String s) { b(s); }", "void f(int x) { a(x); }"));

            assertTrue(verdict.isEquivalent(), verdict.report());
        }

        @Test
        void testEveryFunctionIsReported() {
            EquivalenceVerdict verdict = checker.check(
                    inClass("void f() { a(); }", "void g() { b(); }"),
                    inClass("void f() { c(); }", "void g() { d(); }"));

            assertEquals(2, verdict.divergences().size());
            assertEquals("T#f()", verdict.divergences().get(0).function());
            assertEquals("T#g()", verdict.divergences().get(1).function());
        }

        @Test
        void testNestedTypesAndConstructors() {
            String source = """
                    class Outer {
                        Outer(int x) { this.x = x; }
                        int x;
                        static class Inner {
                            int twice(int y) { return y * 2; }
                        }
                    }
                    """;

            EquivalenceVerdict verdict = checker.check(source, source);

            assertTrue(verdict.isEquivalent());
            assertTrue(verdict.report().contains("Function 'Outer.Inner#twice(int)'"), verdict.report());
            assertTrue(verdict.report().contains("Function 'Outer#Outer(int)'"), verdict.report());
        }
    }

    @Nested
    class MemberBodies {

        @Test
        void testEnumConstantBodyIsCompared() {
            EquivalenceVerdict verdict = checker.check("""
                    enum E {
                        A { int f(int x) { if (x > 0) { return 1; } return 2; } };
                        int f(int x) { return 0; }
                    }
                    """, """
                    enum E {
                        A { int f(int x) { if (x >= 0) { return 1; } return 2; } };
                        int f(int x) { return 0; }
                    }
                    """);

            Divergence divergence = onlyDivergence(verdict);
            assertEquals("E.A#f(int)", divergence.function());
            assertEquals(CheckStage.CONTENT, divergence.stage());
            assertEquals("Condition mismatch: original='x > 0', candidate='x >= 0'", divergence.detail());
        }

        @Test
        void testCompactConstructorIsCompared() {
            EquivalenceVerdict verdict = checker.check(
                    "record R(int x) { R { if (x < 0) { throw new IllegalArgumentException(); } } }",
                    "record R(int x) { R { } }");

            Divergence divergence = onlyDivergence(verdict);
            assertEquals("R#<compact>", divergence.function());
            assertEquals(CheckStage.STRUCTURE, divergence.stage());
        }

        @Test
        void testStaticInitializerIsCompared() {
            EquivalenceVerdict verdict = checker.check(
                    "class C { static int y; static { if (y > 0) { y = 1; } } }",
                    "class C { static int y; static { y = 1; } }");

            Divergence divergence = onlyDivergence(verdict);
            assertEquals("C#<clinit>[0]", divergence.function());
            assertEquals(CheckStage.STRUCTURE, divergence.stage());
        }

        @Test
        void testInstanceInitializerIsReported() {
            String source = "class C { int y; { if (y > 0) { y = 1; } else { y = 2; } } }";

            EquivalenceVerdict verdict = checker.check(source, source);

            assertTrue(verdict.isEquivalent(), verdict.report());
            assertTrue(verdict.report().contains("Function 'C#<init>[0]' content: OK"), verdict.report());
        }

        @Test
        void testChangedFieldInitializerIsNotEquivalent() {
            EquivalenceVerdict verdict = checker.check(
                    "class C { static int limit = 10; void f() { a(); } }",
                    "class C { static int limit = 20; void f() { a(); } }");

            Divergence divergence = onlyDivergence(verdict);
            assertNull(divergence.function());
            assertEquals(CheckStage.FUNCTION_SET, divergence.stage());
            assertEquals("Declarations outside function bodies differ: "
                    + "original='static int limit = 10;', candidate='static int limit = 20;'", divergence.detail());
        }

        @Test
        void testChangedEnumConstantArgumentIsNotEquivalent() {
            EquivalenceVerdict verdict = checker.check(
                    "enum Level { LOW(1), HIGH(9); Level(int v) { } }",
                    "enum Level { LOW(1), HIGH(8); Level(int v) { } }");

            assertEquals(CheckStage.FUNCTION_SET, onlyDivergence(verdict).stage());
        }
    }

    @Nested
    class TryFinally {

        @Test
        void testMovingFinallyBodyPastEarlyReturn() {
            EquivalenceVerdict verdict = check(
                    "int f(boolean c) { try { if (c) { return 1; } } finally { release(); } return 0; }",
                    "int f(boolean c) { try { if (c) { return 1; } } finally { } release(); return 0; }");

            assertEquals(Outcome.NOT_EQUIVALENT, verdict.outcome());
            Divergence divergence = onlyDivergence(verdict);
            assertEquals(CheckStage.STRUCTURE, divergence.stage());
            assertEquals("Block count mismatch: original=8, candidate=7", divergence.detail());
        }

        @Test
        void testMovingFinallyBodyWithoutJumps() {
            EquivalenceVerdict verdict = check(
                    "void f() { try { a(); } finally { b(); } }",
                    "void f() { try { a(); } finally { } b(); }");

            Divergence divergence = onlyDivergence(verdict);
            assertEquals(CheckStage.CONTENT, divergence.stage());
            assertEquals("Statement mismatch: original='finally { b(); }', candidate='finally { }'",
                    divergence.detail());
        }

        @Test
        void testBreakThroughFinallyIsReflexive() {
            String method = """
                    void f(int n) {
                        while (n > 0) {
                            try {
                                if (n == 3) { break; }
                                n--;
                            } finally {
                                log(n);
                            }
                        }
                    }
                    """;

            assertTrue(check(method, method).isEquivalent());
        }
    }

    @Test
    void testNonTerminatingFunctionsAreVacuouslyEqual() {
        EquivalenceVerdict verdict = check(
                "void f() { while (true) { tick(); } }",
                "void f() {\n    while (true) {\n        tick();\n    }\n}");

        assertTrue(verdict.isEquivalent(), verdict.report());
        assertTrue(verdict.report().contains("vacuously equal"));
    }

    @Test
    void testNonTerminatingContentStillCompared() {
        EquivalenceVerdict verdict = check(
                "void f() { while (true) { tick(); } }",
                "void f() { while (true) { tock(); } }");

        assertEquals(CheckStage.CONTENT, onlyDivergence(verdict).stage());
    }

    @Test
    void testDetailedReportIncludesTries() {
        EquivalenceChecker detailed = new EquivalenceChecker(CheckerConfig.standard().withDetailedReport(true));

        EquivalenceVerdict verdict = detailed.check(inClass("void f() { a(); }"), inClass("void f() { a(); }"));

        assertTrue(verdict.report().contains("Function 'T#f()' original paths: ENTRY(CALL(EXIT(*)))"),
                verdict.report());
        assertTrue(verdict.report().contains("Function 'T#f()' candidate paths: ENTRY(CALL(EXIT(*)))"));
    }

    @Test
    void testInputsAreNotModified() {
        CompilationUnit original = SourceParser.parse(inClass("int f(int x) { // keep\n return x; }"));
        CompilationUnit candidate = SourceParser.parse(inClass("int f(int x) { return x; }"));
        String originalBefore = original.toString();
        String candidateBefore = candidate.toString();

        assertTrue(checker.check(original, candidate).isEquivalent());

        assertEquals(originalBefore, original.toString());
        assertEquals(candidateBefore, candidate.toString());
        assertTrue(original.getRange().isPresent());
    }

    @Test
    void testCheckFunctionSkipsFunctionSet() {
        MethodDeclaration a = SourceParser.parse(inClass("void a(int x) { x++; }"))
                .findFirst(MethodDeclaration.class).orElseThrow();
        MethodDeclaration b = SourceParser.parse(inClass("void b(int x) { x++; }"))
                .findFirst(MethodDeclaration.class).orElseThrow();

        EquivalenceVerdict verdict = checker.checkFunction("pair", a, b);

        assertTrue(verdict.isEquivalent(), verdict.report());
        assertTrue(verdict.transcript().get(0).startsWith("Function 'pair' structure: OK"));
    }

    @Test
    void testUnparsableSourceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> checker.check("class T { void f( }", inClass()));
    }

    @Test
    void testTightBudgetMakesSmallFunctionInconclusive() {
        EquivalenceChecker tight = new EquivalenceChecker(CheckerConfig.standard().withMaxPaths(3));
        String method = sequentialIfs(3);

        EquivalenceVerdict verdict = tight.check(inClass(method), inClass(method));

        assertEquals(Outcome.INCONCLUSIVE, verdict.outcome());
        assertTrue(verdict.report().contains("Function 'T#f(int)' path structure: INCONCLUSIVE"), verdict.report());
    }
}
