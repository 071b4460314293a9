package com.raditha.flowcheck.equivalence;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.raditha.flowcheck.util.SourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FunctionExtractorTest {

    private final FunctionExtractor extractor = new FunctionExtractor();

    @Test
    void testKeysIncludeOwnerAndSignature() {
        CompilationUnit cu = SourceParser.parse("""
                class Shop {
                    Shop() {}
                    void add(String item) {}
                    void add(String item, int count) {}
                    interface Listener { void onAdd(String item); }
                    enum Size { S, M; int weight() { return 1; } }
                }
                record Point(int x, int y) {
                    int sum() { return x + y; }
                }
                """);

        Map<String, BodyDeclaration<?>> functions = extractor.extract(cu);

        assertEquals(List.of(
                "Point#sum()",
                "Shop#Shop()",
                "Shop#add(String)",
                "Shop#add(String, int)",
                "Shop.Listener#onAdd(String)",
                "Shop.Size#weight()"), List.copyOf(functions.keySet()));
    }

    @Test
    void testBodiesWithoutSignatures() {
        CompilationUnit cu = SourceParser.parse("""
                enum Op {
                    PLUS { int apply(int a, int b) { return a + b; } },
                    MINUS { int apply(int a, int b) { return a - b; } };
                    abstract int apply(int a, int b);
                }
                record Range(int lo, int hi) {
                    Range { if (lo > hi) { throw new IllegalArgumentException(); } }
                }
                class Registry {
                    static { init(); }
                    { count = 0; }
                    static { more(); }
                    int count;
                }
                """);

        Map<String, BodyDeclaration<?>> functions = extractor.extract(cu);

        assertEquals(List.of(
                "Op#apply(int, int)",
                "Op.MINUS#apply(int, int)",
                "Op.PLUS#apply(int, int)",
                "Range#<compact>",
                "Registry#<clinit>[0]",
                "Registry#<clinit>[1]",
                "Registry#<init>[0]"), List.copyOf(functions.keySet()));
        assertTrue(functions.get("Registry#<clinit>[1]").toString().contains("more()"));
    }

    @Test
    void testAnonymousAndLocalClassesBelongToTheirFunction() {
        CompilationUnit cu = SourceParser.parse("""
                class T {
                    Runnable make() {
                        class Local { void run() {} }
                        return new Runnable() {
                            { ready(); }
                            public void run() { new Local().run(); }
                        };
                    }
                }
                """);

        assertEquals(List.of("T#make()"), List.copyOf(extractor.extract(cu).keySet()));
    }

    @Test
    void testDuplicateDeclarationKeepsFirst() {
        CompilationUnit cu = SourceParser.parse("class T { void f() { a(); } void f() { b(); } }");

        Map<String, BodyDeclaration<?>> functions = extractor.extract(cu);

        assertEquals(1, functions.size());
        assertTrue(functions.get("T#f()").toString().contains("a()"));
    }

    @Test
    void testSimpleName() {
        assertEquals("add", FunctionExtractor.simpleName("Shop#add(String, int)"));
        assertEquals("<clinit>", FunctionExtractor.simpleName("Registry#<clinit>[1]"));
        assertEquals("<compact>", FunctionExtractor.simpleName("Range#<compact>"));
        assertEquals("apply", FunctionExtractor.simpleName("Op.PLUS#apply(int[], int)"));
    }

    @Test
    void testSkeletonIgnoresBodiesOnly() {
        CompilationUnit original = SourceParser.parse("class T { int y = 1; void f() { a(); } static { b(); } }");
        CompilationUnit newBodies = SourceParser.parse("class T { int y = 1; void f() { c(); } static { d(); } }");
        CompilationUnit newField = SourceParser.parse("class T { int y = 2; void f() { a(); } static { b(); } }");
        String before = original.toString();

        assertEquals(extractor.skeleton(original), extractor.skeleton(newBodies));
        assertNotEquals(extractor.skeleton(original), extractor.skeleton(newField));
        assertFalse(extractor.skeleton(original).contains("a()"));
        assertEquals(before, original.toString());
    }
}
