package com.raditha.flowcheck.equivalence;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.raditha.flowcheck.cfg.CfgBuilder;
import com.raditha.flowcheck.cfg.NodeKind;
import com.raditha.flowcheck.normalization.CanonicalRenderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls the flow-relevant content out of a function body in pre-order.
 * All text is produced by {@link CanonicalRenderer}, so layout and comments never
 * matter while identifiers, operators and literals do.
 * <p>
 * A {@code finally} block is also recorded whole among the statements, so moving code
 * into or out of it shows up even when the statement order stays the same.
 */
public class ContentExtractor {
    private final CanonicalRenderer renderer;

    public ContentExtractor() {
        this(new CanonicalRenderer());
    }

    public ContentExtractor(CanonicalRenderer renderer) {
        this.renderer = renderer;
    }

    public FunctionContent extract(BodyDeclaration<?> declaration) {
        return extract(CfgBuilder.bodyOf(declaration).orElse(null));
    }

    public FunctionContent extract(BlockStmt body) {
        Collector collector = new Collector();
        if (body != null) {
            body.walk(Node.TreeTraversal.PREORDER, collector::accept);
        }
        return new FunctionContent(collector.conditions, collector.loops, collector.jumps, collector.statements);
    }

    private final class Collector {
        private final List<String> conditions = new ArrayList<>();
        private final List<FunctionContent.LoopPart> loops = new ArrayList<>();
        private final List<FunctionContent.JumpPart> jumps = new ArrayList<>();
        private final List<String> statements = new ArrayList<>();

        void accept(Node node) {
            if (node instanceof IfStmt ifStmt) {
                conditions.add(renderer.render(ifStmt.getCondition()));
            } else if (node instanceof WhileStmt whileStmt) {
                String condition = renderer.render(whileStmt.getCondition());
                conditions.add(condition);
                loops.add(new FunctionContent.LoopPart(NodeKind.WHILE, "", condition, ""));
            } else if (node instanceof DoStmt doStmt) {
                String condition = renderer.render(doStmt.getCondition());
                conditions.add(condition);
                loops.add(new FunctionContent.LoopPart(NodeKind.DO, "", condition, ""));
            } else if (node instanceof ForStmt forStmt) {
                String condition = renderer.render(forStmt.getCompare().orElse(null));
                if (forStmt.getCompare().isPresent()) {
                    conditions.add(condition);
                }
                loops.add(new FunctionContent.LoopPart(NodeKind.FOR,
                        renderer.renderAll(forStmt.getInitialization()),
                        condition,
                        renderer.renderAll(forStmt.getUpdate())));
            } else if (node instanceof ForEachStmt forEach) {
                loops.add(new FunctionContent.LoopPart(NodeKind.FOR_EACH,
                        renderer.render(forEach.getVariable()),
                        renderer.render(forEach.getIterable()),
                        ""));
            } else if (node instanceof SwitchStmt switchStmt) {
                conditions.add(renderer.render(switchStmt.getSelector()));
            } else if (node instanceof SwitchEntry entry) {
                SwitchEntry header = entry.clone();
                header.getStatements().clear();
                conditions.add(renderer.renderOneLine(header));
            } else if (node instanceof CatchClause clause) {
                conditions.add("catch " + renderer.render(clause.getParameter()));
            } else if (node instanceof BreakStmt breakStmt) {
                jumps.add(new FunctionContent.JumpPart("break", label(breakStmt.getLabel().orElse(null)), ""));
            } else if (node instanceof ContinueStmt continueStmt) {
                jumps.add(new FunctionContent.JumpPart("continue", label(continueStmt.getLabel().orElse(null)), ""));
            } else if (node instanceof ReturnStmt returnStmt) {
                jumps.add(new FunctionContent.JumpPart("return", null,
                        renderer.render(returnStmt.getExpression().orElse(null))));
            } else if (node instanceof ThrowStmt throwStmt) {
                jumps.add(new FunctionContent.JumpPart("throw", null, renderer.render(throwStmt.getExpression())));
            } else if (node instanceof YieldStmt yieldStmt) {
                jumps.add(new FunctionContent.JumpPart("yield", null, renderer.render(yieldStmt.getExpression())));
            } else if (node instanceof TryStmt tryStmt) {
                if (tryStmt.getResources().isNonEmpty()) {
                    statements.add("try (" + renderer.renderAll(tryStmt.getResources()) + ")");
                }
                tryStmt.getFinallyBlock().ifPresent(block -> statements.add("finally " + renderer.renderOneLine(block)));
            } else if (node instanceof SynchronizedStmt sync) {
                statements.add("synchronized (" + renderer.render(sync.getExpression()) + ")");
            } else if (node instanceof ExpressionStmt || node instanceof AssertStmt
                    || node instanceof ExplicitConstructorInvocationStmt || node instanceof EmptyStmt
                    || node instanceof LocalClassDeclarationStmt || node instanceof LocalRecordDeclarationStmt) {
                statements.add(renderer.render(node));
            }
        }

        private String label(SimpleName name) {
            return name == null ? null : name.asString();
        }
    }
}
