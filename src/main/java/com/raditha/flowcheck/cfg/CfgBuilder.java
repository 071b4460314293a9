package com.raditha.flowcheck.cfg;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
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
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the control-flow graph of a function body.
 * <p>
 * Every statement except blocks becomes one node. Counting loops contribute extra nodes
 * for each initialisation and update expression, switch statements one node per entry
 * and try statements one node per catch clause. Unreachable statements still get
 * nodes, they simply have no incoming edges.
 * <p>
 * Construction walks the tree carrying the set of "dangling" predecessors: each visit
 * links those predecessors to the nodes it creates and returns the set of nodes from
 * which control continues to the next statement.
 * <p>
 * A jump that leaves a {@code try} statement with a {@code finally} block passes
 * through its own copy of that block before reaching its target, so the finally
 * statements appear once on the normal path and once more for every such jump.
 */
public class CfgBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CfgBuilder.class);

    /**
     * Build the graph of a method, constructor, compact constructor or initializer
     * block. A declaration without a body yields the two sentinels joined by a single
     * edge.
     */
    public ControlFlowGraph build(BodyDeclaration<?> declaration) {
        ControlFlowGraph cfg = build(bodyOf(declaration).orElse(null));
        logger.debug("Built CFG for {}: {} nodes, {} edges",
                describe(declaration), cfg.size(), cfg.edgeCount());
        return cfg;
    }

    /**
     * Body of a declaration that has executable code, empty for abstract and native
     * methods and for declarations that are not functions.
     */
    public static Optional<BlockStmt> bodyOf(BodyDeclaration<?> declaration) {
        if (declaration instanceof MethodDeclaration method) {
            return method.getBody();
        } else if (declaration instanceof ConstructorDeclaration constructor) {
            return Optional.of(constructor.getBody());
        } else if (declaration instanceof CompactConstructorDeclaration compact) {
            return Optional.of(compact.getBody());
        } else if (declaration instanceof InitializerDeclaration initializer) {
            return Optional.of(initializer.getBody());
        }
        return Optional.empty();
    }

    private static String describe(BodyDeclaration<?> declaration) {
        if (declaration instanceof NodeWithSimpleName<?> named) {
            return named.getNameAsString();
        }
        return declaration.getClass().getSimpleName();
    }

    /**
     * Build the graph of a block. A null block is treated as an empty body.
     */
    public ControlFlowGraph build(BlockStmt body) {
        Construction construction = new Construction();
        Set<Integer> exits = body == null
                ? Set.of(ControlFlowGraph.ENTRY_ID)
                : construction.visitAll(body.getStatements(), Set.of(ControlFlowGraph.ENTRY_ID));
        construction.connect(exits, ControlFlowGraph.EXIT_ID);
        return construction.graph.build();
    }

    /**
     * Kind of a statement made of a single expression.
     */
    static NodeKind expressionKind(Expression expression) {
        if (expression instanceof VariableDeclarationExpr) {
            return NodeKind.DECLARATION;
        }
        if (expression instanceof AssignExpr) {
            return NodeKind.ASSIGNMENT;
        }
        if (expression instanceof UnaryExpr unary) {
            switch (unary.getOperator()) {
                case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> {
                    return NodeKind.INCREMENT;
                }
                default -> {
                    return NodeKind.EXPRESSION;
                }
            }
        }
        if (expression instanceof MethodCallExpr || expression instanceof ObjectCreationExpr) {
            return NodeKind.CALL;
        }
        return NodeKind.EXPRESSION;
    }

    /**
     * True when a loop condition can never be false: absent or the literal {@code true}.
     */
    static boolean isAlwaysTrue(Optional<Expression> condition) {
        if (condition.isEmpty()) {
            return true;
        }
        Expression expression = condition.get();
        while (expression instanceof EnclosedExpr enclosed) {
            expression = enclosed.getInner();
        }
        return expression instanceof BooleanLiteralExpr literal && literal.getValue();
    }

    /**
     * Something a break or continue can jump to.
     */
    private static final class JumpTarget {
        private final String label;
        private final boolean loop;
        private final boolean breakable;
        private final int continueTarget;
        private final Set<Integer> breakExits = new LinkedHashSet<>();

        private JumpTarget(String label, boolean loop, boolean breakable, int continueTarget) {
            this.label = label;
            this.loop = loop;
            this.breakable = breakable;
            this.continueTarget = continueTarget;
        }
    }

    /**
     * A {@code finally} block being built, with the depth of the jump target and handler
     * stacks outside it.
     */
    private record FinallyFrame(BlockStmt block, int targetDepth, int handlerDepth) {
    }

    /**
     * Per-build state. Not reused across graphs.
     */
    private static final class Construction {
        private final ControlFlowGraph.Builder graph = new ControlFlowGraph.Builder();
        private final Deque<JumpTarget> targets = new ArrayDeque<>();
        private final Deque<List<Integer>> handlers = new ArrayDeque<>();
        private final Deque<FinallyFrame> finallies = new ArrayDeque<>();
        private String pendingLabel;

        void connect(Set<Integer> from, int to) {
            for (int id : from) {
                graph.addEdge(id, to);
            }
        }

        private int node(NodeKind kind, Node astNode, Set<Integer> prev) {
            int id = graph.addNode(kind, astNode);
            connect(prev, id);
            return id;
        }

        Set<Integer> visitAll(NodeList<Statement> statements, Set<Integer> prev) {
            Set<Integer> current = prev;
            for (Statement statement : statements) {
                current = visit(statement, current);
            }
            return current;
        }

        Set<Integer> visit(Statement stmt, Set<Integer> prev) {
            if (stmt instanceof BlockStmt block) {
                return visitAll(block.getStatements(), prev);
            } else if (stmt instanceof IfStmt ifStmt) {
                return visitIf(ifStmt, prev);
            } else if (stmt instanceof ForStmt forStmt) {
                return visitFor(forStmt, prev);
            } else if (stmt instanceof ForEachStmt forEach) {
                return visitForEach(forEach, prev);
            } else if (stmt instanceof WhileStmt whileStmt) {
                return visitWhile(whileStmt, prev);
            } else if (stmt instanceof DoStmt doStmt) {
                return visitDo(doStmt, prev);
            } else if (stmt instanceof SwitchStmt switchStmt) {
                return visitSwitch(switchStmt, prev);
            } else if (stmt instanceof LabeledStmt labeled) {
                return visitLabeled(labeled, prev);
            } else if (stmt instanceof TryStmt tryStmt) {
                return visitTry(tryStmt, prev);
            } else if (stmt instanceof SynchronizedStmt sync) {
                int id = node(NodeKind.SYNCHRONIZED, sync, prev);
                return visit(sync.getBody(), Set.of(id));
            } else if (stmt instanceof BreakStmt breakStmt) {
                int id = node(NodeKind.BRANCH, breakStmt, prev);
                jumpBreak(id, breakStmt.getLabel());
                return Set.of();
            } else if (stmt instanceof ContinueStmt continueStmt) {
                int id = node(NodeKind.BRANCH, continueStmt, prev);
                jumpContinue(id, continueStmt.getLabel());
                return Set.of();
            } else if (stmt instanceof ReturnStmt returnStmt) {
                int id = node(NodeKind.RETURN, returnStmt, prev);
                connect(throughFinally(id, finallies.size()), ControlFlowGraph.EXIT_ID);
                return Set.of();
            } else if (stmt instanceof YieldStmt yieldStmt) {
                int id = node(NodeKind.YIELD, yieldStmt, prev);
                connect(throughFinally(id, finallies.size()), ControlFlowGraph.EXIT_ID);
                return Set.of();
            } else if (stmt instanceof ThrowStmt throwStmt) {
                int id = node(NodeKind.THROW, throwStmt, prev);
                jumpThrow(id);
                return Set.of();
            }
            return Set.of(node(leafKind(stmt), stmt, prev));
        }

        private NodeKind leafKind(Statement stmt) {
            if (stmt instanceof ExpressionStmt expressionStmt) {
                return expressionKind(expressionStmt.getExpression());
            } else if (stmt instanceof AssertStmt) {
                return NodeKind.ASSERT;
            } else if (stmt instanceof EmptyStmt) {
                return NodeKind.EMPTY;
            } else if (stmt instanceof ExplicitConstructorInvocationStmt) {
                return NodeKind.CONSTRUCTOR_CALL;
            } else if (stmt instanceof LocalClassDeclarationStmt || stmt instanceof LocalRecordDeclarationStmt) {
                return NodeKind.LOCAL_TYPE;
            }
            return NodeKind.OTHER;
        }

        private Set<Integer> visitIf(IfStmt stmt, Set<Integer> prev) {
            int id = node(NodeKind.IF, stmt, prev);
            Set<Integer> exits = new LinkedHashSet<>(visit(stmt.getThenStmt(), Set.of(id)));
            if (stmt.getElseStmt().isPresent()) {
                exits.addAll(visit(stmt.getElseStmt().get(), Set.of(id)));
            } else {
                exits.add(id);
            }
            return exits;
        }

        private Set<Integer> visitFor(ForStmt stmt, Set<Integer> prev) {
            Set<Integer> current = prev;
            for (Expression init : stmt.getInitialization()) {
                current = Set.of(node(expressionKind(init), init, current));
            }
            int header = node(NodeKind.FOR, stmt, current);

            List<Integer> updates = new ArrayList<>();
            for (Expression update : stmt.getUpdate()) {
                updates.add(graph.addNode(expressionKind(update), update));
            }
            for (int i = 0; i + 1 < updates.size(); i++) {
                graph.addEdge(updates.get(i), updates.get(i + 1));
            }
            if (!updates.isEmpty()) {
                graph.addEdge(updates.get(updates.size() - 1), header);
            }
            int continueTarget = updates.isEmpty() ? header : updates.get(0);

            JumpTarget target = pushLoop(continueTarget);
            Set<Integer> bodyExits = visit(stmt.getBody(), Set.of(header));
            targets.pop();
            connect(bodyExits, continueTarget);

            return loopExits(header, isAlwaysTrue(stmt.getCompare()), target);
        }

        private Set<Integer> visitForEach(ForEachStmt stmt, Set<Integer> prev) {
            int header = node(NodeKind.FOR_EACH, stmt, prev);
            JumpTarget target = pushLoop(header);
            Set<Integer> bodyExits = visit(stmt.getBody(), Set.of(header));
            targets.pop();
            connect(bodyExits, header);
            return loopExits(header, false, target);
        }

        private Set<Integer> visitWhile(WhileStmt stmt, Set<Integer> prev) {
            int header = node(NodeKind.WHILE, stmt, prev);
            JumpTarget target = pushLoop(header);
            Set<Integer> bodyExits = visit(stmt.getBody(), Set.of(header));
            targets.pop();
            connect(bodyExits, header);
            return loopExits(header, isAlwaysTrue(Optional.of(stmt.getCondition())), target);
        }

        /*
         * The DO node is the condition check at the bottom of the loop. The body is built
         * hanging off it, so its outgoing edges after the visit are exactly the back edges
         * into the body; the loop's predecessors are then linked to the same body entries.
         */
        private Set<Integer> visitDo(DoStmt stmt, Set<Integer> prev) {
            int check = graph.addNode(NodeKind.DO, stmt);
            JumpTarget target = pushLoop(check);
            Set<Integer> bodyExits = visit(stmt.getBody(), Set.of(check));
            targets.pop();

            List<Integer> bodyEntries = List.copyOf(graph.successorsOf(check));
            if (bodyEntries.isEmpty()) {
                connect(prev, check);
            } else {
                for (int entry : bodyEntries) {
                    connect(prev, entry);
                }
            }
            connect(bodyExits, check);
            return loopExits(check, isAlwaysTrue(Optional.of(stmt.getCondition())), target);
        }

        private Set<Integer> visitSwitch(SwitchStmt stmt, Set<Integer> prev) {
            int header = node(NodeKind.SWITCH, stmt, prev);
            JumpTarget target = new JumpTarget(takePendingLabel(), false, true, -1);
            targets.push(target);

            Set<Integer> exits = new LinkedHashSet<>();
            Set<Integer> fallthrough = Set.of();
            boolean hasDefault = false;
            for (SwitchEntry entry : stmt.getEntries()) {
                int caseId = node(NodeKind.CASE, entry, Set.of(header));
                connect(fallthrough, caseId);
                if (entry.getLabels().isEmpty()) {
                    hasDefault = true;
                }
                Set<Integer> entryExits = visitAll(entry.getStatements(), Set.of(caseId));
                if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                    fallthrough = entryExits;
                } else {
                    exits.addAll(entryExits);
                    fallthrough = Set.of();
                }
            }
            exits.addAll(fallthrough);
            targets.pop();

            exits.addAll(target.breakExits);
            if (!hasDefault) {
                exits.add(header);
            }
            return exits;
        }

        private Set<Integer> visitLabeled(LabeledStmt stmt, Set<Integer> prev) {
            int id = node(NodeKind.LABELED, stmt, prev);
            String label = stmt.getLabel().asString();
            Statement inner = stmt.getStatement();
            if (inner instanceof ForStmt || inner instanceof ForEachStmt || inner instanceof WhileStmt
                    || inner instanceof DoStmt || inner instanceof SwitchStmt) {
                pendingLabel = label;
                return visit(inner, Set.of(id));
            }
            JumpTarget target = new JumpTarget(label, false, false, -1);
            targets.push(target);
            Set<Integer> exits = new LinkedHashSet<>(visit(inner, Set.of(id)));
            targets.pop();
            exits.addAll(target.breakExits);
            return exits;
        }

        /*
         * The finally frame is pushed below the catch handlers: a throw in the try block
         * reaches the catch clauses directly, while a jump out of the try block or out of
         * a catch body crosses the frame.
         */
        private Set<Integer> visitTry(TryStmt stmt, Set<Integer> prev) {
            int id = node(NodeKind.TRY, stmt, prev);
            List<Integer> catchIds = new ArrayList<>();
            for (CatchClause clause : stmt.getCatchClauses()) {
                catchIds.add(node(NodeKind.CATCH, clause, Set.of(id)));
            }

            Optional<BlockStmt> finallyBlock = stmt.getFinallyBlock();
            finallyBlock.ifPresent(block -> finallies.push(new FinallyFrame(block, targets.size(), handlers.size())));
            if (!catchIds.isEmpty()) {
                handlers.push(catchIds);
            }
            Set<Integer> exits = new LinkedHashSet<>(visit(stmt.getTryBlock(), Set.of(id)));
            if (!catchIds.isEmpty()) {
                handlers.pop();
            }

            Iterator<Integer> catchIterator = catchIds.iterator();
            for (CatchClause clause : stmt.getCatchClauses()) {
                exits.addAll(visit(clause.getBody(), Set.of(catchIterator.next())));
            }
            if (finallyBlock.isPresent()) {
                finallies.pop();
                return visit(finallyBlock.get(), exits);
            }
            return exits;
        }

        /**
         * Build a fresh copy of the {@code count} innermost finally blocks, chained from
         * the jump node outwards. Each copy is built with the jump targets and handlers
         * that enclose its try statement, so jumps inside a finally block resolve as they
         * would in the source.
         *
         * @return the nodes from which the jump continues to its target
         */
        private Set<Integer> throughFinally(int jump, int count) {
            Set<Integer> current = Set.of(jump);
            if (count == 0) {
                return current;
            }
            Deque<FinallyFrame> crossed = new ArrayDeque<>();
            Deque<JumpTarget> hiddenTargets = new ArrayDeque<>();
            Deque<List<Integer>> hiddenHandlers = new ArrayDeque<>();
            for (int i = 0; i < count; i++) {
                FinallyFrame frame = finallies.pop();
                crossed.push(frame);
                while (targets.size() > frame.targetDepth()) {
                    hiddenTargets.push(targets.pop());
                }
                while (handlers.size() > frame.handlerDepth()) {
                    hiddenHandlers.push(handlers.pop());
                }
                current = visit(frame.block(), current);
            }
            while (!hiddenHandlers.isEmpty()) {
                handlers.push(hiddenHandlers.pop());
            }
            while (!hiddenTargets.isEmpty()) {
                targets.push(hiddenTargets.pop());
            }
            while (!crossed.isEmpty()) {
                finallies.push(crossed.pop());
            }
            return current;
        }

        /**
         * Number of innermost finally frames entered after the stack had reached
         * {@code depth}.
         */
        private int framesAbove(int depth, boolean byTarget) {
            int count = 0;
            for (FinallyFrame frame : finallies) {
                int frameDepth = byTarget ? frame.targetDepth() : frame.handlerDepth();
                if (frameDepth < depth) {
                    break;
                }
                count++;
            }
            return count;
        }

        private JumpTarget pushLoop(int continueTarget) {
            JumpTarget target = new JumpTarget(takePendingLabel(), true, true, continueTarget);
            targets.push(target);
            return target;
        }

        private Set<Integer> loopExits(int header, boolean infinite, JumpTarget target) {
            Set<Integer> exits = new LinkedHashSet<>();
            if (!infinite) {
                exits.add(header);
            }
            exits.addAll(target.breakExits);
            return exits;
        }

        private String takePendingLabel() {
            String label = pendingLabel;
            pendingLabel = null;
            return label;
        }

        private void jumpBreak(int id, Optional<SimpleName> label) {
            int depth = targets.size();
            for (JumpTarget target : targets) {
                boolean matches = label.isPresent()
                        ? label.get().asString().equals(target.label)
                        : target.breakable;
                if (matches) {
                    target.breakExits.addAll(throughFinally(id, framesAbove(depth, true)));
                    return;
                }
                depth--;
            }
            logger.debug("No target for break {}, routing to exit", label.map(SimpleName::asString).orElse(""));
            connect(throughFinally(id, finallies.size()), ControlFlowGraph.EXIT_ID);
        }

        private void jumpContinue(int id, Optional<SimpleName> label) {
            int depth = targets.size();
            for (JumpTarget target : targets) {
                boolean matches = target.loop
                        && (label.isEmpty() || label.get().asString().equals(target.label));
                if (matches) {
                    connect(throughFinally(id, framesAbove(depth, true)), target.continueTarget);
                    return;
                }
                depth--;
            }
            logger.debug("No target for continue {}, routing to exit", label.map(SimpleName::asString).orElse(""));
            connect(throughFinally(id, finallies.size()), ControlFlowGraph.EXIT_ID);
        }

        private void jumpThrow(int id) {
            Set<Integer> exits = throughFinally(id, framesAbove(handlers.size(), false));
            if (handlers.isEmpty()) {
                connect(exits, ControlFlowGraph.EXIT_ID);
            } else {
                for (int handler : handlers.peek()) {
                    connect(exits, handler);
                }
            }
        }
    }
}
