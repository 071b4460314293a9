package com.raditha.flowcheck.equivalence;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.raditha.flowcheck.normalization.CanonicalRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Collects the functions of a compilation unit keyed by owner and signature.
 * <p>
 * Keys look like {@code Outer.Inner#name(int, String)} so overloads stay distinct.
 * Methods and constructors are keyed by signature, record compact constructors as
 * {@code R#<compact>} and initializer blocks as {@code C#<clinit>[n]} (static) or
 * {@code C#<init>[n]} (instance), numbered in source order. Members of an enum
 * constant's body have the constant in their owner chain: {@code E.A#f(int)}.
 * <p>
 * Only members of named types are functions; bodies of anonymous and local classes
 * belong to the function that contains them.
 */
public class FunctionExtractor {
    private static final Logger logger = LoggerFactory.getLogger(FunctionExtractor.class);

    public static final String COMPACT_CONSTRUCTOR = "<compact>";
    public static final String STATIC_INITIALIZER = "<clinit>";
    public static final String INSTANCE_INITIALIZER = "<init>";

    private final CanonicalRenderer renderer;

    public FunctionExtractor() {
        this(new CanonicalRenderer());
    }

    public FunctionExtractor(CanonicalRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * @return functions sorted by key
     */
    public Map<String, BodyDeclaration<?>> extract(CompilationUnit cu) {
        Map<String, BodyDeclaration<?>> functions = new TreeMap<>();
        for (BodyDeclaration<?> member : cu.findAll(BodyDeclaration.class)) {
            Optional<String> key = keyOf(member);
            if (key.isEmpty()) {
                continue;
            }
            if (functions.putIfAbsent(key.get(), member) != null) {
                logger.warn("Duplicate declaration of {} ignored", key.get());
            }
        }
        return functions;
    }

    /**
     * Canonical text of the unit with every function body emptied: the declarations,
     * field initializers and enum constant arguments that no function comparison covers.
     * The unit itself is not modified.
     */
    public String skeleton(CompilationUnit cu) {
        CompilationUnit copy = cu.clone();
        for (BodyDeclaration<?> member : extract(copy).values()) {
            if (member instanceof MethodDeclaration method) {
                method.getBody().ifPresent(body -> method.setBody(new BlockStmt()));
            } else if (member instanceof ConstructorDeclaration constructor) {
                constructor.setBody(new BlockStmt());
            } else if (member instanceof CompactConstructorDeclaration compact) {
                compact.setBody(new BlockStmt());
            } else if (member instanceof InitializerDeclaration initializer) {
                initializer.setBody(new BlockStmt());
            }
        }
        return renderer.render(copy);
    }

    /**
     * Key of a function, or empty when the declaration is not a function or is not a
     * member of a named type.
     */
    public static Optional<String> keyOf(BodyDeclaration<?> member) {
        String local;
        if (member instanceof CallableDeclaration<?> callable) {
            local = callable.getSignature().asString();
        } else if (member instanceof CompactConstructorDeclaration) {
            local = COMPACT_CONSTRUCTOR;
        } else if (member instanceof InitializerDeclaration initializer) {
            local = initializerName(initializer);
        } else {
            return Optional.empty();
        }

        Deque<String> owners = new ArrayDeque<>();
        Node current = member.getParentNode().orElse(null);
        while (current instanceof TypeDeclaration<?> || current instanceof EnumConstantDeclaration) {
            owners.push(((NodeWithSimpleName<?>) current).getNameAsString());
            Node parent = current.getParentNode().orElse(null);
            if (parent == null || parent instanceof CompilationUnit) {
                return Optional.of(String.join(".", owners) + "#" + local);
            }
            current = parent;
        }
        return Optional.empty();
    }

    /**
     * The name part of a key: {@code add} for {@code Shop#add(String)},
     * {@code <init>} for {@code Shop#<init>[0]}.
     */
    public static String simpleName(String key) {
        String local = key.substring(key.indexOf('#') + 1);
        int end = local.length();
        for (char stop : new char[]{'(', '['}) {
            int index = local.indexOf(stop);
            if (index >= 0 && index < end) {
                end = index;
            }
        }
        return local.substring(0, end);
    }

    private static String initializerName(InitializerDeclaration initializer) {
        int index = 0;
        Node parent = initializer.getParentNode().orElse(null);
        if (parent != null) {
            for (Node sibling : parent.getChildNodes()) {
                if (sibling == initializer) {
                    break;
                }
                if (sibling instanceof InitializerDeclaration other && other.isStatic() == initializer.isStatic()) {
                    index++;
                }
            }
        }
        return (initializer.isStatic() ? STATIC_INITIALIZER : INSTANCE_INITIALIZER) + "[" + index + "]";
    }
}
