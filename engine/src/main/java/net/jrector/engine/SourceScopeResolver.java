package net.jrector.engine;

import net.jrector.api.ClassFacts;
import net.jrector.api.MethodFacts;
import net.jrector.api.Node;
import net.jrector.api.NodeKeys;
import net.jrector.api.NodeKind;
import net.jrector.api.Nodes;
import net.jrector.api.ResolvedType;
import net.jrector.api.Scope;
import net.jrector.api.ScopeResolver;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Answers type and symbol questions from the scope the traversal engine stored on each node and the
 * classes discovered in the processed sources.
 * <p>
 * Variables are typed from the parameter declaring them or from their assignments in the same function,
 * as long as all of those agree. One instance serves one file.
 */
public final class SourceScopeResolver implements ScopeResolver {
    private static final Map<String, ResolvedType> FUNCTION_RETURN_TYPES = Map.ofEntries(
            Map.entry("array_merge", ResolvedType.ARRAY),
            Map.entry("array_map", ResolvedType.ARRAY),
            Map.entry("array_filter", ResolvedType.ARRAY),
            Map.entry("array_values", ResolvedType.ARRAY),
            Map.entry("array_keys", ResolvedType.ARRAY),
            Map.entry("array_slice", ResolvedType.ARRAY),
            Map.entry("array_reverse", ResolvedType.ARRAY),
            Map.entry("array_unique", ResolvedType.ARRAY),
            Map.entry("explode", ResolvedType.ARRAY),
            Map.entry("range", ResolvedType.ARRAY),
            Map.entry("count", ResolvedType.INT),
            Map.entry("strlen", ResolvedType.INT),
            Map.entry("implode", ResolvedType.STRING),
            Map.entry("sprintf", ResolvedType.STRING),
            Map.entry("strtolower", ResolvedType.STRING),
            Map.entry("strtoupper", ResolvedType.STRING),
            Map.entry("trim", ResolvedType.STRING),
            Map.entry("substr", ResolvedType.STRING)
    );
    private static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "===", "!==", "<>", "<", "<=", ">", ">=",
            "&&", "||", "and", "or", "xor");

    private final ClassTable classTable;
    private final Set<String> resolvingVariables = new HashSet<>();
    @Nullable
    private Node root;

    public SourceScopeResolver(ClassTable classTable) {
        this.classTable = classTable;
    }

    /**
     * The tree of the current pass, searched for assignments to variables outside of functions.
     */
    void setRoot(Node root) {
        this.root = root;
    }

    @Override
    public Scope scopeOf(Node node) {
        return Objects.requireNonNullElse(node.getAttribute(NodeKeys.SCOPE), Scope.GLOBAL);
    }

    @Override
    public String resolveName(Node name) {
        var resolved = name.getAttribute(NodeKeys.RESOLVED_NAME);
        if (resolved != null) {
            return resolved;
        }
        return scopeOf(name).resolveClassName(Objects.requireNonNull(name.value(), "name"));
    }

    @Nullable
    @Override
    public ClassFacts resolveClass(String className) {
        return classTable.get(className);
    }

    @Nullable
    @Override
    public ClassFacts inClassScope(Node node) {
        var className = scopeOf(node).className();
        return className == null ? null : classTable.get(className);
    }

    @Override
    public boolean isSubclassOf(ClassFacts classFacts, String className) {
        var target = Nodes.stripLeadingBackslash(className);
        var visited = new HashSet<String>();
        var queue = new ArrayDeque<String>();
        enqueueAncestors(classFacts, queue);
        while (!queue.isEmpty()) {
            var ancestor = queue.removeFirst();
            if (!visited.add(ancestor.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (ancestor.equalsIgnoreCase(target)) {
                return true;
            }
            var facts = classTable.get(ancestor);
            if (facts != null) {
                enqueueAncestors(facts, queue);
            }
        }
        return false;
    }

    private static void enqueueAncestors(ClassFacts facts, ArrayDeque<String> queue) {
        if (facts.parentName() != null) {
            queue.add(facts.parentName());
        }
        queue.addAll(facts.interfaces());
    }

    @Nullable
    @Override
    public MethodFacts findMethod(ClassFacts classFacts, String methodName) {
        var visited = new HashSet<String>();
        ClassFacts current = classFacts;
        while (current != null && visited.add(current.name().toLowerCase(Locale.ROOT))) {
            var method = current.findDeclaredMethod(methodName);
            if (method != null) {
                return method;
            }
            current = current.parentName() == null ? null : classTable.get(current.parentName());
        }
        for (var interfaceName : classFacts.interfaces()) {
            var facts = classTable.get(interfaceName);
            if (facts != null) {
                var method = findMethod(facts, methodName);
                if (method != null) {
                    return method;
                }
            }
        }
        return null;
    }

    @Nullable
    @Override
    public MethodFacts resolveCalledMethod(Node call) {
        ClassFacts target;
        if (call.is(NodeKind.METHOD_CALL)) {
            var receiverType = resolveType(call.requireSlot(0));
            if (receiverType == null || !receiverType.isObject()) {
                return null;
            }
            target = classTable.get(Objects.requireNonNull(receiverType.className()));
        } else if (call.is(NodeKind.STATIC_CALL)) {
            target = resolveClassReference(call.requireSlot(0));
        } else {
            return null;
        }
        var methodName = Nodes.getName(call.requireSlot(1));
        if (target == null || methodName == null) {
            return null;
        }
        return findMethod(target, methodName);
    }

    @Nullable
    private ClassFacts resolveClassReference(Node reference) {
        if (!reference.is(NodeKind.NAME)) {
            var type = resolveType(reference);
            return type != null && type.isObject() ? classTable.get(Objects.requireNonNull(type.className())) : null;
        }
        if (Nodes.isName(reference, "parent")) {
            var current = inClassScope(reference);
            return current == null || current.parentName() == null ? null : classTable.get(current.parentName());
        }
        return classTable.get(resolveName(reference));
    }

    @Nullable
    @Override
    public ResolvedType resolveType(Node node) {
        return switch (node.kind()) {
            case STRING -> ResolvedType.STRING;
            case NUMBER -> isFloatLiteral(Objects.requireNonNull(node.value())) ? ResolvedType.FLOAT : ResolvedType.INT;
            case ARRAY -> ResolvedType.ARRAY;
            case CAST -> castType(Objects.requireNonNull(node.value()));
            case NEW -> {
                var type = node.requireSlot(0);
                if (!type.is(NodeKind.NAME)) {
                    yield ResolvedType.objectOf("object");
                }
                var facts = resolveClassReference(type);
                yield ResolvedType.objectOf(facts != null ? facts.name() : resolveName(type));
            }
            case CONST_FETCH -> constantType(node.requireSlot(0));
            case VARIABLE -> variableType(node);
            case FUNC_CALL -> {
                var name = node.requireSlot(0);
                yield name.is(NodeKind.NAME)
                        ? FUNCTION_RETURN_TYPES.get(Nodes.stripLeadingBackslash(Objects.requireNonNull(name.value())).toLowerCase(Locale.ROOT))
                        : null;
            }
            case METHOD_CALL, STATIC_CALL -> {
                var method = resolveCalledMethod(node);
                yield method == null ? null : method.returnType();
            }
            case BINARY_OP -> {
                var operator = Objects.requireNonNull(node.value());
                if (operator.equals(".")) {
                    yield ResolvedType.STRING;
                }
                yield COMPARISON_OPERATORS.contains(operator) ? ResolvedType.BOOL : null;
            }
            case UNARY_OP -> "!".equals(node.value()) ? ResolvedType.BOOL : null;
            case INSTANCEOF -> ResolvedType.BOOL;
            case CLOSURE, ARROW_FUNCTION -> ResolvedType.objectOf("Closure");
            default -> null;
        };
    }

    @Nullable
    private ResolvedType variableType(Node variable) {
        var scope = scopeOf(variable);
        var name = Objects.requireNonNull(variable.value());
        if (name.equals("this")) {
            return scope.className() == null ? null : ResolvedType.objectOf(scope.className());
        }

        var container = scope.functionLike() != null ? scope.functionLike() : root;
        if (container == null) {
            return null;
        }
        var key = container.id() + "$" + name;
        if (!resolvingVariables.add(key)) {
            return null;
        }
        try {
            ResolvedType type = null;
            boolean declared = false;
            if (container.kind().isFunctionLike()) {
                var params = container.kind() == NodeKind.METHOD ? container.requireSlot(2)
                        : container.kind() == NodeKind.FUNCTION ? container.requireSlot(1)
                        : container.requireSlot(0);
                for (var param : params.items()) {
                    if (Nodes.isName(param.requireSlot(2), name)) {
                        type = TypeNodes.parameterType(param, scopeOf(param));
                        declared = true;
                        if (type == null) {
                            return null;
                        }
                    }
                }
            }
            if (isWrittenIndirectly(container, name)) {
                return null;
            }
            for (var assign : Nodes.findAllInScope(container, NodeKind.ASSIGN)) {
                if (!"=".equals(assign.value()) || !Nodes.isName(assign.requireSlot(0), name)) {
                    continue;
                }
                var assigned = resolveType(assign.requireSlot(1));
                if (assigned == null || (declared && !assigned.equals(type))) {
                    return null;
                }
                type = assigned;
                declared = true;
            }
            return type;
        } finally {
            resolvingVariables.remove(key);
        }
    }

    /**
     * Writes that do not show up as a plain assignment to the variable: compound assignments, destructuring,
     * foreach targets and references.
     */
    private static boolean isWrittenIndirectly(Node container, String name) {
        for (var assign : Nodes.findAllInScope(container, NodeKind.ASSIGN)) {
            var target = assign.requireSlot(0);
            if (!"=".equals(assign.value()) && Nodes.isName(target, name)) {
                return true;
            }
            if (target.is(NodeKind.ARRAY) && mentionsVariable(target, name)) {
                return true;
            }
        }
        for (var foreach : Nodes.findAllInScope(container, NodeKind.FOREACH)) {
            if (mentionsVariable(foreach.slot(1), name) || mentionsVariable(foreach.slot(2), name)) {
                return true;
            }
        }
        // closures importing the variable by reference included
        for (var reference : Nodes.findAll(container, NodeKind.UNARY_OP)) {
            if ("&".equals(reference.value()) && Nodes.isName(reference.requireSlot(0), name)) {
                return true;
            }
        }
        for (var item : Nodes.findAll(container, NodeKind.ARRAY_ITEM)) {
            if ("&".equals(item.value()) && Nodes.isName(item.requireSlot(1), name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean mentionsVariable(@Nullable Node node, String name) {
        if (node == null) {
            return false;
        }
        for (var variable : Nodes.findAll(node, NodeKind.VARIABLE)) {
            if (name.equals(variable.value())) {
                return true;
            }
        }
        return false;
    }

    @Nullable
    private static ResolvedType constantType(Node name) {
        return switch (Nodes.stripLeadingBackslash(Objects.requireNonNull(name.value())).toLowerCase(Locale.ROOT)) {
            case "true", "false" -> ResolvedType.BOOL;
            case "null" -> ResolvedType.NULL;
            default -> null;
        };
    }

    @Nullable
    private static ResolvedType castType(String cast) {
        return switch (cast.toLowerCase(Locale.ROOT)) {
            case "int", "integer" -> ResolvedType.INT;
            case "bool", "boolean" -> ResolvedType.BOOL;
            case "float", "double", "real" -> ResolvedType.FLOAT;
            case "string", "binary" -> ResolvedType.STRING;
            case "array" -> ResolvedType.ARRAY;
            case "object" -> ResolvedType.objectOf("object");
            default -> null;
        };
    }

    private static boolean isFloatLiteral(String literal) {
        var lower = literal.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x") || lower.startsWith("0b")) {
            return false;
        }
        return lower.contains(".") || lower.contains("e");
    }
}
