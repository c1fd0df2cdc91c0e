package net.jrector.engine;

import net.jrector.api.Node;
import net.jrector.api.NodeKeys;
import net.jrector.api.NodeKind;
import net.jrector.api.Nodes;
import net.jrector.api.Scope;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Stores the lexical scope on every node of a tree and the resolved class name on every class reference.
 */
final class ScopeAnnotator {
    private ScopeAnnotator() {
    }

    static void annotate(Node root) {
        annotate(root, Scope.GLOBAL);
    }

    static void annotate(Node node, Scope scope) {
        node.putAttribute(NodeKeys.SCOPE, scope);
        var inner = enter(node, scope);
        for (int i = 0; i < node.childCount(); i++) {
            var child = node.child(i);
            if (child == null) {
                continue;
            }
            if (child.is(NodeKind.NAME)) {
                child.putAttribute(NodeKeys.RESOLVED_NAME, resolveClassReference(node, i, child, inner));
            }
            annotate(child, inner);
        }
    }

    /**
     * The scope that the children of {@code node} live in.
     */
    static Scope enter(Node node, Scope scope) {
        return switch (node.kind()) {
            case NAMESPACE -> scope.withNamespace(namespaceName(node), collectUses(node));
            case FILE_WITHOUT_NAMESPACE -> scope.withNamespace(null, collectUses(node));
            case CLASS -> scope.withClass(qualify(scope, node.requireSlot(1).value()));
            case INTERFACE -> scope.withClass(qualify(scope, node.requireSlot(0).value()));
            case METHOD, FUNCTION, CLOSURE, ARROW_FUNCTION -> scope.withFunction(node);
            default -> scope;
        };
    }

    /**
     * Fully qualified name of a declaration named {@code name} in the namespace of {@code scope}.
     */
    static String qualify(Scope scope, @Nullable String name) {
        if (name == null) {
            throw new IllegalStateException("Declaration without a name");
        }
        return scope.namespace() == null ? name : scope.namespace() + "\\" + name;
    }

    @Nullable
    private static String namespaceName(Node namespace) {
        var name = namespace.slot(0);
        return name == null ? null : Nodes.stripLeadingBackslash(name.value());
    }

    /**
     * Class imports of a namespace body, keyed by lower-cased alias.
     */
    static Map<String, String> collectUses(Node container) {
        var uses = new HashMap<String, String>();
        for (var statement : container.items()) {
            if (!statement.is(NodeKind.USE) || statement.value() != null) {
                continue;
            }
            for (var item : statement.items()) {
                var name = Nodes.stripLeadingBackslash(item.requireSlot(0).value());
                var alias = item.value() != null ? item.value() : name.substring(name.lastIndexOf('\\') + 1);
                uses.put(alias.toLowerCase(Locale.ROOT), name);
            }
        }
        return uses;
    }

    @Nullable
    private static String resolveClassReference(Node parent, int index, Node name, Scope scope) {
        var value = name.value();
        if (value == null) {
            return null;
        }
        switch (parent.kind()) {
            case NAMESPACE:
                return null;
            case USE_ITEM:
                return Nodes.stripLeadingBackslash(value);
            case FUNC_CALL:
            case CONST_FETCH:
                // functions and constants fall back to the global namespace, they are not classes
                return null;
            default:
                if (value.equalsIgnoreCase("parent")) {
                    return null;
                }
                return scope.resolveClassName(value);
        }
    }
}
