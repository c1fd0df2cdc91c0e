package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates synthetic nodes for rules. Arguments are moved into the new nodes, not copied.
 */
public final class NodeFactory {
    private NodeFactory() {
    }

    public static Node name(String name) {
        return Node.leaf(NodeKind.NAME, name);
    }

    public static Node identifier(String name) {
        return Node.leaf(NodeKind.IDENTIFIER, name);
    }

    public static Node variable(String name) {
        return Node.leaf(NodeKind.VARIABLE, name);
    }

    public static Node string(String value) {
        return Node.leaf(NodeKind.STRING, "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'");
    }

    public static Node args(List<Node> args) {
        return new Node(NodeKind.ARG_LIST, null, args);
    }

    public static Node arg(Node expression) {
        return Node.of(NodeKind.ARG, expression);
    }

    public static Node staticCall(String className, String methodName, Node args) {
        return Node.of(NodeKind.STATIC_CALL, name(className), identifier(methodName), args);
    }

    public static Node array(List<Node> items) {
        return new Node(NodeKind.ARRAY, null, items);
    }

    public static Node arrayItem(@Nullable Node key, Node value) {
        return Node.of(NodeKind.ARRAY_ITEM, key, value);
    }

    public static Node spreadItem(Node value) {
        var item = Node.of(NodeKind.ARRAY_ITEM, null, value);
        item.setValue("...");
        return item;
    }

    public static Node namespace(@Nullable String name, List<Node> statements) {
        var children = new ArrayList<Node>(statements.size() + 1);
        children.add(name == null ? null : name(name));
        children.addAll(statements);
        return new Node(NodeKind.NAMESPACE, null, children);
    }

    /**
     * Creates a type node: {@code ?Foo} becomes a nullable type, builtin types become identifiers and
     * everything else a name.
     */
    public static Node type(String type) {
        if (type.startsWith("?")) {
            return Node.of(NodeKind.NULLABLE_TYPE, type(type.substring(1)));
        }
        if (type.contains("|")) {
            var members = new ArrayList<Node>();
            for (var member : type.split("\\|")) {
                members.add(type(member));
            }
            return new Node(NodeKind.UNION_TYPE, null, members);
        }
        return ResolvedType.isBuiltinTypeName(type) ? identifier(type) : name(type);
    }
}
