package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Queries over nodes and small tree walks used by rules.
 */
public final class Nodes {
    private static final Set<NodeKind> NAMED_KINDS = Set.of(NodeKind.NAME, NodeKind.IDENTIFIER, NodeKind.VARIABLE);

    private Nodes() {
    }

    /**
     * @return the name carried by a name, identifier or variable node, {@code null} for any other node
     */
    @Nullable
    public static String getName(@Nullable Node node) {
        if (node == null || !NAMED_KINDS.contains(node.kind())) {
            return null;
        }
        return node.value();
    }

    /**
     * Compares a name, identifier or variable against a name or a {@code Prefix*} pattern.
     * Class-like names compare case-insensitively, as they do in PHP; variables compare exactly.
     */
    public static boolean isName(@Nullable Node node, String pattern) {
        var name = getName(node);
        if (name == null) {
            return false;
        }
        if (node.kind() != NodeKind.VARIABLE) {
            name = stripLeadingBackslash(name).toLowerCase(Locale.ROOT);
            pattern = stripLeadingBackslash(pattern).toLowerCase(Locale.ROOT);
        }
        if (pattern.endsWith("*")) {
            return name.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return name.equals(pattern);
    }

    public static boolean isNames(@Nullable Node node, Iterable<String> patterns) {
        for (var pattern : patterns) {
            if (isName(node, pattern)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isFullyQualified(Node name) {
        return name.is(NodeKind.NAME) && name.value() != null && name.value().startsWith("\\");
    }

    public static String stripLeadingBackslash(String name) {
        return name.startsWith("\\") ? name.substring(1) : name;
    }

    public static boolean isThis(@Nullable Node node) {
        return node != null && node.is(NodeKind.VARIABLE) && "this".equals(node.value());
    }

    /**
     * A call written as {@code foo(...)}, creating a closure instead of calling.
     */
    public static boolean isFirstClassCallable(Node call) {
        var args = switch (call.kind()) {
            case FUNC_CALL -> call.slot(1);
            case METHOD_CALL, STATIC_CALL -> call.slot(2);
            default -> null;
        };
        return args != null && "...".equals(args.value());
    }

    public static boolean hasModifier(@Nullable Node modifiers, String modifier) {
        if (modifiers == null || modifiers.value() == null) {
            return false;
        }
        for (var keyword : modifiers.value().split(" ")) {
            if (keyword.equalsIgnoreCase(modifier)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Visits the subtree in pre-order, skipping absent slots.
     */
    public static void walk(Node root, Consumer<Node> visitor) {
        visitor.accept(root);
        for (var child : root.children()) {
            if (child != null) {
                walk(child, visitor);
            }
        }
    }

    public static List<Node> findAll(Node root, NodeKind kind) {
        var result = new ArrayList<Node>();
        walk(root, node -> {
            if (node.is(kind)) {
                result.add(node);
            }
        });
        return result;
    }

    /**
     * Like {@link #findAll(Node, NodeKind)}, but does not descend into nested functions, closures or classes.
     */
    public static List<Node> findAllInScope(Node root, NodeKind kind) {
        var result = new ArrayList<Node>();
        for (var child : root.children()) {
            if (child != null) {
                collectInScope(child, kind, result);
            }
        }
        return result;
    }

    private static void collectInScope(Node node, NodeKind kind, List<Node> result) {
        if (node.is(kind)) {
            result.add(node);
        }
        if (node.kind().isFunctionLike() || node.kind().isClassLike()) {
            return;
        }
        for (var child : node.children()) {
            if (child != null) {
                collectInScope(child, kind, result);
            }
        }
    }

    /**
     * Walks the subtree and lets {@code callback} replace nodes. A non-null return value different from the
     * visited node takes its place, and the walk continues into the children of the replacement.
     * The root itself is never passed to the callback.
     *
     * @return {@code true} if any node was replaced
     */
    public static boolean traverse(Node root, Function<Node, @Nullable Node> callback) {
        boolean changed = false;
        for (int i = 0; i < root.childCount(); i++) {
            var child = root.child(i);
            if (child == null) {
                continue;
            }
            var replacement = callback.apply(child);
            if (replacement != null && replacement != child) {
                root.setChild(i, replacement);
                child = replacement;
                changed = true;
            }
            if (traverse(child, callback)) {
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Structural identity of a subtree, independent of formatting and node identities.
     */
    public static String fingerprint(Node root) {
        var builder = new StringBuilder();
        appendFingerprint(root, builder);
        return builder.toString();
    }

    private static void appendFingerprint(@Nullable Node node, StringBuilder builder) {
        if (node == null) {
            builder.append('_');
            return;
        }
        builder.append(node.kind().ordinal());
        if (node.value() != null) {
            builder.append('\'').append(node.value()).append('\'');
        }
        if (node.docComment() != null) {
            builder.append("/**").append(node.docComment().text().hashCode());
        }
        if (node.childCount() > 0) {
            builder.append('(');
            for (var child : node.children()) {
                appendFingerprint(child, builder);
                builder.append(',');
            }
            builder.append(')');
        }
    }

    /**
     * Checks that no node instance occurs twice in the tree.
     *
     * @throws IllegalStateException naming the first node found in two positions
     */
    public static void verifyOwnership(Node root) {
        var seen = Collections.newSetFromMap(new IdentityHashMap<Node, Boolean>());
        walk(root, node -> {
            if (!seen.add(node)) {
                throw new IllegalStateException("Node " + node + " is shared between two parents, use deepCopy() to reuse subtrees");
            }
        });
    }
}
