package net.jrector.api;

import java.util.List;
import java.util.Objects;

/**
 * The outcome of a single {@link Rule#refactor} call.
 */
public final class RefactorResult {
    private static final RefactorResult NO_CHANGE = new RefactorResult(Type.NO_CHANGE, List.of());
    private static final RefactorResult REMOVE = new RefactorResult(Type.REMOVE, List.of());
    private static final RefactorResult STOP = new RefactorResult(Type.STOP, List.of());

    private final Type type;
    private final List<Node> nodes;

    private RefactorResult(Type type, List<Node> nodes) {
        this.type = type;
        this.nodes = nodes;
    }

    public static RefactorResult noChange() {
        return NO_CHANGE;
    }

    /**
     * Replaces the visited node. Passing the visited node itself reports an in-place change.
     */
    public static RefactorResult replace(Node node) {
        return new RefactorResult(Type.REPLACE, List.of(Objects.requireNonNull(node, "node")));
    }

    /**
     * Replaces the visited node with several siblings. Only valid where the node is an item of a list,
     * e.g. a statement.
     */
    public static RefactorResult replaceWith(List<Node> nodes) {
        if (nodes.isEmpty()) {
            return REMOVE;
        }
        return nodes.size() == 1 ? replace(nodes.get(0)) : new RefactorResult(Type.REPLACE_MANY, List.copyOf(nodes));
    }

    public static RefactorResult remove() {
        return REMOVE;
    }

    /**
     * No change, and no further rules should look at this node in the current pass.
     */
    public static RefactorResult stop() {
        return STOP;
    }

    public Type type() {
        return type;
    }

    public List<Node> nodes() {
        return nodes;
    }

    public Node node() {
        if (type != Type.REPLACE) {
            throw new IllegalStateException("No single replacement node for " + type);
        }
        return nodes.get(0);
    }

    public boolean isChange() {
        return type == Type.REPLACE || type == Type.REPLACE_MANY || type == Type.REMOVE;
    }

    @Override
    public String toString() {
        return nodes.isEmpty() ? type.toString() : type + nodes.toString();
    }

    public enum Type {
        NO_CHANGE,
        REPLACE,
        REPLACE_MANY,
        REMOVE,
        STOP
    }
}
