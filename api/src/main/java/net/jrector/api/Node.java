package net.jrector.api;

import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.UnmodifiableView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A syntax node.
 * <p>
 * A node exclusively owns its children. Moving a child into a newly created node is fine as long as the old
 * parent is discarded; placing the same instance in two positions of a live tree is not, use {@link #deepCopy()}.
 * <p>
 * Nodes produced by a parser remember the span, value, children and doc comment they were parsed with, which
 * lets a printer reuse the original text of everything that was not modified.
 */
public final class Node {
    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id;
    private final NodeKind kind;
    @Nullable
    private String value;
    private final List<Node> children;
    private final Map<String, Object> attributes = new HashMap<>();
    @Nullable
    private DocComment docComment;

    @Nullable
    private SourceSpan span;
    @Nullable
    private Original original;

    public Node(NodeKind kind, @Nullable String value, List<Node> children) {
        this.id = NEXT_ID.incrementAndGet();
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = value;
        this.children = new ArrayList<>(children);
        if (this.children.size() < kind.fixedSlots()) {
            throw new IllegalArgumentException(kind + " requires " + kind.fixedSlots() + " slots, got " + children.size());
        }
        if (!kind.hasList() && this.children.size() != kind.fixedSlots()) {
            throw new IllegalArgumentException(kind + " has exactly " + kind.fixedSlots() + " slots, got " + children.size());
        }
        for (int i = kind.fixedSlots(); i < this.children.size(); i++) {
            Objects.requireNonNull(this.children.get(i), "list items must not be null");
        }
    }

    public static Node leaf(NodeKind kind, String value) {
        return new Node(kind, value, List.of());
    }

    public static Node of(NodeKind kind, @Nullable Node... children) {
        var list = new ArrayList<Node>(children.length);
        Collections.addAll(list, children);
        return new Node(kind, null, list);
    }

    /**
     * Identity of this node, stable for its lifetime and unique within the process.
     */
    public long id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean is(NodeKind kind) {
        return this.kind == kind;
    }

    @Nullable
    public String value() {
        return value;
    }

    public void setValue(@Nullable String value) {
        this.value = value;
    }

    public int childCount() {
        return children.size();
    }

    /**
     * All children: the fixed slots (which may be {@code null}) followed by the list part.
     */
    @UnmodifiableView
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    @Nullable
    public Node child(int index) {
        return children.get(index);
    }

    public void setChild(int index, @Nullable Node child) {
        if (child == null && index >= kind.fixedSlots()) {
            throw new IllegalArgumentException("Cannot null out list item " + index + " of " + kind);
        }
        children.set(index, child);
    }

    @Nullable
    public Node slot(int slot) {
        checkSlot(slot);
        return children.get(slot);
    }

    public Node requireSlot(int slot) {
        return Objects.requireNonNull(slot(slot), () -> kind + " has no child in slot " + slot);
    }

    public void setSlot(int slot, @Nullable Node child) {
        checkSlot(slot);
        children.set(slot, child);
    }

    /**
     * @return a copy of the list part of the children
     */
    public List<Node> items() {
        return List.copyOf(children.subList(kind.fixedSlots(), children.size()));
    }

    public int itemCount() {
        return children.size() - kind.fixedSlots();
    }

    public Node item(int index) {
        return children.get(kind.fixedSlots() + index);
    }

    public void setItems(List<Node> items) {
        checkList();
        children.subList(kind.fixedSlots(), children.size()).clear();
        for (var item : items) {
            children.add(Objects.requireNonNull(item, "item"));
        }
    }

    public void addItem(Node item) {
        checkList();
        children.add(Objects.requireNonNull(item, "item"));
    }

    public void addItem(int index, Node item) {
        checkList();
        children.add(kind.fixedSlots() + index, Objects.requireNonNull(item, "item"));
    }

    /**
     * Replaces the child at {@code index} (counted over all children) with any number of nodes.
     * Only valid inside the list part.
     */
    public void spliceChild(int index, List<Node> replacements) {
        checkList();
        if (index < kind.fixedSlots()) {
            throw new IllegalArgumentException("Cannot splice fixed slot " + index + " of " + kind);
        }
        children.remove(index);
        for (int i = replacements.size() - 1; i >= 0; i--) {
            children.add(index, Objects.requireNonNull(replacements.get(i), "replacement"));
        }
    }

    @Nullable
    public DocComment docComment() {
        return docComment;
    }

    public void setDocComment(@Nullable DocComment docComment) {
        this.docComment = docComment;
    }

    @Nullable
    @SuppressWarnings("unchecked")
    public <T> T getAttribute(NodeKey<T> key) {
        return (T) attributes.get(key.name());
    }

    public <T> void putAttribute(NodeKey<T> key, @Nullable T value) {
        if (value == null) {
            attributes.remove(key.name());
        } else {
            attributes.put(key.name(), value);
        }
    }

    public boolean hasAttribute(NodeKey<?> key) {
        return attributes.containsKey(key.name());
    }

    @UnmodifiableView
    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * @return the span this node was parsed from, or {@code null} for nodes created by rules
     */
    @Nullable
    public SourceSpan span() {
        return span;
    }

    public boolean isSynthetic() {
        return span == null;
    }

    @Nullable
    public String originalValue() {
        return original == null ? null : original.value;
    }

    /**
     * @return the children as they were parsed, or an empty list for synthetic nodes
     */
    public List<Node> originalChildren() {
        return original == null ? List.of() : original.children;
    }

    @Nullable
    public DocComment originalDocComment() {
        return original == null ? null : original.docComment;
    }

    /**
     * Whether the value, doc comment or child identities differ from the parsed state.
     * Changes deeper in the tree are not considered.
     */
    public boolean isModified() {
        if (original == null) {
            return true;
        }
        if (!Objects.equals(value, original.value) || !Objects.equals(docComment, original.docComment)) {
            return true;
        }
        if (children.size() != original.children.size()) {
            return true;
        }
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) != original.children.get(i)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Records the span of a freshly parsed node.
     */
    @ApiStatus.Internal
    public void setSpan(SourceSpan span) {
        this.span = span;
    }

    /**
     * Snapshots the current state of this subtree as its original state. Called by parsers once a tree is complete.
     */
    @ApiStatus.Internal
    public void freezeOriginal() {
        this.original = new Original(value, nonNullCopy(children), docComment);
        for (var child : children) {
            if (child != null) {
                child.freezeOriginal();
            }
        }
    }

    /**
     * Copies this subtree. The copy keeps spans and original state, so unmodified copies print like the original.
     */
    public Node deepCopy() {
        return deepCopy(new IdentityHashMap<>());
    }

    private Node deepCopy(Map<Node, Node> copies) {
        var copiedChildren = new ArrayList<Node>(children.size());
        for (var child : children) {
            copiedChildren.add(child == null ? null : child.deepCopy(copies));
        }
        var copy = new Node(kind, value, copiedChildren);
        copy.attributes.putAll(attributes);
        copy.docComment = docComment;
        copy.span = span;
        if (original != null) {
            var originalChildren = new ArrayList<Node>(original.children.size());
            for (var originalChild : original.children) {
                originalChildren.add(originalChild == null ? null : copies.getOrDefault(originalChild, originalChild));
            }
            copy.original = new Original(original.value, nonNullCopy(originalChildren), original.docComment);
        }
        copies.put(this, copy);
        return copy;
    }

    private void checkSlot(int slot) {
        if (slot < 0 || slot >= kind.fixedSlots()) {
            throw new IndexOutOfBoundsException(kind + " has no slot " + slot);
        }
    }

    private void checkList() {
        if (!kind.hasList()) {
            throw new UnsupportedOperationException(kind + " has no list part");
        }
    }

    // absent slots are null, which List.copyOf rejects
    private static List<Node> nonNullCopy(List<Node> nodes) {
        return Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    @Override
    public String toString() {
        return value == null ? kind + "#" + id : kind + "#" + id + "(" + value + ")";
    }

    private record Original(@Nullable String value, List<Node> children, @Nullable DocComment docComment) {
    }
}
