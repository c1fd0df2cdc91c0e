package net.jrector.php;

import net.jrector.api.Node;
import net.jrector.api.NodeKind;
import net.jrector.api.Replacements;
import net.jrector.api.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Prints one tree against the source it was parsed from.
 * <p>
 * Parsed nodes without modifications below them print as their original text. Modified parsed nodes print as
 * their original text with the modified parts replaced, falling back to {@link NodeWriter} only when a node
 * cannot be patched (a slot that was emptied or filled, a value change, a reordered list). Synthetic nodes are
 * always written by {@link NodeWriter}.
 */
final class Reprinter {
    static final String INDENT = "    ";

    private final String source;
    private final NodeWriter writer;
    private final Map<Node, Boolean> dirty = new IdentityHashMap<>();

    Reprinter(String source) {
        this.source = source;
        this.writer = new NodeWriter(this);
    }

    String print(Node root) {
        return print(root, "");
    }

    /**
     * @param indent indentation of the line the output starts on, used for lines written fresh
     */
    String print(Node node, String indent) {
        if (node.isSynthetic()) {
            return writer.write(node, indent);
        }
        var span = Objects.requireNonNull(node.span());
        if (!isDirty(node)) {
            return span.slice(source).toString();
        }
        return reprint(node);
    }

    String source() {
        return source;
    }

    private boolean isDirty(Node node) {
        var cached = dirty.get(node);
        if (cached != null) {
            return cached;
        }
        boolean result = node.isModified();
        if (!result) {
            for (var child : node.children()) {
                if (child != null && isDirty(child)) {
                    result = true;
                    break;
                }
            }
        }
        dirty.put(node, result);
        return result;
    }

    private String reprint(Node node) {
        var span = Objects.requireNonNull(node.span());
        if (!Objects.equals(node.value(), node.originalValue())) {
            return fallback(node);
        }

        var replacements = new Replacements();
        var docComment = node.docComment();
        var originalDocComment = node.originalDocComment();
        if (!Objects.equals(docComment, originalDocComment)) {
            if (originalDocComment != null && originalDocComment.span() != null) {
                var docSpan = originalDocComment.span();
                if (docComment == null) {
                    replacements.remove(new SourceSpan(docSpan.start(), skipWhitespace(docSpan.end())));
                } else {
                    replacements.replace(docSpan, docComment.text());
                }
            } else if (docComment != null) {
                replacements.insertAt(span.start(), docComment.text() + "\n" + indentOf(span.start()));
            }
        }

        var original = node.originalChildren();
        var current = node.children();
        int fixedSlots = node.kind().fixedSlots();
        for (int i = 0; i < fixedSlots; i++) {
            var originalChild = original.get(i);
            var child = current.get(i);
            if (originalChild == child) {
                if (child != null && isDirty(child)) {
                    replacements.replace(child, print(child, indentOf(child)));
                }
            } else if (originalChild != null && child != null) {
                var text = print(child, indentOf(originalChild));
                if (Precedence.needsParentheses(node, i, child) && !isParenthesized(originalChild)) {
                    text = "(" + text + ")";
                }
                replacements.replace(originalChild, text);
            } else {
                return fallback(node);
            }
        }

        if (node.kind().hasList()) {
            var originalItems = original.subList(fixedSlots, original.size());
            var items = current.subList(fixedSlots, current.size());
            if (!reprintList(node, originalItems, items, replacements)) {
                return fallback(node);
            }
        }
        return replacements.apply(source, span);
    }

    private String fallback(Node node) {
        return writer.write(node, indentOf(node));
    }

    private boolean reprintList(Node node, List<Node> originals, List<Node> items, Replacements replacements) {
        if (sameIdentities(originals, items)) {
            for (var item : items) {
                if (isDirty(item)) {
                    replacements.replace(item, print(item, indentOf(item)));
                }
            }
            return true;
        }

        var originalSet = identitySet(originals);
        var itemSet = identitySet(items);
        var separator = separatorOf(node, originals);
        var itemIndent = itemIndentOf(node, originals);

        var pending = new ArrayList<Node>();
        Node anchor = null;
        int i = 0;
        int j = 0;
        while (i < originals.size() || j < items.size()) {
            var originalItem = i < originals.size() ? originals.get(i) : null;
            var item = j < items.size() ? items.get(j) : null;
            if (originalItem != null && originalItem == item) {
                flushBefore(originalItem, anchor, pending, separator, itemIndent, replacements);
                if (isDirty(item)) {
                    replacements.replace(item, print(item, indentOf(item)));
                }
                anchor = originalItem;
                i++;
                j++;
            } else if (originalItem != null && item != null && !itemSet.contains(originalItem) && !originalSet.contains(item)) {
                flushBefore(originalItem, anchor, pending, separator, itemIndent, replacements);
                replacements.replace(originalItem, print(item, indentOf(originalItem)));
                anchor = originalItem;
                i++;
                j++;
            } else if (originalItem != null && !itemSet.contains(originalItem)) {
                replacements.remove(removalSpan(originals, i, itemSet));
                i++;
            } else if (item != null && !originalSet.contains(item)) {
                pending.add(item);
                j++;
            } else {
                // reordered
                return false;
            }
        }

        if (!pending.isEmpty()) {
            if (anchor != null) {
                replacements.insertAt(anchor.span().end(), separator + join(pending, separator, itemIndent));
            } else if (!originals.isEmpty()) {
                replacements.insertAt(originals.get(0).span().start(), join(pending, separator, itemIndent));
            } else {
                var listStart = node.getAttribute(PhpParser.LIST_START);
                if (listStart == null) {
                    return false;
                }
                replacements.insertAt(listStart, emptyListInsertion(node, listStart, pending, separator, itemIndent));
            }
        }
        return true;
    }

    private void flushBefore(Node next, Node anchor, List<Node> pending, String separator, String itemIndent, Replacements replacements) {
        if (pending.isEmpty()) {
            return;
        }
        if (anchor != null) {
            replacements.insertAt(anchor.span().end(), separator + join(pending, separator, itemIndent));
        } else {
            replacements.insertAt(next.span().start(), join(pending, separator, itemIndent) + separator);
        }
        pending.clear();
    }

    private String join(List<Node> nodes, String separator, String indent) {
        var builder = new StringBuilder();
        for (var node : nodes) {
            if (!builder.isEmpty()) {
                builder.append(separator);
            }
            builder.append(print(node, indent));
        }
        return builder.toString();
    }

    private String emptyListInsertion(Node node, int listStart, List<Node> pending, String separator, String itemIndent) {
        if (node.kind().listStyle() != NodeKind.ListStyle.STATEMENTS) {
            return join(pending, separator, itemIndent);
        }
        var prefix = node.is(NodeKind.FILE) ? "\n\n" : "\n";
        var text = prefix + itemIndent + join(pending, separator, itemIndent);
        if (listStart < source.length() && !Character.isWhitespace(source.charAt(listStart))) {
            text += "\n" + indentOf(node);
        }
        return text;
    }

    private SourceSpan removalSpan(List<Node> originals, int index, Set<Node> kept) {
        var item = originals.get(index).span();
        if (index > 0) {
            return new SourceSpan(originals.get(index - 1).span().end(), item.end());
        }
        if (originals.size() > 1 && kept.contains(originals.get(1))) {
            return new SourceSpan(item.start(), originals.get(1).span().start());
        }
        return item;
    }

    private String separatorOf(Node node, List<Node> originals) {
        var style = node.kind().listStyle();
        if (originals.size() >= 2) {
            var between = source.substring(originals.get(0).span().end(), originals.get(1).span().start());
            var expected = switch (style) {
                case COMMA -> ",";
                case PIPE -> "|";
                default -> "";
            };
            if (between.strip().equals(expected)) {
                return between;
            }
        }
        return switch (style) {
            case COMMA -> ", ";
            case PIPE -> "|";
            default -> "\n" + itemIndentOf(node, originals);
        };
    }

    private String itemIndentOf(Node node, List<Node> originals) {
        if (!originals.isEmpty()) {
            return indentOf(originals.get(0));
        }
        return childIndent(node, indentOf(node));
    }

    static String childIndent(Node node, String indent) {
        return switch (node.kind()) {
            case FILE, FILE_WITHOUT_NAMESPACE -> indent;
            case NAMESPACE -> "braced".equals(node.value()) ? indent + INDENT : indent;
            default -> indent + INDENT;
        };
    }

    String indentOf(Node node) {
        return node.span() == null ? "" : indentOf(node.span().start());
    }

    /**
     * The leading whitespace of the line containing {@code offset}.
     */
    String indentOf(int offset) {
        int lineStart = source.lastIndexOf('\n', offset - 1) + 1;
        int end = lineStart;
        while (end < source.length() && end < offset && (source.charAt(end) == ' ' || source.charAt(end) == '\t')) {
            end++;
        }
        return source.substring(lineStart, end);
    }

    private int skipWhitespace(int offset) {
        while (offset < source.length() && Character.isWhitespace(source.charAt(offset))) {
            offset++;
        }
        return offset;
    }

    private boolean isParenthesized(Node node) {
        var span = node.span();
        int before = span.start() - 1;
        while (before >= 0 && Character.isWhitespace(source.charAt(before))) {
            before--;
        }
        int after = span.end();
        while (after < source.length() && Character.isWhitespace(source.charAt(after))) {
            after++;
        }
        return before >= 0 && after < source.length() && source.charAt(before) == '(' && source.charAt(after) == ')';
    }

    private static boolean sameIdentities(List<Node> first, List<Node> second) {
        if (first.size() != second.size()) {
            return false;
        }
        for (int i = 0; i < first.size(); i++) {
            if (first.get(i) != second.get(i)) {
                return false;
            }
        }
        return true;
    }

    private static Set<Node> identitySet(List<Node> nodes) {
        var set = Collections.newSetFromMap(new IdentityHashMap<Node, Boolean>());
        set.addAll(nodes);
        return set;
    }
}
