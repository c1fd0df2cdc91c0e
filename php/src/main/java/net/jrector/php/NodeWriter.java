package net.jrector.php;

import net.jrector.api.Node;
import net.jrector.api.NodeKind;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Writes nodes in a canonical layout: four space indentation, one statement per line, braces of classes and
 * functions on their own line. Children are printed through the {@link Reprinter} so parsed subtrees keep their
 * original text.
 */
final class NodeWriter {
    private final Reprinter printer;

    NodeWriter(Reprinter printer) {
        this.printer = printer;
    }

    String write(Node node, String indent) {
        var docComment = node.docComment();
        var text = writeBody(node, indent);
        return docComment == null ? text : docComment.text() + "\n" + indent + text;
    }

    private String writeBody(Node node, String indent) {
        return switch (node.kind()) {
            case FILE -> "<?php\n\n" + statements(node, indent);
            case FILE_WITHOUT_NAMESPACE -> statements(node, indent);
            case NAMESPACE -> namespace(node, indent);
            case DECLARE, STRING, NUMBER, IDENTIFIER, NAME, MODIFIERS -> value(node);
            case USE -> "use " + (node.value() != null ? node.value() + " " : "") + list(node, ", ", indent) + ";";
            case USE_ITEM -> child(node, 0, indent) + (node.value() != null ? " as " + node.value() : "");
            case CLASS -> suffix(node.slot(0), " ", indent) + "class " + child(node, 1, indent)
                    + prefix(" extends ", node.slot(2), indent) + prefix(" implements ", node.slot(3), indent)
                    + "\n" + indent + body(node, indent);
            case INTERFACE -> "interface " + child(node, 0, indent) + prefix(" extends ", node.slot(1), indent)
                    + "\n" + indent + body(node, indent);
            case NAME_LIST, UNION_TYPE -> list(node, node.is(NodeKind.UNION_TYPE) ? "|" : ", ", indent);
            case PROPERTY -> child(node, 0, indent) + " " + suffix(node.slot(1), " ", indent) + list(node, ", ", indent) + ";";
            case PROPERTY_ITEM -> child(node, 0, indent) + prefix(" = ", node.slot(1), indent);
            case CLASS_CONST -> suffix(node.slot(0), " ", indent) + "const " + list(node, ", ", indent) + ";";
            case CONST_ITEM -> child(node, 0, indent) + " = " + child(node, 1, indent);
            case METHOD -> suffix(node.slot(0), " ", indent) + "function " + flag(node, "&") + child(node, 1, indent)
                    + child(node, 2, indent) + prefix(": ", node.slot(3), indent)
                    + (node.slot(4) == null ? ";" : "\n" + indent + child(node, 4, indent));
            case FUNCTION -> "function " + flag(node, "&") + child(node, 0, indent) + child(node, 1, indent)
                    + prefix(": ", node.slot(2), indent) + "\n" + indent + child(node, 3, indent);
            case PARAM_LIST, CLOSURE_USES -> "(" + list(node, ", ", indent) + ")";
            case PARAM -> suffix(node.slot(0), " ", indent) + suffix(node.slot(1), " ", indent)
                    + (node.value() != null ? node.value() : "") + child(node, 2, indent) + prefix(" = ", node.slot(3), indent);
            case BLOCK -> node.itemCount() == 0 ? "{\n" + indent + "}" : "{\n" + statements(node, indent + Reprinter.INDENT) + "\n" + indent + "}";
            case NULLABLE_TYPE -> "?" + child(node, 0, indent);
            case EXPRESSION_STMT -> child(node, 0, indent) + ";";
            case RETURN -> "return" + prefix(" ", node.slot(0), indent) + ";";
            case ECHO -> "echo " + list(node, ", ", indent) + ";";
            case THROW -> "throw " + child(node, 0, indent) + ";";
            case IF -> "if (" + child(node, 0, indent) + ")" + controlBody(node, 1, indent) + elsePart(node, indent);
            case ELSE -> elseBody(node, indent);
            case FOREACH -> "foreach (" + child(node, 0, indent) + " as " + suffix(node.slot(1), " => ", indent)
                    + flag(node, "&") + child(node, 2, indent) + ")" + controlBody(node, 3, indent);
            case WHILE -> "while (" + child(node, 0, indent) + ")" + controlBody(node, 1, indent);
            case ASSIGN, BINARY_OP -> child(node, 0, indent) + " " + value(node) + " " + child(node, 1, indent);
            case UNARY_OP -> unary(node, indent);
            case POSTFIX_OP -> child(node, 0, indent) + value(node);
            case CAST -> "(" + value(node) + ")" + child(node, 0, indent);
            case TERNARY -> node.slot(1) == null
                    ? child(node, 0, indent) + " ?: " + child(node, 2, indent)
                    : child(node, 0, indent) + " ? " + child(node, 1, indent) + " : " + child(node, 2, indent);
            case INSTANCEOF -> child(node, 0, indent) + " instanceof " + child(node, 1, indent);
            case VARIABLE -> "$" + value(node);
            case CONST_FETCH -> child(node, 0, indent);
            case ARRAY -> node.value() != null
                    ? node.value() + list(node, ", ", indent) + ")"
                    : "[" + list(node, ", ", indent) + "]";
            case ARRAY_ITEM -> arrayItem(node, indent);
            case ARRAY_DIM_FETCH -> child(node, 0, indent) + "[" + (node.slot(1) == null ? "" : child(node, 1, indent)) + "]";
            case FUNC_CALL -> child(node, 0, indent) + child(node, 1, indent);
            case METHOD_CALL -> child(node, 0, indent) + arrow(node) + child(node, 1, indent) + child(node, 2, indent);
            case STATIC_CALL -> child(node, 0, indent) + "::" + child(node, 1, indent) + child(node, 2, indent);
            case PROPERTY_FETCH -> child(node, 0, indent) + arrow(node) + child(node, 1, indent);
            case STATIC_PROPERTY_FETCH, CLASS_CONST_FETCH -> child(node, 0, indent) + "::" + child(node, 1, indent);
            case NEW -> "new " + child(node, 0, indent) + (node.slot(1) == null ? "" : child(node, 1, indent));
            case ARG_LIST -> "...".equals(node.value()) ? "(...)" : "(" + list(node, ", ", indent) + ")";
            case ARG -> flag(node, "...") + child(node, 0, indent);
            case CLOSURE -> ("static".equals(node.value()) ? "static " : "") + "function " + flag(node, "&") + child(node, 0, indent)
                    + prefix(" use ", node.slot(1), indent) + prefix(": ", node.slot(2), indent) + " " + child(node, 3, indent);
            case ARROW_FUNCTION -> ("static".equals(node.value()) ? "static " : "") + "fn" + child(node, 0, indent)
                    + prefix(": ", node.slot(1), indent) + " => " + child(node, 2, indent);
        };
    }

    private String namespace(Node node, String indent) {
        var name = node.slot(0);
        var header = name == null ? "namespace" : "namespace " + child(node, 0, indent);
        if ("braced".equals(node.value())) {
            return header + " {\n" + statements(node, indent + Reprinter.INDENT) + "\n" + indent + "}";
        }
        if (node.itemCount() == 0) {
            return header + ";";
        }
        return header + ";\n\n" + indent + statements(node, indent);
    }

    private String body(Node node, String indent) {
        if (node.itemCount() == 0) {
            return "{\n" + indent + "}";
        }
        return "{\n" + statements(node, indent + Reprinter.INDENT) + "\n" + indent + "}";
    }

    /**
     * Writes the list part one item per line. Blank lines between items that were adjacent in the source are kept.
     */
    private String statements(Node node, String itemIndent) {
        var items = node.items();
        var builder = new StringBuilder();
        boolean leadingIndent = !node.is(NodeKind.FILE_WITHOUT_NAMESPACE) && !node.is(NodeKind.NAMESPACE)
                || "braced".equals(node.value());
        for (int i = 0; i < items.size(); i++) {
            var item = items.get(i);
            if (i == 0) {
                if (leadingIndent) {
                    builder.append(itemIndent);
                }
            } else {
                builder.append("\n".repeat(lineBreaksBetween(items.get(i - 1), item))).append(itemIndent);
            }
            builder.append(printer.print(item, itemIndent));
        }
        return builder.toString();
    }

    private int lineBreaksBetween(Node previous, Node next) {
        var previousSpan = previous.span();
        var nextSpan = next.span();
        if (previousSpan == null || nextSpan == null || previousSpan.end() > nextSpan.start()) {
            return 1;
        }
        var between = printer.source().substring(previousSpan.end(), nextSpan.start());
        if (!between.isBlank()) {
            return 1;
        }
        return (int) Math.max(1, between.chars().filter(c -> c == '\n').count());
    }

    private String controlBody(Node node, int slot, String indent) {
        var body = node.requireSlot(slot);
        if (body.is(NodeKind.BLOCK)) {
            return " " + printer.print(body, indent);
        }
        var bodyIndent = indent + Reprinter.INDENT;
        return "\n" + bodyIndent + printer.print(body, bodyIndent);
    }

    private String elsePart(Node node, String indent) {
        var elseNode = node.slot(2);
        if (elseNode == null) {
            return "";
        }
        var body = node.requireSlot(1);
        var separator = body.is(NodeKind.BLOCK) ? " " : "\n" + indent;
        return separator + printer.print(elseNode, indent);
    }

    private String elseBody(Node node, String indent) {
        var body = node.requireSlot(0);
        if (!body.is(NodeKind.IF)) {
            return "else" + controlBody(node, 0, indent);
        }
        var text = printer.print(body, indent);
        if ("elseif".equals(node.value())) {
            // a parsed elseif branch starts with its keyword
            return text.startsWith("elseif") ? text : "else" + text;
        }
        return "else " + text;
    }

    private String unary(Node node, String indent) {
        var operator = value(node);
        var operand = child(node, 0, indent);
        if (Character.isLetter(operator.charAt(operator.length() - 1))) {
            return operator + " " + operand;
        }
        // keep "- -$a" from turning into a decrement
        if ((operator.equals("-") && operand.startsWith("-")) || (operator.equals("+") && operand.startsWith("+"))) {
            return operator + " " + operand;
        }
        return operator + operand;
    }

    private String arrayItem(Node node, String indent) {
        var value = child(node, 1, indent);
        if ("...".equals(node.value())) {
            return "..." + value;
        }
        var reference = "&".equals(node.value()) ? "&" : "";
        return suffix(node.slot(0), " => ", indent) + reference + value;
    }

    private static String arrow(Node node) {
        return "?->".equals(node.value()) ? "?->" : "->";
    }

    private String child(Node node, int index, String indent) {
        var child = node.child(index);
        if (child == null) {
            return "";
        }
        var text = printer.print(child, indent);
        return Precedence.needsParentheses(node, index, child) ? "(" + text + ")" : text;
    }

    private String prefix(String prefix, @Nullable Node child, String indent) {
        return child == null ? "" : prefix + printer.print(child, indent);
    }

    private String suffix(@Nullable Node child, String suffix, String indent) {
        return child == null ? "" : printer.print(child, indent) + suffix;
    }

    private String list(Node node, String separator, String indent) {
        List<Node> items = node.items();
        var builder = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                builder.append(separator);
            }
            builder.append(printer.print(items.get(i), indent));
        }
        return builder.toString();
    }

    private static String flag(Node node, String flag) {
        var value = node.value();
        return value != null && value.contains(flag) ? flag : "";
    }

    private static String value(Node node) {
        var value = node.value();
        if (value == null) {
            throw new IllegalStateException(node + " has no value to print");
        }
        return value;
    }
}
