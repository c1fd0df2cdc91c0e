package net.jrector.php;

import net.jrector.api.Node;
import net.jrector.api.NodeKind;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Operator binding strength, higher binds tighter.
 */
final class Precedence {
    static final int LOWEST = 0;
    static final int ASSIGNMENT = 4;
    static final int TERNARY = 5;
    static final int COALESCE = 6;
    static final int NOT = 18;
    static final int INSTANCEOF = 19;
    static final int UNARY = 20;
    static final int NEW = 21;
    static final int POW = 21;
    static final int POSTFIX = 22;
    static final int PRIMARY = 23;

    static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", ".=", "%=", "**=", "??=", "&=", "|=", "^=", "<<=", ">>="
    );

    private static final Map<String, Integer> BINARY = Map.ofEntries(
            Map.entry("or", 1),
            Map.entry("xor", 2),
            Map.entry("and", 3),
            Map.entry("??", COALESCE),
            Map.entry("||", 7),
            Map.entry("&&", 8),
            Map.entry("|", 9),
            Map.entry("^", 10),
            Map.entry("&", 11),
            Map.entry("==", 12),
            Map.entry("!=", 12),
            Map.entry("===", 12),
            Map.entry("!==", 12),
            Map.entry("<>", 12),
            Map.entry("<=>", 12),
            Map.entry("<", 13),
            Map.entry("<=", 13),
            Map.entry(">", 13),
            Map.entry(">=", 13),
            Map.entry(".", 14),
            Map.entry("<<", 15),
            Map.entry(">>", 15),
            Map.entry("+", 16),
            Map.entry("-", 16),
            Map.entry("*", 17),
            Map.entry("/", 17),
            Map.entry("%", 17),
            Map.entry("**", POW)
    );

    private static final Set<String> LOW_PRECEDENCE_UNARY = Set.of("include", "include_once", "require", "require_once", "print");

    private Precedence() {
    }

    /**
     * @return the precedence of a binary operator, {@code -1} if {@code operator} is none
     */
    static int binary(String operator) {
        return BINARY.getOrDefault(operator.toLowerCase(Locale.ROOT), -1);
    }

    static boolean isRightAssociative(String operator) {
        return operator.equals("??") || operator.equals("**");
    }

    static int of(Node node) {
        return switch (node.kind()) {
            case ASSIGN, ARROW_FUNCTION -> ASSIGNMENT;
            case TERNARY -> TERNARY;
            case BINARY_OP -> binary(requireValue(node));
            case INSTANCEOF -> INSTANCEOF;
            case UNARY_OP -> unary(requireValue(node));
            case CAST -> UNARY;
            case POSTFIX_OP -> POSTFIX;
            case NEW -> NEW;
            default -> PRIMARY;
        };
    }

    static int unary(String operator) {
        var lower = operator.toLowerCase(Locale.ROOT);
        if (lower.equals("!")) {
            return NOT;
        }
        if (lower.equals("clone")) {
            return POSTFIX;
        }
        return LOW_PRECEDENCE_UNARY.contains(lower) ? ASSIGNMENT : UNARY;
    }

    /**
     * The precedence a child needs to appear in {@code parent} at {@code index} without parentheses.
     */
    static int required(Node parent, int index) {
        return switch (parent.kind()) {
            case BINARY_OP -> {
                var operator = requireValue(parent);
                int precedence = binary(operator);
                boolean right = isRightAssociative(operator);
                if (index == 0) {
                    yield right ? precedence + 1 : precedence;
                }
                yield right ? precedence : precedence + 1;
            }
            case ASSIGN -> index == 0 ? POSTFIX : ASSIGNMENT;
            case UNARY_OP -> {
                int precedence = unary(requireValue(parent));
                yield precedence == POSTFIX ? POSTFIX : precedence;
            }
            case CAST -> UNARY;
            case POSTFIX_OP -> POSTFIX;
            case TERNARY -> index == 1 ? LOWEST : COALESCE;
            case INSTANCEOF -> index == 0 ? UNARY : PRIMARY;
            case METHOD_CALL, PROPERTY_FETCH, ARRAY_DIM_FETCH -> index == 0 ? POSTFIX : LOWEST;
            case FUNC_CALL, STATIC_CALL, STATIC_PROPERTY_FETCH, CLASS_CONST_FETCH -> index == 0 ? PRIMARY : LOWEST;
            default -> LOWEST;
        };
    }

    static boolean needsParentheses(@Nullable Node parent, int index, Node child) {
        if (parent == null || index >= parent.kind().fixedSlots()) {
            return false;
        }
        if (!isExpression(child.kind())) {
            return false;
        }
        return of(child) < required(parent, index);
    }

    private static boolean isExpression(NodeKind kind) {
        return switch (kind) {
            case NAME, IDENTIFIER, MODIFIERS, ARG_LIST, PARAM_LIST, BLOCK, NULLABLE_TYPE, UNION_TYPE, NAME_LIST,
                 CLOSURE_USES -> false;
            default -> true;
        };
    }

    private static String requireValue(Node node) {
        var value = node.value();
        if (value == null) {
            throw new IllegalStateException(node + " has no operator");
        }
        return value;
    }
}
