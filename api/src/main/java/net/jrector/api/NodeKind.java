package net.jrector.api;

/**
 * The tag of a {@link Node}.
 * <p>
 * Every kind has a fixed number of leading child slots (an absent optional part is a {@code null} slot),
 * optionally followed by a variable-length list of children. The comment next to each constant lists
 * the fixed slots in order, followed by the content of the list part.
 */
public enum NodeKind {
    /** list: top-level statements */
    FILE(0, ListStyle.STATEMENTS),
    /** list: statements of a file that declares no namespace */
    FILE_WITHOUT_NAMESPACE(0, ListStyle.STATEMENTS),
    /** [name?], list: statements. Value {@code "braced"} for the block form */
    NAMESPACE(1, ListStyle.STATEMENTS),
    /** value: verbatim declare statement */
    DECLARE(0),
    /** list: use items. Value {@code "function"} or {@code "const"} for those import kinds */
    USE(0, ListStyle.COMMA),
    /** [name]. Value: alias */
    USE_ITEM(1),
    /** [modifiers?, identifier, extends?, implements?], list: members */
    CLASS(4, ListStyle.STATEMENTS),
    /** [identifier, extends?], list: members */
    INTERFACE(2, ListStyle.STATEMENTS),
    /** list: names */
    NAME_LIST(0, ListStyle.COMMA),
    /** [modifiers, type?], list: property items */
    PROPERTY(2, ListStyle.COMMA),
    /** [variable, default?] */
    PROPERTY_ITEM(2),
    /** [modifiers?], list: constant items */
    CLASS_CONST(1, ListStyle.COMMA),
    /** [identifier, value] */
    CONST_ITEM(2),
    /** [modifiers?, identifier, params, return type?, body?] */
    METHOD(5),
    /** [identifier, params, return type?, body] */
    FUNCTION(4),
    /** list: parameters */
    PARAM_LIST(0, ListStyle.COMMA),
    /** [modifiers?, type?, variable, default?]. Value: {@code "&"}, {@code "..."} or {@code "&..."} */
    PARAM(4),
    /** list: statements */
    BLOCK(0, ListStyle.STATEMENTS),
    /** [type] */
    NULLABLE_TYPE(1),
    /** list: types */
    UNION_TYPE(0, ListStyle.PIPE),

    /** [expression] */
    EXPRESSION_STMT(1),
    /** [expression?] */
    RETURN(1),
    /** list: expressions */
    ECHO(0, ListStyle.COMMA),
    /** [expression] */
    THROW(1),
    /** [condition, block, else?] */
    IF(3),
    /** [block or if] */
    ELSE(1),
    /** [expression, key variable?, value, block]. Value {@code "&"} for by-reference iteration */
    FOREACH(4),
    /** [condition, block] */
    WHILE(2),

    /** [target, expression]. Value: operator */
    ASSIGN(2),
    /** [left, right]. Value: operator */
    BINARY_OP(2),
    /** [expression]. Value: prefix operator */
    UNARY_OP(1),
    /** [expression]. Value: postfix operator */
    POSTFIX_OP(1),
    /** [expression]. Value: cast type */
    CAST(1),
    /** [condition, then?, else] */
    TERNARY(3),
    /** [expression, class] */
    INSTANCEOF(2),
    /** value: name without the dollar sign */
    VARIABLE(0),
    /** value: literal as written, quotes included */
    STRING(0),
    /** value: literal as written */
    NUMBER(0),
    /** [name] */
    CONST_FETCH(1),
    /** list: array items. Value {@code "array("} for the long syntax */
    ARRAY(0, ListStyle.COMMA),
    /** [key?, value]. Value {@code "..."} for unpacking or {@code "&"} for references */
    ARRAY_ITEM(2),
    /** [expression, dimension?] */
    ARRAY_DIM_FETCH(2),
    /** [name or expression, arguments] */
    FUNC_CALL(2),
    /** [expression, identifier, arguments]. Value {@code "?->"} when null-safe */
    METHOD_CALL(3),
    /** [class, identifier, arguments] */
    STATIC_CALL(3),
    /** [expression, identifier]. Value {@code "?->"} when null-safe */
    PROPERTY_FETCH(2),
    /** [class, variable] */
    STATIC_PROPERTY_FETCH(2),
    /** [class, identifier] */
    CLASS_CONST_FETCH(2),
    /** [class, arguments?] */
    NEW(2),
    /** list: arguments. Value {@code "..."} for a first-class callable */
    ARG_LIST(0, ListStyle.COMMA),
    /** [expression]. Value {@code "..."} for unpacking */
    ARG(1),
    /** [params, uses?, return type?, body]. Value {@code "static"} for static closures */
    CLOSURE(4),
    /** list: variables */
    CLOSURE_USES(0, ListStyle.COMMA),
    /** [params, return type?, expression]. Value {@code "static"} for static arrow functions */
    ARROW_FUNCTION(3),

    /** value: identifier text (method names, property names, builtin types) */
    IDENTIFIER(0),
    /** value: class, function or constant name, a leading backslash marks a fully qualified name */
    NAME(0),
    /** value: modifier keywords separated by single spaces */
    MODIFIERS(0);

    private final int fixedSlots;
    private final ListStyle listStyle;

    NodeKind(int fixedSlots) {
        this(fixedSlots, ListStyle.NONE);
    }

    NodeKind(int fixedSlots, ListStyle listStyle) {
        this.fixedSlots = fixedSlots;
        this.listStyle = listStyle;
    }

    public int fixedSlots() {
        return fixedSlots;
    }

    public boolean hasList() {
        return listStyle != ListStyle.NONE;
    }

    public ListStyle listStyle() {
        return listStyle;
    }

    public boolean isLeaf() {
        return fixedSlots == 0 && !hasList();
    }

    public boolean isFunctionLike() {
        return this == METHOD || this == FUNCTION || this == CLOSURE || this == ARROW_FUNCTION;
    }

    public boolean isClassLike() {
        return this == CLASS || this == INTERFACE;
    }

    public enum ListStyle {
        NONE,
        STATEMENTS,
        COMMA,
        PIPE
    }
}
