package net.jrector.php;

enum TokenType {
    INLINE_HTML,
    OPEN_TAG,
    WHITESPACE,
    COMMENT,
    DOC_COMMENT,
    VARIABLE,
    /**
     * Identifiers, keywords and (qualified) names.
     */
    NAME,
    NUMBER,
    STRING,
    OPERATOR,
    EOF;

    boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT || this == DOC_COMMENT;
    }
}
