package net.jrector.php;

import java.util.Locale;

record Token(TokenType type, String text, int start, int end) {
    boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    boolean isOperator(String operator) {
        return is(TokenType.OPERATOR, operator);
    }

    /**
     * Keywords compare case-insensitively.
     */
    boolean isKeyword(String keyword) {
        return type == TokenType.NAME && text.toLowerCase(Locale.ROOT).equals(keyword);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of file" : "'" + text + "'";
    }
}
