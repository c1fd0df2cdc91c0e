package net.jrector.php;

import net.jrector.api.ParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits PHP source into tokens, whitespace and comments included, so that the token texts concatenate to the
 * complete input.
 */
final class PhpLexer {
    // Longest first
    private static final String[] OPERATORS = {
            "<=>", "**=", "...", "<<=", ">>=", "===", "!==", "??=", "?->",
            "++", "--", "->", "=>", "::", "==", "!=", "<>", "<=", ">=", "&&", "||", "??", "+=", "-=", "*=", "/=",
            ".=", "%=", "&=", "|=", "^=", "<<", ">>", "**",
            "+", "-", "*", "/", "%", "=", "<", ">", "!", ".", "&", "|", "^", "~", "?", ":", ";", ",", "(", ")",
            "[", "]", "{", "}", "@"
    };

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int position;

    private PhpLexer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) throws ParseException {
        var lexer = new PhpLexer(source);
        lexer.run();
        return lexer.tokens;
    }

    private void run() throws ParseException {
        int openTag = source.indexOf("<?php");
        if (openTag == -1) {
            throw error("Missing <?php open tag", 0);
        }
        if (openTag > 0) {
            add(TokenType.INLINE_HTML, 0, openTag);
        }
        position = openTag + 5;
        add(TokenType.OPEN_TAG, openTag, openTag + 5);

        while (position < source.length()) {
            int start = position;
            char c = source.charAt(position);
            if (Character.isWhitespace(c)) {
                while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
                    position++;
                }
                add(TokenType.WHITESPACE, start, position);
            } else if (source.startsWith("?>", position)) {
                throw error("Closing tags are not supported", position);
            } else if (source.startsWith("/**", position) && !source.startsWith("/**/", position)) {
                add(TokenType.DOC_COMMENT, start, blockCommentEnd(start));
            } else if (source.startsWith("/*", position)) {
                add(TokenType.COMMENT, start, blockCommentEnd(start));
            } else if (source.startsWith("//", position) || (c == '#' && !source.startsWith("#[", position))) {
                while (position < source.length() && source.charAt(position) != '\n') {
                    position++;
                }
                add(TokenType.COMMENT, start, position);
            } else if (c == '$' && position + 1 < source.length() && isIdentifierStart(source.charAt(position + 1))) {
                position++;
                skipIdentifier();
                add(TokenType.VARIABLE, start, position);
            } else if (isIdentifierStart(c) || (c == '\\' && position + 1 < source.length() && isIdentifierStart(source.charAt(position + 1)))) {
                readName();
                add(TokenType.NAME, start, position);
            } else if (Character.isDigit(c) || (c == '.' && position + 1 < source.length() && Character.isDigit(source.charAt(position + 1)))) {
                readNumber();
                add(TokenType.NUMBER, start, position);
            } else if (c == '\'' || c == '"' || c == '`') {
                readQuoted(c);
                add(TokenType.STRING, start, position);
            } else if (source.startsWith("<<<", position)) {
                readHeredoc();
                add(TokenType.STRING, start, position);
            } else {
                readOperator();
            }
        }
        tokens.add(new Token(TokenType.EOF, "", source.length(), source.length()));
    }

    private int blockCommentEnd(int start) throws ParseException {
        int end = source.indexOf("*/", start + 2);
        if (end == -1) {
            throw error("Unterminated comment", start);
        }
        position = end + 2;
        return position;
    }

    private void readName() {
        if (source.charAt(position) == '\\') {
            position++;
        }
        skipIdentifier();
        while (position + 1 < source.length() && source.charAt(position) == '\\' && isIdentifierStart(source.charAt(position + 1))) {
            position++;
            skipIdentifier();
        }
    }

    private void skipIdentifier() {
        while (position < source.length() && isIdentifierPart(source.charAt(position))) {
            position++;
        }
    }

    private void readNumber() {
        if (source.startsWith("0x", position) || source.startsWith("0X", position)
                || source.startsWith("0b", position) || source.startsWith("0B", position)) {
            position += 2;
            while (position < source.length() && (Character.isLetterOrDigit(source.charAt(position)) || source.charAt(position) == '_')) {
                position++;
            }
            return;
        }
        while (position < source.length()) {
            char c = source.charAt(position);
            if (Character.isDigit(c) || c == '_') {
                position++;
            } else if (c == '.' && position + 1 < source.length() && Character.isDigit(source.charAt(position + 1))) {
                position++;
            } else if ((c == 'e' || c == 'E') && position + 1 < source.length()
                    && (Character.isDigit(source.charAt(position + 1)) || source.charAt(position + 1) == '-' || source.charAt(position + 1) == '+')) {
                position += 2;
            } else {
                break;
            }
        }
    }

    private void readQuoted(char quote) throws ParseException {
        int start = position;
        position++;
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == '\\') {
                position += 2;
            } else if (c == quote) {
                position++;
                return;
            } else {
                position++;
            }
        }
        throw error("Unterminated string", start);
    }

    private void readHeredoc() throws ParseException {
        int start = position;
        position += 3;
        while (position < source.length() && (source.charAt(position) == ' ' || source.charAt(position) == '\t')) {
            position++;
        }
        boolean quoted = position < source.length() && (source.charAt(position) == '\'' || source.charAt(position) == '"');
        if (quoted) {
            position++;
        }
        int labelStart = position;
        skipIdentifier();
        var label = source.substring(labelStart, position);
        if (label.isEmpty()) {
            throw error("Invalid heredoc label", start);
        }
        if (quoted) {
            position++;
        }
        int lineEnd = source.indexOf('\n', position);
        if (lineEnd == -1) {
            throw error("Unterminated heredoc", start);
        }
        position = lineEnd + 1;
        while (position < source.length()) {
            int contentStart = position;
            while (contentStart < source.length() && (source.charAt(contentStart) == ' ' || source.charAt(contentStart) == '\t')) {
                contentStart++;
            }
            if (source.startsWith(label, contentStart)
                    && (contentStart + label.length() >= source.length() || !isIdentifierPart(source.charAt(contentStart + label.length())))) {
                position = contentStart + label.length();
                return;
            }
            int next = source.indexOf('\n', position);
            if (next == -1) {
                break;
            }
            position = next + 1;
        }
        throw error("Unterminated heredoc", start);
    }

    private void readOperator() throws ParseException {
        for (var operator : OPERATORS) {
            if (source.startsWith(operator, position)) {
                add(TokenType.OPERATOR, position, position + operator.length());
                position += operator.length();
                return;
            }
        }
        throw error("Unexpected character '" + source.charAt(position) + "'", position);
    }

    private void add(TokenType type, int start, int end) {
        tokens.add(new Token(type, source.substring(start, end), start, end));
    }

    private ParseException error(String message, int offset) {
        return PhpParser.errorAt(source, message, offset);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c >= 0x80;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c >= 0x80;
    }
}
