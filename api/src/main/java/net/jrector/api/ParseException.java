package net.jrector.api;

import java.io.IOException;

/**
 * Thrown when a source file cannot be parsed.
 */
public class ParseException extends IOException {
    public final int line;
    public final int column;

    public ParseException(String message, int line, int column) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }
}
