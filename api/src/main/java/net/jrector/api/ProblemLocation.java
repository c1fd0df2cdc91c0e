package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

public record ProblemLocation(Path file, @Nullable Integer line, @Nullable Integer column,
                              @Nullable Integer offset, @Nullable Integer length) {
    public static ProblemLocation ofFile(Path file) {
        return new ProblemLocation(file, null, null, null, null);
    }

    /**
     * @param line   1-based line number.
     * @param column 1-based column number.
     */
    public static ProblemLocation ofLocationInFile(Path file, int line, int column) {
        return new ProblemLocation(file, line, column, null, null);
    }

    /**
     * Points at a node of the original source. Synthetic nodes only locate the file.
     */
    public static ProblemLocation ofNode(Path file, Node node) {
        var span = node.span();
        if (span == null) {
            return ofFile(file);
        }
        return new ProblemLocation(file, null, null, span.start(), span.length());
    }
}
