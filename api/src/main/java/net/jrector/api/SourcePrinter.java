package net.jrector.api;

/**
 * Turns a tree back into source text.
 * <p>
 * Printing a tree without modifications must reproduce {@code originalSource} exactly. Unmodified subtrees of
 * a modified tree keep their original text.
 */
public interface SourcePrinter {
    String print(Node root, String originalSource);
}
