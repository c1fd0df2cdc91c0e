package net.jrector.api;

/**
 * Turns source text into a tree whose nodes remember their original state.
 */
public interface SourceParser {
    /**
     * @return a {@link NodeKind#FILE} node
     */
    Node parse(String source) throws ParseException;
}
