package net.jrector.php;

import net.jrector.api.Node;
import net.jrector.api.NodeKey;
import net.jrector.api.ParseException;
import net.jrector.api.SourceParser;

/**
 * Parses the supported PHP subset into a tree of {@link Node nodes}.
 * <p>
 * Every parsed node carries its span, doc comments are attached to the statement or class member that follows
 * them and are part of its span. Parentheses around expressions do not produce nodes.
 */
public final class PhpParser implements SourceParser {
    /**
     * Offset at which the list part of a parsed node starts, used to insert into lists that were empty.
     */
    static final NodeKey<Integer> LIST_START = NodeKey.create("php.list_start");

    @Override
    public Node parse(String source) throws ParseException {
        var tokens = PhpLexer.tokenize(source);
        var root = new SyntaxReader(source, tokens).readFile();
        root.freezeOriginal();
        return root;
    }

    static ParseException errorAt(String source, String message, int offset) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new ParseException(message, line, offset - lineStart + 1);
    }
}
