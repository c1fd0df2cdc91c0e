package net.jrector.php;

import net.jrector.api.Node;
import net.jrector.api.SourcePrinter;

/**
 * Prints trees produced by {@link PhpParser}, keeping the original text of everything that was not modified.
 */
public final class PhpPrinter implements SourcePrinter {
    @Override
    public String print(Node root, String originalSource) {
        return new Reprinter(originalSource).print(root);
    }
}
