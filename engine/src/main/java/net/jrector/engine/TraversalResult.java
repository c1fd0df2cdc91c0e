package net.jrector.engine;

import net.jrector.api.Node;

/**
 * @param root    the root after the pass, a different instance if a rule replaced it
 * @param changed whether any rule reported a change
 */
public record TraversalResult(Node root, boolean changed) {
}
