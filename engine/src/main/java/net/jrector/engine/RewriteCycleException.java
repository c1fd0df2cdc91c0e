package net.jrector.engine;

import net.jrector.api.NodeKind;

/**
 * Thrown when the rules keep replacing the node at one position with fresh nodes.
 */
public class RewriteCycleException extends IllegalStateException {
    public RewriteCycleException(String ruleId, NodeKind kind, int rewrites) {
        super("Rule " + ruleId + " keeps rewriting a " + kind + " node, gave up after " + rewrites + " rewrites");
    }
}
