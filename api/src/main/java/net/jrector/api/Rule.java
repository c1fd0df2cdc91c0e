package net.jrector.api;

import java.util.Set;

/**
 * A transformation rule. Rules are created through {@link RulePlugin plugins}.
 * <p>
 * A rule must not keep mutable state between calls that could leak from one file into another. State that
 * is needed while a single file is processed belongs in {@link RuleContext#state}.
 */
public interface Rule {
    /**
     * The node kinds this rule wants to see. Must not be empty.
     */
    Set<NodeKind> getNodeKinds();

    /**
     * Inspects and possibly rewrites a node of one of the {@link #getNodeKinds() declared kinds}.
     * <p>
     * Rules may edit the node in place and return {@link RefactorResult#replace(Node) replace(node)} with the same
     * instance; edits that are not reported do not count as a change.
     */
    RefactorResult refactor(Node node, RuleContext context);

    /**
     * Rules with higher priority see a node first. Rules of equal priority run in registration order.
     */
    default int getPriority() {
        return 0;
    }

    RuleDefinition getDefinition();
}
