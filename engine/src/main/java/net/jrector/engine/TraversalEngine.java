package net.jrector.engine;

import net.jrector.api.Node;
import net.jrector.api.NodeKeys;
import net.jrector.api.Scope;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one pass of all rules over a tree: depth-first, pre-order, with a fixpoint at every node.
 * <p>
 * At a node, the rules registered for its kind are called in index order. When one of them replaces the node,
 * the rules for the kind of the replacement start over on the replacement. A rule is called at most once per
 * node instance within that fixpoint, so a rule that edits in place and reports the same instance is not called
 * again. Afterwards the children of the resulting node are visited.
 */
public final class TraversalEngine {
    /**
     * How often the node at one position may be rewritten during a single pass.
     */
    public static final int MAX_NODE_REWRITES = 100;

    private final NodeIndex index;

    public TraversalEngine(NodeIndex index) {
        this.index = index;
    }

    public NodeIndex index() {
        return index;
    }

    public TraversalResult applyAll(Node root, FileContext context) {
        context.setRoot(root);
        ScopeAnnotator.annotate(root);

        var pass = new Pass(context);
        var results = pass.rewrite(root, Scope.GLOBAL);
        if (results.size() != 1) {
            throw new IllegalStateException("Rules must not remove or split the root node of " + context.file());
        }
        var newRoot = results.get(0);
        if (newRoot != root) {
            context.setRoot(newRoot);
        }
        pass.visitChildren(newRoot, ScopeAnnotator.enter(newRoot, Scope.GLOBAL));
        return new TraversalResult(newRoot, pass.changed);
    }

    private final class Pass {
        private final FileContext context;
        private boolean changed;

        Pass(FileContext context) {
            this.context = context;
        }

        /**
         * Applies the rules to the node at one position until none of them changes it anymore.
         *
         * @return the nodes now occupying the position, empty if the node was removed
         */
        List<Node> rewrite(Node node, Scope scope) {
            Map<Node, Set<RuleDescriptor>> attempted = new IdentityHashMap<>();
            var current = node;
            int rewrites = 0;
            current.putAttribute(NodeKeys.SCOPE, scope);

            boolean restart;
            do {
                restart = false;
                var attemptedOnCurrent = attempted.computeIfAbsent(current,
                        n -> Collections.newSetFromMap(new IdentityHashMap<RuleDescriptor, Boolean>()));
                for (var descriptor : index.rulesFor(current.kind())) {
                    if (!attemptedOnCurrent.add(descriptor)) {
                        continue;
                    }
                    var result = descriptor.rule().refactor(current, context);
                    switch (result.type()) {
                        case NO_CHANGE -> {
                        }
                        case STOP -> {
                            return List.of(current);
                        }
                        case REMOVE -> {
                            changed = true;
                            logRewrite(descriptor, current, "removed");
                            return List.of();
                        }
                        case REPLACE_MANY -> {
                            changed = true;
                            logRewrite(descriptor, current, "replaced by " + result.nodes());
                            for (var replacement : result.nodes()) {
                                ScopeAnnotator.annotate(replacement, scope);
                            }
                            return result.nodes();
                        }
                        case REPLACE -> {
                            changed = true;
                            if (++rewrites > MAX_NODE_REWRITES) {
                                throw new RewriteCycleException(descriptor.id(), current.kind(), MAX_NODE_REWRITES);
                            }
                            var replacement = result.node();
                            logRewrite(descriptor, current, replacement == current ? "changed" : "replaced by " + replacement);
                            // refresh scopes and resolved names of whatever the rule attached
                            ScopeAnnotator.annotate(replacement, scope);
                            if (replacement != current) {
                                current = replacement;
                                restart = true;
                            }
                        }
                    }
                    if (restart) {
                        break;
                    }
                }
            } while (restart);
            return List.of(current);
        }

        void visitChildren(Node parent, Scope scope) {
            int fixedSlots = parent.kind().fixedSlots();
            int i = 0;
            while (i < parent.childCount()) {
                var child = parent.child(i);
                if (child == null) {
                    i++;
                    continue;
                }
                var results = rewrite(child, scope);
                if (i < fixedSlots) {
                    if (results.size() > 1) {
                        throw new IllegalStateException("Cannot replace " + child + " in slot " + i + " of " + parent
                                + " with several nodes");
                    }
                    var replacement = results.isEmpty() ? null : results.get(0);
                    if (replacement != child) {
                        parent.setSlot(i, replacement);
                    }
                    if (replacement != null) {
                        visitChildren(replacement, ScopeAnnotator.enter(replacement, scope));
                    }
                    i++;
                } else {
                    if (results.size() != 1 || results.get(0) != child) {
                        parent.spliceChild(i, results);
                    }
                    for (var node : results) {
                        visitChildren(node, ScopeAnnotator.enter(node, scope));
                    }
                    i += results.size();
                }
            }
        }

        private void logRewrite(RuleDescriptor descriptor, Node node, String what) {
            var logger = context.logger();
            if (logger.isDebugEnabled()) {
                logger.debug("%s: %s on %s: %s", context.file(), descriptor.id(), node, what);
            }
        }
    }
}
