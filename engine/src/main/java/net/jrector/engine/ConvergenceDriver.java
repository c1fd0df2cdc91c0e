package net.jrector.engine;

import net.jrector.api.Node;
import net.jrector.api.Nodes;

import java.util.HashSet;

/**
 * Repeats traversal passes until the rules stop changing the tree.
 * <p>
 * Stops early when the tree returns to a state it was in before, which would otherwise repeat until the pass
 * limit. Either way the last tree is kept and the file gets a warning.
 */
public final class ConvergenceDriver {
    public static final int DEFAULT_MAX_PASSES = 10;

    private final TraversalEngine engine;
    private final int maxPasses;

    public ConvergenceDriver(TraversalEngine engine) {
        this(engine, DEFAULT_MAX_PASSES);
    }

    public ConvergenceDriver(TraversalEngine engine, int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("At least one pass is required, got " + maxPasses);
        }
        this.engine = engine;
        this.maxPasses = maxPasses;
    }

    public int maxPasses() {
        return maxPasses;
    }

    public ConvergenceResult run(Node root, FileContext context) {
        var seen = new HashSet<String>();
        seen.add(Nodes.fingerprint(root));

        var current = root;
        boolean changed = false;
        int passes = 0;
        while (passes < maxPasses) {
            var result = engine.applyAll(current, context);
            passes++;
            current = result.root();
            Nodes.verifyOwnership(current);
            if (!result.changed()) {
                return new ConvergenceResult(current, changed, passes, false, false);
            }
            changed = true;
            if (!seen.add(Nodes.fingerprint(current))) {
                warn(context, "Rules keep rewriting " + context.file() + " back to an earlier state, stopped after " + passes + " passes");
                return new ConvergenceResult(current, true, passes, true, true);
            }
        }
        warn(context, "Rules did not converge on " + context.file() + " within " + maxPasses + " passes");
        return new ConvergenceResult(current, true, passes, true, false);
    }

    private static void warn(FileContext context, String message) {
        context.logger().warn("%s", message);
        context.addWarning(message);
    }
}
