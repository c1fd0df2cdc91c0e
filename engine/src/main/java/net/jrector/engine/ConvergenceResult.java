package net.jrector.engine;

import net.jrector.api.Node;

/**
 * @param passes        number of traversal passes that ran
 * @param exhausted     whether the driver stopped before reaching a fixed point
 * @param cycleDetected whether it stopped because the tree returned to an earlier state
 */
public record ConvergenceResult(Node root, boolean changed, int passes, boolean exhausted, boolean cycleDetected) {
}
