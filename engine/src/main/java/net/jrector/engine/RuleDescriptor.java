package net.jrector.engine;

import com.google.gson.JsonElement;
import net.jrector.api.ConfigurationException;
import net.jrector.api.NodeKind;
import net.jrector.api.Rule;
import org.jetbrains.annotations.Nullable;

import java.util.EnumSet;
import java.util.Set;

/**
 * A configured rule as it takes part in a run.
 *
 * @param order         position in the rule-set, breaks ties between equal priorities
 * @param configuration the payload the rule was configured with, if any
 */
public record RuleDescriptor(String id, Rule rule, Set<NodeKind> nodeKinds, int priority, int order,
                             @Nullable JsonElement configuration) {
    public RuleDescriptor {
        if (nodeKinds.isEmpty()) {
            throw new ConfigurationException("Rule " + id + " does not declare any node kinds");
        }
        nodeKinds = Set.copyOf(EnumSet.copyOf(nodeKinds));
    }

    public static RuleDescriptor of(String id, Rule rule, int order) {
        return new RuleDescriptor(id, rule, rule.getNodeKinds(), rule.getPriority(), order, null);
    }

    @Override
    public String toString() {
        return id;
    }
}
