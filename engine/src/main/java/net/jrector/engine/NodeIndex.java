package net.jrector.engine;

import net.jrector.api.NodeKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps every node kind to the rules that declared interest in it, highest priority first and in
 * registration order among equal priorities. Immutable once built.
 */
public final class NodeIndex {
    private static final Comparator<RuleDescriptor> ORDER = Comparator
            .comparingInt(RuleDescriptor::priority).reversed()
            .thenComparingInt(RuleDescriptor::order);

    private final Map<NodeKind, List<RuleDescriptor>> rules;

    private NodeIndex(Map<NodeKind, List<RuleDescriptor>> rules) {
        this.rules = rules;
    }

    public static NodeIndex build(Collection<RuleDescriptor> descriptors) {
        var byKind = new EnumMap<NodeKind, List<RuleDescriptor>>(NodeKind.class);
        for (var descriptor : descriptors) {
            for (var kind : descriptor.nodeKinds()) {
                byKind.computeIfAbsent(kind, k -> new ArrayList<>()).add(descriptor);
            }
        }
        for (var entry : byKind.entrySet()) {
            var sorted = new ArrayList<>(entry.getValue());
            sorted.sort(ORDER);
            entry.setValue(Collections.unmodifiableList(sorted));
        }
        return new NodeIndex(byKind);
    }

    public List<RuleDescriptor> rulesFor(NodeKind kind) {
        return rules.getOrDefault(kind, List.of());
    }

    public Set<NodeKind> kinds() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
