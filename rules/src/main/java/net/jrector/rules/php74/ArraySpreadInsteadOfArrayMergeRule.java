package net.jrector.rules.php74;

import net.jrector.api.Node;
import net.jrector.api.NodeFactory;
import net.jrector.api.NodeKind;
import net.jrector.api.Nodes;
import net.jrector.api.RefactorResult;
import net.jrector.api.Rule;
import net.jrector.api.RuleContext;
import net.jrector.api.RuleDefinition;
import net.jrector.api.ScopeResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Changes {@code array_merge()} of arrays into an array literal with spreads.
 * <p>
 * Every argument has to be known to be a non-nullable array. The items of literal lists are inlined. Calls with
 * string-keyed literals are left alone, since unpacking them is an error before PHP 8.1.
 */
public class ArraySpreadInsteadOfArrayMergeRule implements Rule {
    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.FUNC_CALL);
    }

    @Override
    public RefactorResult refactor(Node node, RuleContext context) {
        if (!Nodes.isName(node.slot(0), "array_merge") || Nodes.isFirstClassCallable(node)) {
            return RefactorResult.noChange();
        }
        var args = node.requireSlot(1).items();
        if (args.isEmpty()) {
            return RefactorResult.noChange();
        }
        for (var arg : args) {
            if (!canSpread(arg, context.resolver())) {
                return RefactorResult.noChange();
            }
        }

        var items = new ArrayList<Node>();
        for (var arg : args) {
            var value = arg.requireSlot(0);
            if (isList(value)) {
                items.addAll(value.items());
            } else {
                items.add(NodeFactory.spreadItem(value));
            }
        }
        return RefactorResult.replace(NodeFactory.array(items));
    }

    private static boolean canSpread(Node arg, ScopeResolver resolver) {
        // array_merge(...$arrays)
        if (arg.value() != null) {
            return false;
        }
        var value = arg.requireSlot(0);
        if (value.is(NodeKind.ARRAY) && hasStringKeys(value)) {
            return false;
        }
        var type = resolver.resolveType(value);
        return type != null && type.isArray();
    }

    private static boolean hasStringKeys(Node array) {
        for (var item : array.items()) {
            var key = item.slot(0);
            if (key != null && !key.is(NodeKind.NUMBER)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A literal without keys and references, whose items can be moved as they are.
     */
    private static boolean isList(Node value) {
        if (!value.is(NodeKind.ARRAY)) {
            return false;
        }
        List<Node> items = value.items();
        for (var item : items) {
            if (item.slot(0) != null || "&".equals(item.value())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public RuleDefinition getDefinition() {
        return new RuleDefinition("Change array_merge() of arrays to the spread operator",
                """
                        function run(array $items)
                        {
                            return array_merge($items, ['bar']);
                        }
                        """,
                """
                        function run(array $items)
                        {
                            return [...$items, 'bar'];
                        }
                        """);
    }
}
