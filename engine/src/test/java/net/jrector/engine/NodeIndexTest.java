package net.jrector.engine;

import net.jrector.api.ConfigurationException;
import net.jrector.api.NodeKind;
import net.jrector.api.RefactorResult;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeIndexTest {
    private static LambdaRule rule(NodeKind first, NodeKind... rest) {
        return new LambdaRule(EnumSet.of(first, rest), 0, (node, context) -> RefactorResult.noChange());
    }

    @Test
    void testEveryDeclaredKindListsTheRule() {
        var arrays = rule(NodeKind.ARRAY, NodeKind.FUNC_CALL);
        var calls = rule(NodeKind.FUNC_CALL);
        var descriptors = List.of(
                RuleDescriptor.of("arrays", arrays, 0),
                RuleDescriptor.of("calls", calls, 1)
        );

        var index = NodeIndex.build(descriptors);

        for (var descriptor : descriptors) {
            for (var kind : descriptor.nodeKinds()) {
                assertThat(index.rulesFor(kind)).contains(descriptor);
            }
        }
        assertThat(index.rulesFor(NodeKind.ARRAY)).extracting(RuleDescriptor::id).containsExactly("arrays");
        assertThat(index.kinds()).containsExactlyInAnyOrder(NodeKind.ARRAY, NodeKind.FUNC_CALL);
    }

    @Test
    void testUnregisteredKindHasNoRules() {
        var index = NodeIndex.build(List.of(RuleDescriptor.of("arrays", rule(NodeKind.ARRAY), 0)));

        assertThat(index.rulesFor(NodeKind.CLASS)).isEmpty();
        assertThat(NodeIndex.build(List.of()).isEmpty()).isTrue();
    }

    @Test
    void testHigherPriorityComesFirstThenRegistrationOrder() {
        var low = new RuleDescriptor("low", rule(NodeKind.VARIABLE), Set.of(NodeKind.VARIABLE), -1, 0, null);
        var firstDefault = new RuleDescriptor("first", rule(NodeKind.VARIABLE), Set.of(NodeKind.VARIABLE), 0, 1, null);
        var high = new RuleDescriptor("high", rule(NodeKind.VARIABLE), Set.of(NodeKind.VARIABLE), 10, 2, null);
        var secondDefault = new RuleDescriptor("second", rule(NodeKind.VARIABLE), Set.of(NodeKind.VARIABLE), 0, 3, null);

        var index = NodeIndex.build(List.of(low, firstDefault, high, secondDefault));
        var reversed = NodeIndex.build(List.of(secondDefault, high, firstDefault, low));

        assertThat(index.rulesFor(NodeKind.VARIABLE)).extracting(RuleDescriptor::id)
                .containsExactly("high", "first", "second", "low");
        assertThat(reversed.rulesFor(NodeKind.VARIABLE)).isEqualTo(index.rulesFor(NodeKind.VARIABLE));
    }

    @Test
    void testRuleWithoutKindsIsRejected() {
        var rule = new LambdaRule(Set.of(), 0, (node, context) -> RefactorResult.noChange());

        assertThatThrownBy(() -> RuleDescriptor.of("empty", rule, 0))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("empty");
    }
}
