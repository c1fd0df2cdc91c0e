package net.jrector.api;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodesTest {
    @Test
    void testNameMatching() {
        var name = NodeFactory.name("\\Foo\\Bar");

        assertThat(Nodes.isName(name, "foo\\bar")).isTrue();
        assertThat(Nodes.isName(name, "Foo\\*")).isTrue();
        assertThat(Nodes.isName(name, "Foo")).isFalse();
        assertThat(Nodes.isName(NodeFactory.variable("This"), "this")).isFalse();
        assertThat(Nodes.isName(NodeFactory.string("'Foo'"), "Foo")).isFalse();
        assertThat(Nodes.isNames(name, List.of("Baz", "Foo\\Bar"))).isTrue();
    }

    @Test
    void testModifiers() {
        var modifiers = Node.leaf(NodeKind.MODIFIERS, "final public");

        assertThat(Nodes.hasModifier(modifiers, "FINAL")).isTrue();
        assertThat(Nodes.hasModifier(modifiers, "static")).isFalse();
        assertThat(Nodes.hasModifier(null, "final")).isFalse();
    }

    @Test
    void testFingerprintIgnoresIdentity() {
        assertThat(Nodes.fingerprint(call("foo"))).isEqualTo(Nodes.fingerprint(call("foo")));
        assertThat(Nodes.fingerprint(call("foo"))).isNotEqualTo(Nodes.fingerprint(call("bar")));
    }

    @Test
    void testFindAllInScopeStopsAtFunctions() {
        var inner = call("inner");
        var closure = Node.of(NodeKind.CLOSURE, new Node(NodeKind.PARAM_LIST, null, List.of()), null, null,
                new Node(NodeKind.BLOCK, null, List.of(Node.of(NodeKind.EXPRESSION_STMT, inner))));
        var outer = call("outer");
        var block = new Node(NodeKind.BLOCK, null, List.of(
                Node.of(NodeKind.EXPRESSION_STMT, outer),
                Node.of(NodeKind.EXPRESSION_STMT, closure)
        ));

        assertThat(Nodes.findAllInScope(block, NodeKind.FUNC_CALL)).containsExactly(outer);
        assertThat(Nodes.findAll(block, NodeKind.FUNC_CALL)).containsExactly(outer, inner);
    }

    @Test
    void testTraverseReplacesNodes() {
        var statement = Node.of(NodeKind.EXPRESSION_STMT, call("foo"));

        var changed = Nodes.traverse(statement, node -> Nodes.isName(node, "foo") ? NodeFactory.name("bar") : null);

        assertThat(changed).isTrue();
        assertThat(statement.requireSlot(0).requireSlot(0).value()).isEqualTo("bar");
    }

    @Test
    void testSharedNodesAreDetected() {
        var shared = NodeFactory.variable("a");
        var tree = Node.of(NodeKind.ASSIGN, shared, NodeFactory.variable("b"));
        tree.setValue("=");
        Nodes.verifyOwnership(tree);

        tree.setSlot(1, shared);
        assertThatThrownBy(() -> Nodes.verifyOwnership(tree))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("deepCopy");
    }

    @Test
    void testFirstClassCallable() {
        var callable = Node.of(NodeKind.FUNC_CALL, NodeFactory.name("strlen"), new Node(NodeKind.ARG_LIST, "...", List.of()));

        assertThat(Nodes.isFirstClassCallable(callable)).isTrue();
        assertThat(Nodes.isFirstClassCallable(call("strlen"))).isFalse();
    }

    private static Node call(String function) {
        return Node.of(NodeKind.FUNC_CALL, NodeFactory.name(function), NodeFactory.args(List.of()));
    }
}
