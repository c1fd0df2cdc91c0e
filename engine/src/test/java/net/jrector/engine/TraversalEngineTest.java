package net.jrector.engine;

import net.jrector.api.Logger;
import net.jrector.api.Node;
import net.jrector.api.NodeFactory;
import net.jrector.api.NodeKind;
import net.jrector.api.RefactorResult;
import net.jrector.api.Scope;
import net.jrector.php.PhpParser;
import net.jrector.php.PhpPrinter;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraversalEngineTest {
    private final PhpParser parser = new PhpParser();
    private final PhpPrinter printer = new PhpPrinter();

    private static FileContext context() {
        return new FileContext(Path.of("test.php"), ClassTable.EMPTY, Logger.NONE);
    }

    private String applyOnce(String source, LambdaRule... rules) throws Exception {
        var root = parser.parse(source);
        var result = new TraversalEngine(LambdaRule.index(rules)).applyAll(root, context());
        return printer.print(result.root(), source);
    }

    @Test
    void testWithoutRulesNothingChanges() throws Exception {
        var source = "<?php\n$a = array_merge($b, [1]);\n";
        var root = parser.parse(source);

        var result = new TraversalEngine(LambdaRule.index()).applyAll(root, context());

        assertThat(result.changed()).isFalse();
        assertThat(result.root()).isSameAs(root);
        assertThat(printer.print(result.root(), source)).isEqualTo(source);
    }

    @Test
    void testInPlaceEdit() throws Exception {
        var rename = LambdaRule.on(NodeKind.VARIABLE, (node, context) -> {
            if (!"a".equals(node.value())) {
                return RefactorResult.noChange();
            }
            node.setValue("b");
            return RefactorResult.replace(node);
        });

        assertThat(applyOnce("<?php\n$a = 1;\necho $a;\n", rename)).isEqualTo("<?php\n$b = 1;\necho $b;\n");
    }

    @Test
    void testRuleIsCalledOncePerNodeInstance() throws Exception {
        var calls = new AtomicInteger();
        var touch = LambdaRule.on(NodeKind.VARIABLE, (node, context) -> {
            calls.incrementAndGet();
            return RefactorResult.replace(node);
        });
        var root = parser.parse("<?php\n$a = $b;\n");

        var result = new TraversalEngine(LambdaRule.index(touch)).applyAll(root, context());

        assertThat(result.changed()).isTrue();
        assertThat(calls).hasValue(2);
    }

    @Test
    void testReplacementIsRewrittenByRulesForItsKind() throws Exception {
        var seen = new ArrayList<Node>();
        var toArray = LambdaRule.on(NodeKind.FUNC_CALL, (node, context) -> RefactorResult.replace(NodeFactory.array(List.of())));
        var recordArrays = LambdaRule.on(NodeKind.ARRAY, (node, context) -> {
            seen.add(node);
            return RefactorResult.noChange();
        });
        var root = parser.parse("<?php\n$x = array_merge();\n");

        var result = new TraversalEngine(LambdaRule.index(toArray, recordArrays)).applyAll(root, context());

        assertThat(result.changed()).isTrue();
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).isSynthetic()).isTrue();
        assertThat(printer.print(result.root(), "<?php\n$x = array_merge();\n")).isEqualTo("<?php\n$x = [];\n");
    }

    @Test
    void testEndlessReplacementIsACycle() throws Exception {
        var recreate = LambdaRule.on(NodeKind.VARIABLE, (node, context) -> RefactorResult.replace(NodeFactory.variable("a")));
        var root = parser.parse("<?php\n$a = 1;\n");

        assertThatThrownBy(() -> new TraversalEngine(LambdaRule.index(recreate)).applyAll(root, context()))
                .isInstanceOf(RewriteCycleException.class)
                .hasMessageContaining("rule-0")
                .hasMessageContaining(String.valueOf(TraversalEngine.MAX_NODE_REWRITES));
    }

    @Test
    void testStopSkipsRemainingRulesButNotChildren() throws Exception {
        var statementCalls = new AtomicInteger();
        var variableCalls = new AtomicInteger();
        var stop = LambdaRule.on(NodeKind.EXPRESSION_STMT, (node, context) -> RefactorResult.stop()).withPriority(10);
        var statements = LambdaRule.on(NodeKind.EXPRESSION_STMT, (node, context) -> {
            statementCalls.incrementAndGet();
            return RefactorResult.noChange();
        });
        var variables = LambdaRule.on(NodeKind.VARIABLE, (node, context) -> {
            variableCalls.incrementAndGet();
            return RefactorResult.noChange();
        });
        var root = parser.parse("<?php\n$a = 1;\n");

        var result = new TraversalEngine(LambdaRule.index(statements, variables, stop)).applyAll(root, context());

        assertThat(result.changed()).isFalse();
        assertThat(statementCalls).hasValue(0);
        assertThat(variableCalls).hasValue(1);
    }

    @Test
    void testRulesRunInPriorityOrder() throws Exception {
        var order = new ArrayList<String>();
        var low = LambdaRule.on(NodeKind.VARIABLE, (node, context) -> {
            order.add("low");
            return RefactorResult.noChange();
        });
        var high = LambdaRule.on(NodeKind.VARIABLE, (node, context) -> {
            order.add("high");
            return RefactorResult.noChange();
        }).withPriority(5);

        applyOnce("<?php\n$a = 1;\n", low, high);

        assertThat(order).containsExactly("high", "low");
    }

    @Test
    void testRemovalFromList() throws Exception {
        var removeEcho = LambdaRule.on(NodeKind.ECHO, (node, context) -> RefactorResult.remove());

        assertThat(applyOnce("<?php\n$a = 1;\necho $a;\n$b = 2;\n", removeEcho)).isEqualTo("<?php\n$a = 1;\n$b = 2;\n");
    }

    @Test
    void testRemovalFromSlotLeavesItEmpty() throws Exception {
        var removeNumbers = LambdaRule.on(NodeKind.NUMBER, (node, context) -> RefactorResult.remove());

        assertThat(applyOnce("<?php\nfunction f()\n{\n    return 1;\n}\n", removeNumbers))
                .isEqualTo("<?php\nfunction f()\n{\n    return;\n}\n");
    }

    @Test
    void testSeveralNodesReplaceOneListItem() throws Exception {
        var calls = new AtomicInteger();
        var duplicate = LambdaRule.on(NodeKind.ECHO, (node, context) -> {
            calls.incrementAndGet();
            return RefactorResult.replaceWith(List.of(node, node.deepCopy()));
        });

        var output = applyOnce("<?php\n$a = 1;\necho $a;\n$b = 2;\n", duplicate);

        assertThat(output).isEqualTo("<?php\n$a = 1;\necho $a;\necho $a;\n$b = 2;\n");
        assertThat(calls).hasValue(1);
    }

    @Test
    void testSeveralNodesCannotReplaceASlot() throws Exception {
        var split = LambdaRule.on(NodeKind.NUMBER, (node, context) -> RefactorResult.replaceWith(List.of(
                Node.leaf(NodeKind.NUMBER, "1"), Node.leaf(NodeKind.NUMBER, "2"))));
        var root = parser.parse("<?php\n$a = 1;\n");

        assertThatThrownBy(() -> new TraversalEngine(LambdaRule.index(split)).applyAll(root, context()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("several nodes");
    }

    @Test
    void testVisitedNodesKnowTheirScope() throws Exception {
        var scopes = new ArrayList<Scope>();
        var record = LambdaRule.on(NodeKind.VARIABLE, (node, context) -> {
            scopes.add(context.resolver().scopeOf(node));
            return RefactorResult.noChange();
        });

        applyOnce("""
                <?php
                namespace App;

                use Psr\\Log\\LoggerInterface;

                class Foo
                {
                    public function run()
                    {
                        $x = 1;
                    }
                }
                """, record);

        assertThat(scopes).hasSize(1);
        var scope = scopes.get(0);
        assertThat(scope.namespace()).isEqualTo("App");
        assertThat(scope.className()).isEqualTo("App\\Foo");
        assertThat(scope.functionLike()).isNotNull();
        assertThat(scope.functionLike().kind()).isEqualTo(NodeKind.METHOD);
        assertThat(scope.resolveClassName("LoggerInterface")).isEqualTo("Psr\\Log\\LoggerInterface");
    }
}
