package net.jrector.php;

import net.jrector.api.Node;
import net.jrector.api.NodeKind;
import net.jrector.api.Nodes;
import net.jrector.api.ParseException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhpParserTest {
    private final PhpParser parser = new PhpParser();

    @Nested
    class FileStructure {
        @Test
        void testStatementsWithoutNamespaceAreGrouped() throws Exception {
            var root = parser.parse("<?php\n$a = 1;\necho $a;\n");

            assertThat(root.kind()).isEqualTo(NodeKind.FILE);
            assertThat(root.itemCount()).isEqualTo(1);
            var body = root.item(0);
            assertThat(body.kind()).isEqualTo(NodeKind.FILE_WITHOUT_NAMESPACE);
            assertThat(body.items()).extracting(Node::kind).containsExactly(NodeKind.EXPRESSION_STMT, NodeKind.ECHO);
        }

        @Test
        void testLeadingDeclareStaysOutsideOfStatementGroup() throws Exception {
            var root = parser.parse("<?php\ndeclare(strict_types=1);\n\n$a = 1;\n");

            assertThat(root.items()).extracting(Node::kind).containsExactly(NodeKind.DECLARE, NodeKind.FILE_WITHOUT_NAMESPACE);
            assertThat(root.item(0).value()).isEqualTo("declare(strict_types=1);");
        }

        @Test
        void testNamespaceForms() throws Exception {
            var semicolon = parser.parse("<?php\nnamespace App\\Model;\n\nclass User\n{\n}\n");
            var namespace = semicolon.item(0);
            assertThat(namespace.kind()).isEqualTo(NodeKind.NAMESPACE);
            assertThat(namespace.value()).isNull();
            assertThat(Nodes.getName(namespace.slot(0))).isEqualTo("App\\Model");
            assertThat(namespace.items()).extracting(Node::kind).containsExactly(NodeKind.CLASS);

            var braced = parser.parse("<?php\nnamespace App {\n    function run()\n    {\n    }\n}\n");
            assertThat(braced.item(0).value()).isEqualTo("braced");
            assertThat(braced.item(0).items()).extracting(Node::kind).containsExactly(NodeKind.FUNCTION);
        }

        @Test
        void testEverySpanCoversItsChildren() throws Exception {
            var source = """
                    <?php

                    final class Greeter extends Base implements GreeterInterface
                    {
                        private ?string $name = null;

                        public function greet(string $name): string
                        {
                            return 'Hello ' . $name;
                        }
                    }
                    """;
            var root = parser.parse(source);

            Nodes.walk(root, node -> {
                assertThat(node.span()).as("span of %s", node).isNotNull();
                for (var child : node.children()) {
                    if (child != null) {
                        assertThat(node.span().contains(child.span())).as("%s inside %s", child, node).isTrue();
                    }
                }
            });
        }
    }

    @Nested
    class Declarations {
        @Test
        void testClassParts() throws Exception {
            var root = parser.parse("""
                    <?php
                    final class Greeter extends Base implements GreeterInterface, \\Countable
                    {
                        const PREFIX = 'Hello';
                        private static ?int $count = 0, $other;

                        abstract protected function count(): int;
                    }
                    """);
            var type = Nodes.findAll(root, NodeKind.CLASS).get(0);

            assertThat(type.requireSlot(0).value()).isEqualTo("final");
            assertThat(type.requireSlot(1).value()).isEqualTo("Greeter");
            assertThat(type.requireSlot(2).value()).isEqualTo("Base");
            assertThat(type.requireSlot(3).items()).extracting(Node::value).containsExactly("GreeterInterface", "\\Countable");
            assertThat(type.items()).extracting(Node::kind).containsExactly(NodeKind.CLASS_CONST, NodeKind.PROPERTY, NodeKind.METHOD);

            var property = type.item(1);
            assertThat(property.requireSlot(0).value()).isEqualTo("private static");
            assertThat(property.requireSlot(1).kind()).isEqualTo(NodeKind.NULLABLE_TYPE);
            assertThat(property.itemCount()).isEqualTo(2);

            var method = type.item(2);
            assertThat(Nodes.hasModifier(method.slot(0), "abstract")).isTrue();
            assertThat(method.slot(4)).isNull();
            assertThat(method.requireSlot(3).value()).isEqualTo("int");
        }

        @Test
        void testPromotedParameters() throws Exception {
            var root = parser.parse("""
                    <?php
                    class Service
                    {
                        public function __construct(private Logger $logger, array &$options = [], string ...$rest)
                        {
                        }
                    }
                    """);
            var params = Nodes.findAll(root, NodeKind.PARAM);

            assertThat(params).hasSize(3);
            assertThat(params.get(0).requireSlot(0).value()).isEqualTo("private");
            assertThat(params.get(0).requireSlot(1).kind()).isEqualTo(NodeKind.NAME);
            assertThat(params.get(1).requireSlot(1).kind()).isEqualTo(NodeKind.IDENTIFIER);
            assertThat(params.get(1).value()).isEqualTo("&");
            assertThat(params.get(1).requireSlot(3).kind()).isEqualTo(NodeKind.ARRAY);
            assertThat(params.get(2).value()).isEqualTo("...");
        }

        @Test
        void testDocCommentIsAttachedToFollowingStatement() throws Exception {
            var source = "<?php\n\n/**\n * @var Foo_Bar $x\n */\n$x = make();\n";
            var root = parser.parse(source);
            var statement = root.item(0).item(0);

            assertThat(statement.docComment()).isNotNull();
            assertThat(statement.docComment().text()).isEqualTo("/**\n * @var Foo_Bar $x\n */");
            assertThat(statement.span().slice(source).toString()).startsWith("/**").endsWith("make();");
        }

        @Test
        void testPlainCommentsAreNotDocComments() throws Exception {
            var root = parser.parse("<?php\n/* Foo_Bar */\n$x = make();\n");

            assertThat(root.item(0).item(0).docComment()).isNull();
        }
    }

    @Nested
    class Expressions {
        @Test
        void testOperatorPrecedence() throws Exception {
            var root = parser.parse("<?php\n$a = 1 + 2 * 3;\n");
            var assign = Nodes.findAll(root, NodeKind.ASSIGN).get(0);
            var sum = assign.requireSlot(1);

            assertThat(sum.kind()).isEqualTo(NodeKind.BINARY_OP);
            assertThat(sum.value()).isEqualTo("+");
            assertThat(sum.requireSlot(1).value()).isEqualTo("*");
        }

        @Test
        void testParenthesesDoNotProduceNodes() throws Exception {
            var root = parser.parse("<?php\n$a = (1 + 2) * 3;\n");
            var product = Nodes.findAll(root, NodeKind.ASSIGN).get(0).requireSlot(1);

            assertThat(product.value()).isEqualTo("*");
            assertThat(product.requireSlot(0).value()).isEqualTo("+");
        }

        @Test
        void testCallsAndMemberAccess() throws Exception {
            var root = parser.parse("<?php\n$this->logger?->info(self::PREFIX, static::count(), strlen(...));\n");

            var call = Nodes.findAll(root, NodeKind.METHOD_CALL).get(0);
            assertThat(call.value()).isEqualTo("?->");
            assertThat(call.requireSlot(0).kind()).isEqualTo(NodeKind.PROPERTY_FETCH);
            assertThat(Nodes.isThis(call.requireSlot(0).requireSlot(0))).isTrue();

            assertThat(Nodes.findAll(root, NodeKind.CLASS_CONST_FETCH)).hasSize(1);
            assertThat(Nodes.findAll(root, NodeKind.STATIC_CALL)).hasSize(1);
            var strlen = Nodes.findAll(root, NodeKind.FUNC_CALL).get(0);
            assertThat(Nodes.isFirstClassCallable(strlen)).isTrue();
        }

        @Test
        void testArrays() throws Exception {
            var root = parser.parse("<?php\n$a = array('k' => 1, ...$rest, &$ref);\n$b = [];\n");
            var arrays = Nodes.findAll(root, NodeKind.ARRAY);

            assertThat(arrays.get(0).value()).isEqualTo("array(");
            var items = arrays.get(0).items();
            assertThat(items.get(0).requireSlot(0).value()).isEqualTo("'k'");
            assertThat(items.get(1).value()).isEqualTo("...");
            assertThat(items.get(2).value()).isEqualTo("&");
            assertThat(arrays.get(1).itemCount()).isZero();
        }

        @Test
        void testClosures() throws Exception {
            var root = parser.parse("<?php\n$f = static fn(int $x): int => $x ** 2;\n$g = function () use (&$name) {\n    return $name;\n};\n");

            var arrow = Nodes.findAll(root, NodeKind.ARROW_FUNCTION).get(0);
            assertThat(arrow.value()).isEqualTo("static");
            assertThat(arrow.requireSlot(2).value()).isEqualTo("**");

            var closure = Nodes.findAll(root, NodeKind.CLOSURE).get(0);
            assertThat(closure.requireSlot(1).itemCount()).isEqualTo(1);
        }

        @Test
        void testElseIfChain() throws Exception {
            var root = parser.parse("<?php\nif ($a) {\n} elseif ($b) {\n} else {\n}\n");
            var outer = root.item(0).item(0);

            assertThat(outer.kind()).isEqualTo(NodeKind.IF);
            var elseIf = outer.requireSlot(2);
            assertThat(elseIf.value()).isEqualTo("elseif");
            var inner = elseIf.requireSlot(0);
            assertThat(inner.kind()).isEqualTo(NodeKind.IF);
            assertThat(inner.requireSlot(2).requireSlot(0).kind()).isEqualTo(NodeKind.BLOCK);
        }
    }

    @Nested
    class Errors {
        @Test
        void testReportsLineAndColumn() {
            assertThatThrownBy(() -> parser.parse("<?php\n$a = ;"))
                    .isInstanceOfSatisfying(ParseException.class, e -> {
                        assertThat(e.line).isEqualTo(2);
                        assertThat(e.column).isEqualTo(6);
                    })
                    .hasMessageStartingWith("2:6: ");
        }

        @Test
        void testMissingOpenTag() {
            assertThatThrownBy(() -> parser.parse("echo 1;"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("<?php");
        }

        @Test
        void testUnsupportedSyntax() {
            assertThatThrownBy(() -> parser.parse("<?php\ntry {\n} catch (E $e) {\n}\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Unsupported syntax");
        }

        @Test
        void testUnterminatedString() {
            assertThatThrownBy(() -> parser.parse("<?php\n$a = 'abc;\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Unterminated string");
        }

        @Test
        void testMissingClosingBrace() {
            assertThatThrownBy(() -> parser.parse("<?php\nfunction run()\n{\n    $a = 1;\n"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Missing '}'");
        }
    }
}
