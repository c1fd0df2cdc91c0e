package net.jrector.api.doc;

import net.jrector.api.DocComment;
import net.jrector.api.Node;
import net.jrector.api.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocTypeRenamerTest {
    private final DocTypeRenamer renamer = new DocTypeRenamer();

    @Test
    void testUnderscoreTypeInVarTag() {
        var node = nodeWithDoc("/** @var Foo_Bar $x */");

        assertThat(renamer.changeUnderscoreType(node, "Foo_", List.of())).isTrue();
        assertThat(node.docComment().text()).isEqualTo("/** @var \\Foo\\Bar $x */");
    }

    @Test
    void testUnionAndGenericTypes() {
        var node = nodeWithDoc("""
                /**
                 * @param Foo_Bar|null $x Foo_Bar stays in the description
                 * @return array<int, Foo_Baz>
                 * @throws Foo_Exception
                 * @see Foo_Bar
                 */""");

        renamer.changeUnderscoreType(node, "Foo_", List.of());

        assertThat(node.docComment().text()).isEqualTo("""
                /**
                 * @param \\Foo\\Bar|null $x Foo_Bar stays in the description
                 * @return array<int, \\Foo\\Baz>
                 * @throws \\Foo\\Exception
                 * @see Foo_Bar
                 */""");
    }

    @Test
    void testExcludedAndForeignClassesStay() {
        var node = nodeWithDoc("/** @var Foo_Excluded|Other_Bar $x */");

        assertThat(renamer.changeUnderscoreType(node, "Foo_", List.of("Foo_Excluded"))).isFalse();
        assertThat(node.docComment().text()).isEqualTo("/** @var Foo_Excluded|Other_Bar $x */");
    }

    @Test
    void testToolSpecificTags() {
        var text = renamer.renameTypes("/** @psalm-var Foo $a @phpstan-return Foo */", type -> "Bar");

        assertThat(text).isEqualTo("/** @psalm-var Bar $a @phpstan-return Bar */");
    }

    @Test
    void testKeywordsAndShapeKeysAreNotClasses() {
        var text = renamer.renameTypes("/** @param array{key: Foo}|non-empty-string|int $a */", type -> "X");

        assertThat(text).isEqualTo("/** @param array{key: X}|non-empty-string|int $a */");
    }

    @Test
    void testNodeWithoutDocComment() {
        var node = Node.leaf(NodeKind.VARIABLE, "x");

        assertThat(renamer.renameTypes(node, type -> "X")).isFalse();
        assertThat(node.docComment()).isNull();
    }

    private static Node nodeWithDoc(String text) {
        var node = Node.leaf(NodeKind.VARIABLE, "x");
        node.setDocComment(DocComment.of(text));
        return node;
    }
}
