package net.jrector.rules.php74;

import net.jrector.rules.RuleTester;
import org.junit.jupiter.api.Test;

class ArraySpreadInsteadOfArrayMergeRuleTest {
    private final RuleTester tester = RuleTester.forRules("array-spread-instead-of-array-merge");

    @Test
    void testMergeWithLiteral() {
        tester.assertRewrite("""
                <?php

                function withBar(array $array)
                {
                    return array_merge($array, ['bar']);
                }
                """, """
                <?php

                function withBar(array $array)
                {
                    return [...$array, 'bar'];
                }
                """);
    }

    @Test
    void testVariablesAssignedArrays() {
        tester.assertRewrite("""
                <?php

                $first = ['a'];
                $second = array_merge($first, ['b'], ['c', 'd']);
                """, """
                <?php

                $first = ['a'];
                $second = [...$first, 'b', 'c', 'd'];
                """);
    }

    @Test
    void testLiteralWithIntegerKeysIsSpread() {
        tester.assertRewrite("""
                <?php

                function prepend(array $items)
                {
                    return array_merge([1 => 'a'], $items);
                }
                """, """
                <?php

                function prepend(array $items)
                {
                    return [...[1 => 'a'], ...$items];
                }
                """);
    }

    @Test
    void testSkipUnknownTypes() {
        tester.assertUnchanged("""
                <?php

                function withBar($array, ?array $maybe)
                {
                    return array_merge($array, ['bar']) + array_merge($maybe, ['bar']);
                }
                """);
    }

    @Test
    void testSkipVariablesOverwrittenByForeach() {
        tester.assertUnchanged("""
                <?php

                function lastRow(array $rows)
                {
                    $row = [];
                    foreach ($rows as $row) {
                    }
                    return array_merge($row, ['bar']);
                }
                """);
    }

    @Test
    void testSkipStringKeys() {
        tester.assertUnchanged("""
                <?php

                function withBar(array $array)
                {
                    return array_merge($array, ['key' => 'bar']);
                }
                """);
    }

    @Test
    void testSkipUnpackedArguments() {
        tester.assertUnchanged("""
                <?php

                function flatten(array $lists)
                {
                    return array_merge(...$lists);
                }
                """);
    }

    @Test
    void testSkipOtherFunctions() {
        tester.assertUnchanged("""
                <?php

                function withBar(array $array)
                {
                    return array_replace($array, ['bar']);
                }
                """);
    }
}
