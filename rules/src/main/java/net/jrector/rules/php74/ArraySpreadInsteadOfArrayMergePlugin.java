package net.jrector.rules.php74;

import net.jrector.api.Rule;
import net.jrector.api.RulePlugin;

public class ArraySpreadInsteadOfArrayMergePlugin implements RulePlugin {
    @Override
    public String getName() {
        return "array-spread-instead-of-array-merge";
    }

    @Override
    public Rule createRule() {
        return new ArraySpreadInsteadOfArrayMergeRule();
    }
}
