package net.jrector.rules.typedeclaration;

import net.jrector.api.Rule;
import net.jrector.api.RulePlugin;

public class ParamTypeToPreferredInterfacePlugin implements RulePlugin {
    @Override
    public String getName() {
        return "param-type-to-preferred-interface";
    }

    @Override
    public Rule createRule() {
        return new ParamTypeToPreferredInterfaceRule();
    }
}
