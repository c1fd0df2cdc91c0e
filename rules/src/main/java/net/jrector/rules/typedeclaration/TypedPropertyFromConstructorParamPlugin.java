package net.jrector.rules.typedeclaration;

import net.jrector.api.Rule;
import net.jrector.api.RulePlugin;

public class TypedPropertyFromConstructorParamPlugin implements RulePlugin {
    @Override
    public String getName() {
        return "typed-property-from-constructor-param";
    }

    @Override
    public Rule createRule() {
        return new TypedPropertyFromConstructorParamRule();
    }
}
