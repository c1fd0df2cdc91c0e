package net.jrector.rules.php70;

import net.jrector.api.Rule;
import net.jrector.api.RulePlugin;

public class ThisCallOnStaticMethodToStaticCallPlugin implements RulePlugin {
    @Override
    public String getName() {
        return "this-call-on-static-method-to-static-call";
    }

    @Override
    public Rule createRule() {
        return new ThisCallOnStaticMethodToStaticCallRule();
    }
}
