package net.jrector.rules.renaming;

import net.jrector.api.Rule;
import net.jrector.api.RulePlugin;

/**
 * Plugin that turns {@code Vendor_Package_Class} style class names into real namespaces.
 */
public class PseudoNamespaceToNamespacePlugin implements RulePlugin {
    @Override
    public String getName() {
        return "pseudo-namespace-to-namespace";
    }

    @Override
    public Rule createRule() {
        return new PseudoNamespaceToNamespaceRule();
    }
}
