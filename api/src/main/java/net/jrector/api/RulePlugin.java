package net.jrector.api;

/**
 * Accessed via {@link java.util.ServiceLoader}.
 */
public interface RulePlugin {

    /**
     * Unique identifier used in rule-set files to enable this rule.
     */
    String getName();

    /**
     * Creates a new instance of the rule.
     */
    Rule createRule();

}
