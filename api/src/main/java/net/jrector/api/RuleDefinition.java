package net.jrector.api;

/**
 * Human readable description of a rule with an example of what it changes.
 */
public record RuleDefinition(String description, String codeBefore, String codeAfter) {
}
