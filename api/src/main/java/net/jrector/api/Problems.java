package net.jrector.api;

/**
 * The problems reported by the engine itself.
 */
public final class Problems {
    public static final ProblemGroup GROUP = ProblemGroup.create("jrector", "jrector");

    public static final ProblemId PARSE_ERROR = ProblemId.create("parse-error", "Source could not be parsed", GROUP);
    public static final ProblemId ENCODING_ERROR = ProblemId.create("encoding-error", "Source is not valid UTF-8", GROUP);
    public static final ProblemId NAMESPACE_CONFLICT = ProblemId.create("namespace-conflict", "Conflicting namespaces in one file", GROUP);
    public static final ProblemId RULE_FAILURE = ProblemId.create("rule-failure", "Rule failed", GROUP);
    public static final ProblemId NOT_CONVERGED = ProblemId.create("not-converged", "Rules did not converge", GROUP);

    private Problems() {
    }
}
