package net.jrector.api;

/**
 * Collects problems found while processing files.
 */
public interface ProblemReporter {
    ProblemReporter NOOP = new ProblemReporter() {
        @Override
        public void report(ProblemId problemId, ProblemSeverity severity, ProblemLocation location, String message) {
        }

        @Override
        public void report(ProblemId problemId, ProblemSeverity severity, String message) {
        }
    };

    /**
     * Implementations must be safe to call from several worker threads.
     */
    void report(ProblemId problemId, ProblemSeverity severity, ProblemLocation location, String message);

    /**
     * Reports a location independent problem.
     */
    void report(ProblemId problemId, ProblemSeverity severity, String message);

}
