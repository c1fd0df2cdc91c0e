package net.jrector.engine;

import net.jrector.api.Logger;
import net.jrector.api.NamespaceConflictException;
import net.jrector.api.ParseException;
import net.jrector.api.ProblemLocation;
import net.jrector.api.ProblemReporter;
import net.jrector.api.ProblemSeverity;
import net.jrector.api.Problems;
import net.jrector.api.SourceEncoding;
import net.jrector.api.SourceParser;
import net.jrector.api.SourcePrinter;

import java.nio.charset.CharacterCodingException;
import java.nio.file.Path;

/**
 * Rewrites the text of a single file: parse, run the rules to a fixed point, print.
 * <p>
 * Failures are confined to the file they occur in. A file that cannot be parsed, that ends up with conflicting
 * namespaces or whose rules throw is reported as {@link FileStatus#ERRORED} and keeps its original text.
 */
public final class FileRewriter {
    private final SourceParser parser;
    private final SourcePrinter printer;
    private final TraversalEngine engine;
    private final ClassTable classTable;
    private final int maxPasses;
    private final Logger logger;
    private final ProblemReporter problemReporter;

    public FileRewriter(SourceParser parser, SourcePrinter printer, NodeIndex index, ClassTable classTable,
                        int maxPasses, Logger logger, ProblemReporter problemReporter) {
        this.parser = parser;
        this.printer = printer;
        this.engine = new TraversalEngine(index);
        this.classTable = classTable;
        this.maxPasses = maxPasses;
        this.logger = logger;
        this.problemReporter = problemReporter;
    }

    /**
     * Rewrites the raw bytes of a file. Content that is not valid UTF-8 is not touched and the file is reported as
     * {@link FileStatus#ERRORED}.
     */
    public FileChange rewrite(String path, byte[] content) {
        String text;
        try {
            text = SourceEncoding.decode(content);
        } catch (CharacterCodingException e) {
            logger.error("Not rewriting %s: not valid UTF-8", path);
            problemReporter.report(Problems.ENCODING_ERROR, ProblemSeverity.ERROR, ProblemLocation.ofFile(Path.of(path)),
                    "Source is not valid UTF-8");
            return FileChange.errored(path, null, "not valid UTF-8");
        }
        return rewrite(path, text);
    }

    /**
     * @param path relative path of the file, used for reporting
     */
    public FileChange rewrite(String path, String content) {
        var file = Path.of(path);
        var context = new FileContext(file, classTable, logger);
        try {
            var root = parser.parse(content);
            var result = new ConvergenceDriver(engine, maxPasses).run(root, context);
            var output = result.changed() ? printer.print(result.root(), content) : content;
            if (result.exhausted()) {
                reportNotConverged(path, result, content, output);
            }
            if (output.equals(content)) {
                return FileChange.unchanged(path, content, context.warnings());
            }
            logger.debug("Rewrote %s in %d passes", path, result.passes());
            return FileChange.changed(path, content, output, context.warnings());
        } catch (ParseException e) {
            logger.error("Failed to parse %s: %s", path, e.getMessage());
            problemReporter.report(Problems.PARSE_ERROR, ProblemSeverity.ERROR,
                    ProblemLocation.ofLocationInFile(file, e.line, e.column), e.getMessage());
            return FileChange.errored(path, content, "parse error at " + e.getMessage());
        } catch (NamespaceConflictException e) {
            logger.error("%s: %s", path, e.getMessage());
            problemReporter.report(Problems.NAMESPACE_CONFLICT, ProblemSeverity.ERROR, ProblemLocation.ofFile(file), e.getMessage());
            return FileChange.errored(path, content, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Failed to rewrite %s: %s", path, e);
            problemReporter.report(Problems.RULE_FAILURE, ProblemSeverity.ERROR, ProblemLocation.ofFile(file), String.valueOf(e));
            return FileChange.errored(path, content, String.valueOf(e));
        }
    }

    private void reportNotConverged(String path, ConvergenceResult result, String content, String output) {
        var message = result.cycleDetected() ? "Rewrite cycle detected after " + result.passes() + " passes"
                : "Not converged after " + result.passes() + " passes";
        var diff = UnifiedDiffs.diff(path, content, output);
        if (!diff.isEmpty()) {
            message += ", keeping the last rewrite:\n" + diff;
        }
        problemReporter.report(Problems.NOT_CONVERGED, ProblemSeverity.WARNING, ProblemLocation.ofFile(Path.of(path)), message);
    }
}
