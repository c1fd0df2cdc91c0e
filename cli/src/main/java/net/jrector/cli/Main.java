package net.jrector.cli;

import net.jrector.api.ConfigurationException;
import net.jrector.api.FileSink;
import net.jrector.api.FileSource;
import net.jrector.api.Logger;
import net.jrector.api.ProblemReporter;
import net.jrector.cli.io.FileSinks;
import net.jrector.cli.io.FileSources;
import net.jrector.engine.ChangeSet;
import net.jrector.engine.NodeIndex;
import net.jrector.engine.RuleRegistry;
import net.jrector.engine.RuleSetConfig;
import org.jetbrains.annotations.VisibleForTesting;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "jrector", mixinStandardHelpOptions = true, usageHelpWidth = 100,
        description = "Rewrites PHP sources with a configurable set of rules.")
public class Main implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CHANGES_FOUND = 3;

    @CommandLine.Parameters(paramLabel = "PATH", arity = "0..*", description = "PHP files or folders containing PHP files to rewrite.")
    List<Path> inputPaths = new ArrayList<>();

    @CommandLine.Option(names = "--config", paramLabel = "FILE", description = "The rule-set file, a JSON file listing the rules to apply and their configuration.")
    Path configPath;

    @CommandLine.Option(names = "--dry-run", description = "Print a unified diff of every change instead of writing files. Exits with 3 if anything would change.")
    boolean dryRun;

    @CommandLine.Option(names = "--output", paramLabel = "PATH", description = "Write the complete rewritten tree to this path instead of changing the input in place. Requires a single input PATH.")
    Path outputPath;

    @CommandLine.Option(names = "--in-format", description = "Specify the format of PATH explicitly. AUTO (the default) performs auto-detection. Other options are FILE for single PHP files and FOLDER for folders.")
    PathType inputFormat = PathType.AUTO;

    @CommandLine.Option(names = "--out-format", description = "Specify the format of --output explicitly. Allows the same options as --in-format.")
    PathType outputFormat = PathType.AUTO;

    @CommandLine.Option(names = "--ignore-prefix", description = "Do not rewrite files whose path relative to PATH starts with any of these prefixes.")
    List<String> ignoredPrefixes = new ArrayList<>();

    @CommandLine.Option(names = "--max-passes", description = "How often the rules are applied to a file at most before giving up on convergence. Overrides the rule-set.")
    Integer maxPasses;

    @CommandLine.Option(names = "--threads", description = "Number of files that are rewritten in parallel. Defaults to the number of processors.")
    int threads = Runtime.getRuntime().availableProcessors();

    @CommandLine.Option(names = "--max-queue-depth", description = "Files are written in a stable order while being rewritten in parallel. Larger queue depths lead to higher memory usage.")
    int maxQueueDepth = 100;

    @CommandLine.Option(names = "--problems-report", paramLabel = "FILE", description = "Write the problems found while rewriting to this JSON file.")
    Path problemsReport;

    @CommandLine.Option(names = "--list-rules", description = "List the available rules and exit.")
    boolean listRules;

    @CommandLine.Option(names = "--debug", description = "Print additional debugging information")
    boolean debug = false;

    public static void main(String[] args) {
        System.exit(innerMain(args));
    }

    @VisibleForTesting
    public static int innerMain(String... args) {
        var commandLine = new CommandLine(new Main());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine.execute(args);
    }

    @Override
    public Integer call() throws Exception {
        var logger = debug ? new Logger(System.out, System.err) : new Logger(null, System.err);
        var registry = RuleRegistry.load();

        if (listRules) {
            printRules(registry, System.out);
            return EXIT_OK;
        }
        if (inputPaths.isEmpty()) {
            logger.error("No PATH to rewrite was given");
            return EXIT_ERROR;
        }
        if (outputPath != null && inputPaths.size() != 1) {
            logger.error("--output requires exactly one input PATH, got %d", inputPaths.size());
            return EXIT_ERROR;
        }

        NodeIndex index;
        int passes;
        try {
            var config = configPath != null ? RuleSetConfig.read(configPath) : RuleSetConfig.EMPTY;
            if (maxPasses != null) {
                config = config.withMaxPasses(maxPasses);
            }
            var rules = registry.instantiate(config);
            index = NodeIndex.build(rules);
            passes = config.maxPassesOrDefault();
            logger.debug("Enabled rules: %s", rules);
        } catch (ConfigurationException | IOException e) {
            logger.error("Invalid configuration: %s", e.getMessage());
            return EXIT_ERROR;
        }
        if (index.isEmpty()) {
            logger.warn("No rules are enabled, nothing will be changed");
        }

        var changes = new ChangeSet();
        try (var fileReporter = problemsReport != null ? new FileProblemReporter(logger, problemsReport) : null) {
            ProblemReporter reporter = fileReporter != null ? fileReporter : ProblemReporter.NOOP;
            rewrite(logger, reporter, index, passes, changes);
        } catch (IOException | IllegalStateException | IllegalArgumentException e) {
            logger.error("Rewriting failed: %s", e.getMessage());
            return EXIT_ERROR;
        }

        if (dryRun) {
            for (var change : changes.changes()) {
                if (change.isChanged()) {
                    System.out.print(change.diff());
                }
            }
        }
        System.out.println(changes.summary());

        if (changes.hasErrors()) {
            return EXIT_ERROR;
        }
        if (dryRun && changes.hasChanges()) {
            return EXIT_CHANGES_FOUND;
        }
        return EXIT_OK;
    }

    private void rewrite(Logger logger, ProblemReporter reporter, NodeIndex index, int passes, ChangeSet changes) throws IOException {
        var sources = new ArrayList<FileSource>(inputPaths.size());
        try (var processor = new SourceFileProcessor(logger, reporter, threads)) {
            for (var inputPath : inputPaths) {
                sources.add(FileSources.create(inputPath, inputFormat));
            }
            for (var ignoredPrefix : ignoredPrefixes) {
                processor.addIgnoredPrefix(ignoredPrefix);
            }
            processor.setMaxQueueDepth(maxQueueDepth);

            var rewriter = processor.createRewriter(index, processor.discoverClasses(sources), passes);
            for (var source : sources) {
                try (var sink = createSink(source)) {
                    processor.process(source, sink, rewriter, changes);
                }
            }
        } finally {
            for (var source : sources) {
                source.close();
            }
        }
    }

    private FileSink createSink(FileSource source) {
        if (dryRun) {
            return FileSinks.discard();
        } else if (outputPath != null) {
            return FileSinks.create(outputPath, outputFormat, source);
        } else {
            return FileSinks.inPlace(source);
        }
    }

    private static void printRules(RuleRegistry registry, PrintStream out) {
        for (var plugin : registry.plugins()) {
            var definition = plugin.createRule().getDefinition();
            out.println(plugin.getName());
            out.println("    " + definition.description());
            printExample("before", definition.codeBefore(), out);
            printExample("after", definition.codeAfter(), out);
            out.println();
        }
    }

    private static void printExample(String label, String code, PrintStream out) {
        out.println("    " + label + ":");
        for (var line : code.strip().split("\n")) {
            out.println(line.isEmpty() ? "" : "        " + line);
        }
    }
}
