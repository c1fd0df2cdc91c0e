package net.jrector.cli;

import net.jrector.api.FileEntry;
import net.jrector.api.FileSink;
import net.jrector.api.FileSource;
import net.jrector.api.Logger;
import net.jrector.api.ParseException;
import net.jrector.api.ProblemReporter;
import net.jrector.api.SourceEncoding;
import net.jrector.api.SourceParser;
import net.jrector.api.SourcePrinter;
import net.jrector.engine.ChangeSet;
import net.jrector.engine.ClassDiscovery;
import net.jrector.engine.ClassTable;
import net.jrector.engine.FileChange;
import net.jrector.engine.FileRewriter;
import net.jrector.engine.NodeIndex;
import net.jrector.php.PhpParser;
import net.jrector.php.PhpPrinter;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the rewriting of whole source trees. Every PHP file is rewritten on its own, in parallel with the others.
 * Before any file is rewritten, the classes declared in all sources are collected, so rules can look at
 * classes of other files.
 */
class SourceFileProcessor implements AutoCloseable {
    private static final String PHP_EXTENSION = "php";

    private final Logger logger;
    private final ProblemReporter problemReporter;
    private final ExecutorService executor;
    private final SourceParser parser = new PhpParser();
    private final SourcePrinter printer = new PhpPrinter();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private int maxQueueDepth = 50;

    private final List<String> ignoredPrefixes = new ArrayList<>();

    public SourceFileProcessor(Logger logger, ProblemReporter problemReporter, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("At least one thread is needed, got " + threads);
        }
        this.logger = logger;
        this.problemReporter = problemReporter;
        this.executor = Executors.newFixedThreadPool(threads);
    }

    public ClassTable discoverClasses(List<FileSource> sources) throws IOException {
        var builder = ClassTable.builder();
        var pending = new ArrayList<Future<?>>();
        for (var source : sources) {
            try (var stream = source.streamEntries()) {
                stream.filter(this::isRewritable).forEach(entry -> pending.add(executor.submit(() -> {
                    discoverClasses(source, entry, builder);
                    return null;
                })));
            }
        }
        for (var future : pending) {
            await(future);
        }

        var classTable = builder.build();
        logger.debug("Discovered %d classes", classTable.size());
        return classTable;
    }

    private void discoverClasses(FileSource source, FileEntry entry, ClassTable.Builder builder) throws IOException {
        try {
            ClassDiscovery.discover(parser.parse(entry.readText())).forEach(builder::add);
        } catch (ParseException | CharacterCodingException e) {
            // Reported once the file itself is rewritten
            logger.debug("Not discovering classes in %s: %s", source.displayPath(entry), e.getMessage());
        }
    }

    public FileRewriter createRewriter(NodeIndex index, ClassTable classTable, int maxPasses) {
        return new FileRewriter(parser, printer, index, classTable, maxPasses, logger, problemReporter);
    }

    /**
     * Rewrites all PHP files of {@code source} and records their outcome in {@code changes}.
     * Sinks that write in place only receive changed files, all others receive the complete tree.
     */
    public void process(FileSource source, FileSink sink, FileRewriter rewriter, ChangeSet changes) throws IOException {
        if (source.canHaveMultipleEntries() && !sink.canHaveMultipleEntries()) {
            throw new IllegalStateException("Cannot have an input with possibly more than one file when the output is a single file.");
        }

        try (var asyncOut = new OrderedParallelWorkQueue(sink, maxQueueDepth, executor);
             var stream = source.streamEntries()) {
            stream.forEach(entry -> asyncOut.submitAsync(parallelSink -> {
                try {
                    processEntry(source, entry, rewriter, parallelSink, changes);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }));
        }
    }

    private void processEntry(FileSource source, FileEntry entry, FileRewriter rewriter, FileSink sink, ChangeSet changes) throws IOException {
        if (entry.directory()) {
            return;
        }

        var content = entry.readAllBytes();

        if (isRewritable(entry)) {
            var path = source.displayPath(entry);
            if (cancelled.get()) {
                logger.debug("Skipping %s", path);
                changes.add(FileChange.skipped(path));
            } else {
                var change = rewriter.rewrite(path, content);
                changes.add(change);
                if (change.isChanged()) {
                    var finalText = Objects.requireNonNull(change.finalText());
                    sink.putFile(entry.relativePath(), FileTime.from(Instant.now()), SourceEncoding.encode(finalText));
                    return;
                }
            }
        }

        if (!sink.isInPlace()) {
            sink.putFile(entry.relativePath(), entry.lastModified(), content);
        }
    }

    private boolean isRewritable(FileEntry entry) {
        return !entry.directory() && entry.hasExtension(PHP_EXTENSION) && !isIgnored(entry.relativePath());
    }

    private boolean isIgnored(String relativePath) {
        for (String ignoredPrefix : ignoredPrefixes) {
            if (relativePath.startsWith(ignoredPrefix)) {
                return true;
            }
        }
        return false;
    }

    private static void await(Future<?> future) throws IOException {
        try {
            future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException ioe) {
                throw ioe;
            }
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while discovering classes");
        }
    }

    /**
     * Files that have not been started yet are reported as skipped. Files being rewritten run to completion.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void setMaxQueueDepth(int maxQueueDepth) {
        this.maxQueueDepth = maxQueueDepth;
    }

    public void addIgnoredPrefix(String ignoredPrefix) {
        logger.debug("Not rewriting entries starting with %s", ignoredPrefix);
        this.ignoredPrefixes.add(ignoredPrefix);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
