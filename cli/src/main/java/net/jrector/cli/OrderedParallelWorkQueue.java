package net.jrector.cli;

import net.jrector.api.FileSink;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.attribute.FileTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Runs work items on an executor, while the files they produce reach the sink in submission order.
 */
class OrderedParallelWorkQueue implements AutoCloseable {
    private final Deque<Future<List<WorkResult>>> pending;
    private final FileSink sink;
    private final int maxQueueDepth;
    private final Executor executor;

    public OrderedParallelWorkQueue(FileSink sink, int maxQueueDepth, Executor executor) {
        this.sink = sink;
        this.maxQueueDepth = maxQueueDepth;
        this.executor = executor;
        if (maxQueueDepth < 0) {
            throw new IllegalArgumentException("Max queue depth must not be negative");
        }
        this.pending = new ArrayDeque<>(maxQueueDepth);
    }

    public void submit(Consumer<FileSink> producer) {
        if (pending.isEmpty()) {
            // Can write directly if nothing else is pending
            producer.accept(sink);
        } else {
            // Needs to be queued behind currently queued async work
            submitAsync(producer);
        }
    }

    public void submitAsync(Consumer<FileSink> producer) {
        try {
            if (maxQueueDepth <= 0) {
                // Forced into synchronous mode
                submit(producer);
                return;
            }
            drainTo(maxQueueDepth - 1);
            pending.add(CompletableFuture.supplyAsync(() -> {
                var parallelSink = new ParallelSink(sink);
                producer.accept(parallelSink);
                return parallelSink.workResults;
            }, executor));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class ParallelSink implements FileSink {
        private final List<WorkResult> workResults = new ArrayList<>();
        private final FileSink target;

        private ParallelSink(FileSink target) {
            this.target = target;
        }

        @Override
        public boolean canHaveMultipleEntries() {
            return target.canHaveMultipleEntries();
        }

        @Override
        public boolean isInPlace() {
            return target.isInPlace();
        }

        @Override
        public void putFile(String relativePath, FileTime lastModified, byte[] content) {
            workResults.add(new WorkResult(relativePath, lastModified, content));
        }
    }

    private void drainTo(int drainTo) throws InterruptedException, IOException {
        while (pending.size() > drainTo) {
            List<WorkResult> workResults;
            try {
                workResults = pending.removeFirst().get();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof UncheckedIOException uioe) {
                    throw uioe.getCause();
                }
                if (e.getCause() instanceof RuntimeException re) {
                    throw re;
                }
                throw new RuntimeException(e.getCause());
            }
            for (var workResult : workResults) {
                sink.putFile(workResult.relativePath, workResult.lastModified, workResult.content);
            }
        }
    }

    /**
     * Waits for all pending work. The sink itself is left open.
     */
    @Override
    public void close() throws IOException {
        try {
            drainTo(0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record WorkResult(String relativePath, FileTime lastModified, byte[] content) {
    }
}
