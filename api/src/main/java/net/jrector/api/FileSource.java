package net.jrector.api;

import java.io.IOException;
import java.util.stream.Stream;

public interface FileSource extends AutoCloseable {
    /**
     * Entries are streamed in a stable order, sorted by relative path.
     */
    Stream<FileEntry> streamEntries() throws IOException;

    boolean canHaveMultipleEntries();

    /**
     * How the entry is named in reports and diffs.
     */
    default String displayPath(FileEntry entry) {
        return entry.relativePath();
    }

    @Override
    default void close() throws IOException {
    }
}
