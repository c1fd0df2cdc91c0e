package net.jrector.api;

import java.io.IOException;
import java.nio.file.attribute.FileTime;

public interface FileSink extends AutoCloseable {
    @Override
    default void close() throws IOException {
    }

    boolean canHaveMultipleEntries();

    /**
     * Whether this sink writes back over the files it was read from. Unchanged files are not rewritten then.
     */
    boolean isInPlace();

    void putFile(String relativePath, FileTime lastModified, byte[] content) throws IOException;
}
