package net.jrector.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.attribute.FileTime;
import java.util.Locale;

/**
 * A file or directory of a {@link FileSource}.
 */
public interface FileEntry {
    boolean directory();

    /**
     * Path relative to the root of the source, with forward slashes and without a leading slash.
     */
    String relativePath();

    FileTime lastModified();

    InputStream openInputStream() throws IOException;

    default byte[] readAllBytes() throws IOException {
        try (var in = openInputStream()) {
            return in.readAllBytes();
        }
    }

    /**
     * PHP sources are always read as UTF-8.
     *
     * @throws java.nio.charset.CharacterCodingException if the content is not valid UTF-8
     */
    default String readText() throws IOException {
        return SourceEncoding.decode(readAllBytes());
    }

    default boolean hasExtension(String extension) {
        return relativePath().toLowerCase(Locale.ROOT).endsWith("." + extension.toLowerCase(Locale.ROOT));
    }
}
