package net.jrector.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * A file entry backed by a file system path below {@code root}.
 */
public record PathFileEntry(Path path, String relativePath, boolean directory, FileTime lastModified) implements FileEntry {
    public static PathFileEntry of(Path root, Path path) throws IOException {
        if (path.equals(root)) {
            throw new IllegalArgumentException("The source root " + root + " cannot be an entry of itself");
        }
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException(path + " is not below the source root " + root);
        }
        var relativePath = root.relativize(path).toString().replace('\\', '/');
        return new PathFileEntry(path, relativePath, Files.isDirectory(path), Files.getLastModifiedTime(path));
    }

    @Override
    public InputStream openInputStream() throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public String toString() {
        return relativePath;
    }
}
