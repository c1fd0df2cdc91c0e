package net.jrector.cli.io;

import net.jrector.api.FileSink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

record SingleFileSink(Path path, boolean isInPlace) implements FileSink {
    @Override
    public void putFile(String relativePath, FileTime lastModified, byte[] content) throws IOException {
        Path targetPath;
        if (Files.isDirectory(path)) {
            targetPath = path.resolve(relativePath);
        } else {
            targetPath = path;
        }
        Files.write(targetPath, content);
        Files.setLastModifiedTime(targetPath, lastModified);
    }

    @Override
    public boolean canHaveMultipleEntries() {
        return false;
    }
}
