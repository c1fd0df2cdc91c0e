package net.jrector.cli.io;

import net.jrector.api.FileSink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

record FolderFileSink(Path path, boolean isInPlace) implements FileSink {
    @Override
    public void putFile(String relativePath, FileTime lastModified, byte[] content) throws IOException {
        var targetPath = path.resolve(relativePath);
        if (targetPath.getParent() != null) {
            Files.createDirectories(targetPath.getParent());
        }
        Files.write(targetPath, content);
        Files.setLastModifiedTime(targetPath, lastModified);
    }

    @Override
    public boolean canHaveMultipleEntries() {
        return true;
    }
}
