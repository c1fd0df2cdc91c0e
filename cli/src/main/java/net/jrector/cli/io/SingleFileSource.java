package net.jrector.cli.io;

import net.jrector.api.FileEntry;
import net.jrector.api.FileSource;
import net.jrector.api.PathFileEntry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.Stream;

record SingleFileSource(Path path) implements FileSource {
    @Override
    public Stream<FileEntry> streamEntries() throws IOException {
        var absolutePath = path.toAbsolutePath();
        return Stream.of(PathFileEntry.of(absolutePath.getParent(), absolutePath));
    }

    @Override
    public boolean canHaveMultipleEntries() {
        return false;
    }

    @Override
    public String displayPath(FileEntry entry) {
        return path.toString().replace('\\', '/');
    }
}
