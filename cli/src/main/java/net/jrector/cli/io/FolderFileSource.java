package net.jrector.cli.io;

import net.jrector.api.FileEntry;
import net.jrector.api.FileSource;
import net.jrector.api.PathFileEntry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

record FolderFileSource(Path path) implements FileSource {
    @Override
    public Stream<FileEntry> streamEntries() throws IOException {
        return Files.walk(path)
                .filter(p -> !p.equals(path))
                .map(this::toEntry)
                .sorted(Comparator.comparing(FileEntry::relativePath));
    }

    private FileEntry toEntry(Path child) {
        try {
            return PathFileEntry.of(path, child);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public boolean canHaveMultipleEntries() {
        return true;
    }

    @Override
    public String displayPath(FileEntry entry) {
        return path.resolve(entry.relativePath()).toString().replace('\\', '/');
    }
}
