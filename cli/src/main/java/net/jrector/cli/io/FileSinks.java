package net.jrector.cli.io;

import net.jrector.api.FileSink;
import net.jrector.api.FileSource;
import net.jrector.cli.PathType;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

public final class FileSinks {
    private static final FileSink DISCARD = new FileSink() {
        @Override
        public boolean canHaveMultipleEntries() {
            return true;
        }

        @Override
        public boolean isInPlace() {
            return true;
        }

        @Override
        public void putFile(String relativePath, FileTime lastModified, byte[] content) {
        }
    };

    private FileSinks() {
    }

    /**
     * A sink writing the complete tree of {@code source} to {@code path}.
     */
    public static FileSink create(Path path, PathType format, FileSource source) {
        if (format == PathType.AUTO) {
            if (source instanceof SingleFileSource) {
                format = PathType.FILE;
            } else if (source instanceof FolderFileSource) {
                format = PathType.FOLDER;
            } else {
                throw new IllegalArgumentException("Cannot auto-detect output format based on source: " + source.getClass());
            }
        }

        return switch (format) {
            case AUTO -> throw new IllegalArgumentException("Do not support AUTO for output when input also was AUTO!");
            case FILE -> new SingleFileSink(path, false);
            case FOLDER -> new FolderFileSink(path, false);
        };
    }

    /**
     * A sink overwriting the files of {@code source} itself.
     */
    public static FileSink inPlace(FileSource source) {
        if (source instanceof SingleFileSource singleFile) {
            return new SingleFileSink(singleFile.path(), true);
        } else if (source instanceof FolderFileSource folder) {
            return new FolderFileSink(folder.path(), true);
        }
        throw new IllegalArgumentException("Cannot write back to source: " + source.getClass());
    }

    /**
     * A sink that writes nothing, used for dry runs.
     */
    public static FileSink discard() {
        return DISCARD;
    }
}
