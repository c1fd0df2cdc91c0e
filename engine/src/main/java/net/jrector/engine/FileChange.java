package net.jrector.engine;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The outcome of processing one file.
 *
 * @param path         path relative to the source root
 * @param originalText {@code null} when the file could not be read
 * @param finalText    the rewritten text, equal to the original unless the status is {@link FileStatus#CHANGED}
 * @param error        what went wrong for {@link FileStatus#ERRORED} files
 */
public record FileChange(String path, @Nullable String originalText, @Nullable String finalText, FileStatus status,
                         List<String> warnings, @Nullable String error) {
    public FileChange {
        warnings = List.copyOf(warnings);
    }

    public static FileChange changed(String path, String originalText, String finalText, List<String> warnings) {
        return new FileChange(path, originalText, finalText, FileStatus.CHANGED, warnings, null);
    }

    public static FileChange unchanged(String path, String text, List<String> warnings) {
        return new FileChange(path, text, text, FileStatus.UNCHANGED, warnings, null);
    }

    public static FileChange errored(String path, @Nullable String originalText, String error) {
        return new FileChange(path, originalText, originalText, FileStatus.ERRORED, List.of(), error);
    }

    public static FileChange skipped(String path) {
        return new FileChange(path, null, null, FileStatus.SKIPPED, List.of(), null);
    }

    public boolean isChanged() {
        return status == FileStatus.CHANGED;
    }

    /**
     * @return a unified diff of the change, empty for anything but changed files
     */
    public String diff() {
        if (!isChanged()) {
            return "";
        }
        return UnifiedDiffs.diff(path, originalText, finalText);
    }
}
