package net.jrector.engine;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Unified diffs of rewritten files, as printed in dry-run mode.
 */
public final class UnifiedDiffs {
    public static final int CONTEXT_LINES = 3;

    private UnifiedDiffs() {
    }

    /**
     * @return the diff with {@code a/} and {@code b/} prefixed file names, empty if the texts are equal
     */
    public static String diff(String path, String originalText, String finalText) {
        var oldLines = toLines(originalText);
        var newLines = toLines(finalText);

        Patch<String> patch = DiffUtils.diff(oldLines, newLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        var diffLines = UnifiedDiffUtils.generateUnifiedDiff("a/" + path, "b/" + path, oldLines, patch, CONTEXT_LINES);
        return String.join("\n", diffLines) + "\n";
    }

    // a trailing empty string stands for the final line break
    private static List<String> toLines(String content) {
        return Arrays.asList(content.split("\\R", -1));
    }
}
