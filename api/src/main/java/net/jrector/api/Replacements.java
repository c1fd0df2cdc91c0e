package net.jrector.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Text edits against the original source of a file, addressed by the spans of parsed nodes.
 */
public final class Replacements {
    private final List<Replacement> replacements;

    public Replacements(List<Replacement> replacements) {
        this.replacements = replacements;
    }

    public Replacements() {
        this(new ArrayList<>());
    }

    public boolean isEmpty() {
        return replacements.isEmpty();
    }

    public void replace(Node node, String newText) {
        add(new Replacement(requireSpan(node), newText));
    }

    public void replace(SourceSpan span, String newText) {
        add(new Replacement(span, newText));
    }

    public void remove(SourceSpan span) {
        add(new Replacement(span, ""));
    }

    public void insertBefore(Node node, String newText) {
        insertAt(requireSpan(node).start(), newText);
    }

    public void insertAfter(Node node, String newText) {
        insertAt(requireSpan(node).end(), newText);
    }

    public void insertAt(int offset, String newText) {
        add(new Replacement(new SourceSpan(offset, offset), newText));
    }

    public void add(Replacement replacement) {
        replacements.add(replacement);
    }

    public String apply(CharSequence originalContent) {
        return apply(originalContent, new SourceSpan(0, originalContent.length()));
    }

    /**
     * Applies the replacements to a region of the original content and returns the edited region.
     * All replacements must lie within the region.
     */
    public String apply(CharSequence originalContent, SourceSpan region) {
        if (replacements.isEmpty()) {
            return region.slice(originalContent).toString();
        }

        // We will assemble the resulting text by iterating all ranges (replaced or not)
        // For this to work, the replacement ranges need to be in ascending order and non-overlapping
        replacements.sort(Replacement.COMPARATOR);

        var writer = new StringBuilder();
        int position = region.start();
        Replacement previousReplacement = null;
        for (var replacement : replacements) {
            var span = replacement.span();
            if (!region.contains(span)) {
                throw new IllegalStateException("Replacement " + replacement + " lies outside of " + region);
            }
            // validate that replacement ranges are non-overlapping
            if (previousReplacement != null && previousReplacement.span().end() > span.start()) {
                throw new IllegalStateException("Trying to replace overlapping ranges: "
                        + replacement + " and " + previousReplacement);
            }
            writer.append(originalContent, position, span.start());
            writer.append(replacement.newText());
            position = span.end();
            previousReplacement = replacement;
        }
        writer.append(originalContent, position, region.end());
        return writer.toString();
    }

    private static SourceSpan requireSpan(Node node) {
        var span = node.span();
        if (span == null) {
            throw new IllegalArgumentException("Node " + node + " was not parsed from source");
        }
        return span;
    }
}
