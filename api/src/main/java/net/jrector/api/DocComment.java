package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A {@code /** ... *}{@code /} comment attached to a declaration or statement.
 * <p>
 * Comments read from source carry their span; comments created by rules do not.
 */
public record DocComment(String text, @Nullable SourceSpan span) {
    public DocComment {
        Objects.requireNonNull(text, "text");
    }

    public static DocComment of(String text) {
        return new DocComment(text, null);
    }

    public DocComment withText(String newText) {
        return newText.equals(text) ? this : new DocComment(newText, null);
    }
}
