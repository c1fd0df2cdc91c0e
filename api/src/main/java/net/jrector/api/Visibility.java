package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

public enum Visibility {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    /**
     * @param modifiers a {@link NodeKind#MODIFIERS} node or {@code null}; members without an explicit visibility are public
     */
    public static Visibility of(@Nullable Node modifiers) {
        for (var visibility : values()) {
            if (Nodes.hasModifier(modifiers, visibility.keyword())) {
                return visibility;
            }
        }
        return PUBLIC;
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
