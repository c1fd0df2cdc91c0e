package net.jrector.rules.renaming;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One configured pseudo-namespace: classes starting with {@code namespacePrefix} move into the namespace spelled
 * by their underscores, except for the {@code excludedClasses}.
 */
public record PseudoNamespaceMapping(String namespacePrefix, @Nullable List<String> excludedClasses) {
    public List<String> excludedOrEmpty() {
        return excludedClasses == null ? List.of() : excludedClasses;
    }
}
