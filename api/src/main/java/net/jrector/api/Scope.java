package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * The lexical surroundings of a node: namespace, imports, enclosing class and enclosing function.
 *
 * @param namespace    current namespace without leading backslash, {@code null} in the global namespace
 * @param uses         class imports keyed by lower-cased alias, values are fully qualified names
 * @param className    fully qualified name of the enclosing class
 * @param functionLike the innermost enclosing method, function, closure or arrow function
 */
public record Scope(@Nullable String namespace, Map<String, String> uses, @Nullable String className,
                    @Nullable Node functionLike) {
    public static final Scope GLOBAL = new Scope(null, Map.of(), null, null);

    public boolean isInClass() {
        return className != null;
    }

    public Scope withNamespace(@Nullable String namespace, Map<String, String> uses) {
        return new Scope(namespace, Map.copyOf(uses), null, null);
    }

    public Scope withClass(String className) {
        return new Scope(namespace, uses, className, null);
    }

    public Scope withFunction(Node functionLike) {
        return new Scope(namespace, uses, className, functionLike);
    }

    /**
     * Resolves a class name as PHP does: fully qualified names stay, the first segment is looked up in the
     * imports, anything else is relative to the current namespace. {@code self} and {@code static} resolve
     * to the enclosing class.
     *
     * @return the fully qualified name without leading backslash
     */
    public String resolveClassName(String name) {
        if (name.startsWith("\\")) {
            return name.substring(1);
        }
        var lower = name.toLowerCase(Locale.ROOT);
        if ((lower.equals("self") || lower.equals("static")) && className != null) {
            return className;
        }
        int separator = name.indexOf('\\');
        var first = separator == -1 ? name : name.substring(0, separator);
        var imported = uses.get(first.toLowerCase(Locale.ROOT));
        if (imported != null) {
            return separator == -1 ? imported : imported + name.substring(separator);
        }
        return namespace == null ? name : namespace + "\\" + name;
    }
}
