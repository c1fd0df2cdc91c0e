package net.jrector.api;

import java.util.Set;

/**
 * Thrown when the declarations of a single file would have to move into different namespaces.
 * Aborts processing of that file; the file is left untouched.
 */
public class NamespaceConflictException extends IllegalStateException {
    private final Set<String> namespaces;

    public NamespaceConflictException(String first, String second) {
        super("There cannot be 2 different namespaces in one file: " + first + " and " + second);
        this.namespaces = Set.of(first, second);
    }

    public Set<String> namespaces() {
        return namespaces;
    }
}
