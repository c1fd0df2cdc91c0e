package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * What is known about a declared class or interface.
 *
 * @param name       fully qualified name, without a leading backslash
 * @param parentName fully qualified name of the parent class
 * @param interfaces fully qualified names of the directly implemented (or, for interfaces, extended) interfaces
 * @param methods    declared methods keyed by lower-cased name
 */
public record ClassFacts(String name, @Nullable String parentName, List<String> interfaces, boolean isInterface,
                         boolean isFinal, boolean isAbstract, Map<String, MethodFacts> methods) {
    @Nullable
    public MethodFacts findDeclaredMethod(String methodName) {
        return methods.get(methodName.toLowerCase(Locale.ROOT));
    }

    public String shortName() {
        int separator = name.lastIndexOf('\\');
        return separator == -1 ? name : name.substring(separator + 1);
    }
}
