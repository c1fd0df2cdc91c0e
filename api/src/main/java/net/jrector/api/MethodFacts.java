package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * What is known about a declared method.
 *
 * @param className      fully qualified name of the declaring class
 * @param parameterTypes declared parameter types, {@code null} entries for untyped parameters
 */
public record MethodFacts(String className, String name, boolean isStatic, boolean isAbstract, Visibility visibility,
                          List<@Nullable ResolvedType> parameterTypes, @Nullable ResolvedType returnType) {
    public boolean isPrivate() {
        return visibility == Visibility.PRIVATE;
    }
}
