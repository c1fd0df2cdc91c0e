package net.jrector.api;

import org.jetbrains.annotations.Nullable;

/**
 * Type and symbol facts for nodes of the file currently being processed.
 * <p>
 * Facts are snapshots of the current tree. After a rule replaced or restructured a node, facts for it
 * have to be resolved again.
 */
public interface ScopeResolver {
    /**
     * @return the inferred type of an expression, or {@code null} if nothing is known
     */
    @Nullable
    ResolvedType resolveType(Node node);

    /**
     * @return the class enclosing the node, or {@code null} outside of classes or for unknown classes
     */
    @Nullable
    ClassFacts inClassScope(Node node);

    /**
     * @return the method a method or static call targets, or {@code null} if it cannot be determined
     */
    @Nullable
    MethodFacts resolveCalledMethod(Node call);

    @Nullable
    ClassFacts resolveClass(String className);

    /**
     * Resolves a {@link NodeKind#NAME} in the scope it occurs in.
     *
     * @return the fully qualified name without leading backslash
     */
    String resolveName(Node name);

    /**
     * Whether the class extends or implements {@code className}, directly or through its ancestors.
     */
    boolean isSubclassOf(ClassFacts classFacts, String className);

    /**
     * Looks up a method in the class and its ancestors.
     */
    @Nullable
    MethodFacts findMethod(ClassFacts classFacts, String methodName);

    Scope scopeOf(Node node);
}
