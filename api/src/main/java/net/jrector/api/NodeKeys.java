package net.jrector.api;

/**
 * Attribute keys shared between the engine, the resolver and rules.
 */
public final class NodeKeys {
    /**
     * The lexical scope the node was last visited in. Set by the traversal engine.
     */
    public static final NodeKey<Scope> SCOPE = NodeKey.create("jrector.scope");

    /**
     * Fully qualified class name a {@link NodeKind#NAME} resolves to in its scope.
     */
    public static final NodeKey<String> RESOLVED_NAME = NodeKey.create("jrector.resolved_name");

    private NodeKeys() {
    }
}
