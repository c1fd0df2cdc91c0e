package net.jrector.api;

/**
 * Typed key into the attribute bag of a {@link Node}.
 */
public record NodeKey<T>(String name) {
    public static <T> NodeKey<T> create(String name) {
        return new NodeKey<>(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
