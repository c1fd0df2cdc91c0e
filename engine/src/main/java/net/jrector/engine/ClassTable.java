package net.jrector.engine;

import net.jrector.api.ClassFacts;
import net.jrector.api.Nodes;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The classes and interfaces declared in the processed sources. Built once before files are processed and
 * read-only afterwards.
 */
public final class ClassTable {
    public static final ClassTable EMPTY = new ClassTable(Map.of());

    private final Map<String, ClassFacts> classes;

    private ClassTable(Map<String, ClassFacts> classes) {
        this.classes = classes;
    }

    public static ClassTable of(Collection<ClassFacts> classes) {
        var builder = new Builder();
        classes.forEach(builder::add);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param className fully qualified name, with or without leading backslash
     */
    @Nullable
    public ClassFacts get(String className) {
        return classes.get(key(className));
    }

    public int size() {
        return classes.size();
    }

    private static String key(String className) {
        return Nodes.stripLeadingBackslash(className).toLowerCase(Locale.ROOT);
    }

    /**
     * Collects facts, possibly from several threads.
     */
    public static final class Builder {
        private final Map<String, ClassFacts> classes = new HashMap<>();

        private Builder() {
        }

        /**
         * The first declaration of a class wins.
         */
        public synchronized Builder add(ClassFacts facts) {
            classes.putIfAbsent(key(facts.name()), facts);
            return this;
        }

        public synchronized ClassTable build() {
            return new ClassTable(Map.copyOf(classes));
        }
    }
}
