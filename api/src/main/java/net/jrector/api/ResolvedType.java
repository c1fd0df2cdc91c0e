package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A type inferred for an expression or declared for a parameter, property or return value.
 */
public record ResolvedType(Kind kind, @Nullable String className, boolean nullable) {
    private static final Map<String, Kind> BUILTIN_TYPES = Map.ofEntries(
            Map.entry("array", Kind.ARRAY),
            Map.entry("string", Kind.STRING),
            Map.entry("int", Kind.INT),
            Map.entry("float", Kind.FLOAT),
            Map.entry("bool", Kind.BOOL),
            Map.entry("false", Kind.BOOL),
            Map.entry("true", Kind.BOOL),
            Map.entry("null", Kind.NULL),
            Map.entry("callable", Kind.CALLABLE),
            Map.entry("iterable", Kind.ITERABLE),
            Map.entry("object", Kind.OBJECT),
            Map.entry("mixed", Kind.MIXED),
            Map.entry("void", Kind.VOID),
            Map.entry("never", Kind.VOID),
            Map.entry("self", Kind.OBJECT),
            Map.entry("static", Kind.OBJECT),
            Map.entry("parent", Kind.OBJECT)
    );

    public static final ResolvedType MIXED = new ResolvedType(Kind.MIXED, null, false);
    public static final ResolvedType ARRAY = new ResolvedType(Kind.ARRAY, null, false);
    public static final ResolvedType STRING = new ResolvedType(Kind.STRING, null, false);
    public static final ResolvedType INT = new ResolvedType(Kind.INT, null, false);
    public static final ResolvedType FLOAT = new ResolvedType(Kind.FLOAT, null, false);
    public static final ResolvedType BOOL = new ResolvedType(Kind.BOOL, null, false);
    public static final ResolvedType NULL = new ResolvedType(Kind.NULL, null, true);

    public ResolvedType {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.OBJECT && className == null) {
            className = "object";
        }
    }

    public static ResolvedType objectOf(String className) {
        return new ResolvedType(Kind.OBJECT, Nodes.stripLeadingBackslash(className), false);
    }

    /**
     * @param name a builtin type keyword such as {@code string}, {@code null} for anything else
     */
    @Nullable
    public static ResolvedType ofBuiltin(String name) {
        var kind = BUILTIN_TYPES.get(name.toLowerCase(Locale.ROOT));
        if (kind == null) {
            return null;
        }
        if (kind == Kind.OBJECT) {
            return objectOf(name.toLowerCase(Locale.ROOT));
        }
        return new ResolvedType(kind, null, kind == Kind.NULL);
    }

    public static boolean isBuiltinTypeName(String name) {
        return BUILTIN_TYPES.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public boolean isArray() {
        return kind == Kind.ARRAY && !nullable;
    }

    public boolean isObject() {
        return kind == Kind.OBJECT;
    }

    public ResolvedType asNullable() {
        return nullable ? this : new ResolvedType(kind, className, true);
    }

    /**
     * @return the type as written in a native declaration, e.g. {@code ?string} or {@code \Foo\Bar}
     */
    public String describe() {
        var base = switch (kind) {
            case OBJECT -> "object".equals(className) ? "object" : "\\" + className;
            default -> kind.name().toLowerCase(Locale.ROOT);
        };
        return nullable && kind != Kind.NULL && kind != Kind.MIXED ? "?" + base : base;
    }

    @Override
    public String toString() {
        return describe();
    }

    public enum Kind {
        ARRAY,
        STRING,
        INT,
        FLOAT,
        BOOL,
        NULL,
        CALLABLE,
        ITERABLE,
        OBJECT,
        MIXED,
        VOID
    }
}
