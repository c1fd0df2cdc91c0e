package net.jrector.engine;

import net.jrector.api.Node;
import net.jrector.api.NodeKind;
import net.jrector.api.ResolvedType;
import net.jrector.api.Scope;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Reads native type declarations.
 */
final class TypeNodes {
    private TypeNodes() {
    }

    /**
     * @return the declared type, {@code null} for absent declarations and for unions other than {@code T|null}
     */
    @Nullable
    static ResolvedType toResolvedType(@Nullable Node type, Scope scope) {
        if (type == null) {
            return null;
        }
        return switch (type.kind()) {
            case NULLABLE_TYPE -> {
                var inner = toResolvedType(type.requireSlot(0), scope);
                yield inner == null ? null : inner.asNullable();
            }
            case UNION_TYPE -> {
                if (type.itemCount() != 2) {
                    yield null;
                }
                var first = toResolvedType(type.item(0), scope);
                var second = toResolvedType(type.item(1), scope);
                if (first == null || second == null) {
                    yield null;
                }
                if (second.kind() == ResolvedType.Kind.NULL) {
                    yield first.asNullable();
                }
                yield first.kind() == ResolvedType.Kind.NULL ? second.asNullable() : null;
            }
            case IDENTIFIER -> {
                var name = type.value().toLowerCase(Locale.ROOT);
                if ((name.equals("self") || name.equals("static")) && scope.className() != null) {
                    yield ResolvedType.objectOf(scope.className());
                }
                yield ResolvedType.ofBuiltin(name);
            }
            case NAME -> ResolvedType.objectOf(scope.resolveClassName(type.value()));
            default -> null;
        };
    }

    /**
     * Type of a parameter, a {@code null} default making it nullable.
     */
    @Nullable
    static ResolvedType parameterType(Node param, Scope scope) {
        var type = toResolvedType(param.slot(1), scope);
        var defaultValue = param.slot(3);
        if (type != null && defaultValue != null && defaultValue.is(NodeKind.CONST_FETCH)
                && "null".equalsIgnoreCase(defaultValue.requireSlot(0).value())) {
            return type.asNullable();
        }
        return type;
    }
}
