package net.jrector.engine;

import net.jrector.api.ClassFacts;
import net.jrector.api.MethodFacts;
import net.jrector.api.Node;
import net.jrector.api.NodeKeys;
import net.jrector.api.NodeKind;
import net.jrector.api.Nodes;
import net.jrector.api.ResolvedType;
import net.jrector.api.Scope;
import net.jrector.api.Visibility;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Extracts {@link ClassFacts} from the declarations of a parsed file.
 */
public final class ClassDiscovery {
    private ClassDiscovery() {
    }

    public static List<ClassFacts> discover(Node root) {
        ScopeAnnotator.annotate(root);
        var result = new ArrayList<ClassFacts>();
        Nodes.walk(root, node -> {
            if (node.kind().isClassLike()) {
                result.add(describe(node));
            }
        });
        return result;
    }

    /**
     * Facts of a class or interface declaration whose scope has been annotated.
     */
    static ClassFacts describe(Node declaration) {
        var outer = Objects.requireNonNullElse(declaration.getAttribute(NodeKeys.SCOPE), Scope.GLOBAL);
        var scope = ScopeAnnotator.enter(declaration, outer);
        var className = Objects.requireNonNull(scope.className());

        boolean isInterface = declaration.is(NodeKind.INTERFACE);
        String parentName = null;
        var interfaces = new ArrayList<String>();
        Node modifiers = null;
        if (isInterface) {
            addNames(declaration.slot(1), scope, interfaces);
        } else {
            modifiers = declaration.slot(0);
            var parent = declaration.slot(2);
            if (parent != null) {
                parentName = scope.resolveClassName(parent.value());
            }
            addNames(declaration.slot(3), scope, interfaces);
        }

        var methods = new LinkedHashMap<String, MethodFacts>();
        for (var member : declaration.items()) {
            if (member.is(NodeKind.METHOD)) {
                var method = describeMethod(member, className, isInterface, scope.withFunction(member));
                methods.putIfAbsent(method.name().toLowerCase(Locale.ROOT), method);
            }
        }
        return new ClassFacts(className, parentName, List.copyOf(interfaces), isInterface,
                Nodes.hasModifier(modifiers, "final"), isInterface || Nodes.hasModifier(modifiers, "abstract"),
                Map.copyOf(methods));
    }

    private static MethodFacts describeMethod(Node method, String className, boolean inInterface, Scope scope) {
        var modifiers = method.slot(0);
        var parameterTypes = new ArrayList<@Nullable ResolvedType>();
        for (var param : method.requireSlot(2).items()) {
            parameterTypes.add(TypeNodes.parameterType(param, scope));
        }
        return new MethodFacts(
                className,
                Objects.requireNonNull(method.requireSlot(1).value()),
                Nodes.hasModifier(modifiers, "static"),
                inInterface || Nodes.hasModifier(modifiers, "abstract"),
                Visibility.of(modifiers),
                // List.copyOf rejects the null entries of untyped parameters
                Collections.unmodifiableList(parameterTypes),
                TypeNodes.toResolvedType(method.slot(3), scope)
        );
    }

    private static void addNames(@Nullable Node nameList, Scope scope, List<String> names) {
        if (nameList == null) {
            return;
        }
        for (var name : nameList.items()) {
            names.add(scope.resolveClassName(name.value()));
        }
    }
}
