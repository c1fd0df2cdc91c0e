package net.jrector.rules.typedeclaration;

import com.google.gson.JsonElement;
import net.jrector.api.ConfigurableRule;
import net.jrector.api.ConfigurationException;
import net.jrector.api.Node;
import net.jrector.api.NodeFactory;
import net.jrector.api.NodeKind;
import net.jrector.api.Nodes;
import net.jrector.api.RefactorResult;
import net.jrector.api.RuleContext;
import net.jrector.api.RuleDefinition;
import net.jrector.api.Scope;
import net.jrector.api.ScopeResolver;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Loosens constructor parameters typed with a concrete class to the one configured interface that class
 * implements. Parameters whose class implements several of the configured interfaces are left alone.
 */
public class ParamTypeToPreferredInterfaceRule implements ConfigurableRule {
    private List<String> interfaces = List.of();

    @Override
    public void configure(JsonElement configuration) {
        if (!configuration.isJsonArray()) {
            throw new ConfigurationException("Expected a list of interface names, got " + configuration);
        }
        var result = new ArrayList<String>();
        for (var element : configuration.getAsJsonArray()) {
            if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString() || element.getAsString().isBlank()) {
                throw new ConfigurationException("Interface names must be non-empty strings, got " + element);
            }
            result.add(Nodes.stripLeadingBackslash(element.getAsString()));
        }
        interfaces = List.copyOf(result);
    }

    public List<String> interfaces() {
        return interfaces;
    }

    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.METHOD);
    }

    @Override
    public RefactorResult refactor(Node node, RuleContext context) {
        if (interfaces.isEmpty() || !Nodes.isName(node.requireSlot(1), "__construct")) {
            return RefactorResult.noChange();
        }
        var resolver = context.resolver();
        boolean changed = false;
        for (var param : node.requireSlot(2).items()) {
            var type = param.slot(1);
            if (type == null) {
                continue;
            }
            var holder = type.is(NodeKind.NULLABLE_TYPE) ? type : param;
            int slot = type.is(NodeKind.NULLABLE_TYPE) ? 0 : 1;
            var name = holder.slot(slot);
            if (name == null || !name.is(NodeKind.NAME)) {
                continue;
            }
            var preferred = findPreferredInterface(resolver, resolver.resolveName(name));
            if (preferred != null) {
                holder.setSlot(slot, NodeFactory.name(reference(resolver.scopeOf(param), preferred)));
                changed = true;
            }
        }
        return changed ? RefactorResult.replace(node) : RefactorResult.noChange();
    }

    @Nullable
    private String findPreferredInterface(ScopeResolver resolver, String className) {
        var classFacts = resolver.resolveClass(className);
        if (classFacts == null || classFacts.isInterface()) {
            return null;
        }
        String preferred = null;
        for (var candidate : interfaces) {
            if (candidate.equalsIgnoreCase(className) || !resolver.isSubclassOf(classFacts, candidate)) {
                continue;
            }
            if (preferred != null) {
                return null;
            }
            preferred = candidate;
        }
        return preferred;
    }

    /**
     * The shortest way to refer to {@code className} without adding an import.
     */
    private static String reference(Scope scope, String className) {
        int separator = className.lastIndexOf('\\');
        if (separator == -1) {
            return scope.namespace() == null ? className : "\\" + className;
        }
        if (className.substring(0, separator).equalsIgnoreCase(scope.namespace())) {
            return className.substring(separator + 1);
        }
        return "\\" + className;
    }

    @Override
    public RuleDefinition getDefinition() {
        return new RuleDefinition("Changes constructor parameter types from a concrete class to its configured interface",
                """
                        final class Service
                        {
                            public function __construct(FileLogger $logger)
                            {
                            }
                        }
                        """,
                """
                        final class Service
                        {
                            public function __construct(\\Psr\\Log\\LoggerInterface $logger)
                            {
                            }
                        }
                        """);
    }
}
