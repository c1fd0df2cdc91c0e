package net.jrector.rules.renaming;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.reflect.TypeToken;
import net.jrector.api.ConfigurableRule;
import net.jrector.api.ConfigurationException;
import net.jrector.api.NamespaceConflictException;
import net.jrector.api.Node;
import net.jrector.api.NodeFactory;
import net.jrector.api.NodeKind;
import net.jrector.api.Nodes;
import net.jrector.api.RefactorResult;
import net.jrector.api.RuleContext;
import net.jrector.api.RuleDefinition;
import net.jrector.api.doc.PseudoNamespaces;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Replaces configured {@code Pseudo_Namespaces} by {@code Pseudo\Namespaces}.
 * <p>
 * References to matching classes are rewritten everywhere, including the types in doc comments. In a file
 * without a namespace, classes, interfaces and functions declared with a matching name are shortened to their
 * last segment and the whole file moves into the namespace their names spell. All of those declarations have to
 * agree on that namespace, otherwise the file cannot be converted and a {@link NamespaceConflictException} is
 * thrown before anything is changed.
 */
public class PseudoNamespaceToNamespaceRule implements ConfigurableRule {
    private static final Gson GSON = new Gson();
    private static final Type MAPPINGS = new TypeToken<List<PseudoNamespaceMapping>>() {
    }.getType();

    private List<PseudoNamespaceMapping> mappings = List.of();

    @Override
    public void configure(JsonElement configuration) {
        if (!configuration.isJsonArray()) {
            throw new ConfigurationException("Expected a list of {\"namespacePrefix\", \"excludedClasses\"} objects, got " + configuration);
        }
        List<PseudoNamespaceMapping> parsed = GSON.fromJson(configuration, MAPPINGS);
        var result = new ArrayList<PseudoNamespaceMapping>(parsed.size());
        for (var mapping : parsed) {
            if (mapping == null || mapping.namespacePrefix() == null || mapping.namespacePrefix().isBlank()) {
                throw new ConfigurationException("Every mapping needs a namespacePrefix");
            }
            result.add(new PseudoNamespaceMapping(mapping.namespacePrefix(), List.copyOf(mapping.excludedOrEmpty())));
        }
        mappings = List.copyOf(result);
    }

    public List<PseudoNamespaceMapping> mappings() {
        return mappings;
    }

    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.FILE_WITHOUT_NAMESPACE, NodeKind.NAMESPACE);
    }

    @Override
    public RefactorResult refactor(Node node, RuleContext context) {
        if (mappings.isEmpty()) {
            return RefactorResult.noChange();
        }

        String newNamespace = null;
        var declarations = new ArrayList<Node>();
        if (node.is(NodeKind.FILE_WITHOUT_NAMESPACE)) {
            for (var identifier : findDeclaredIdentifiers(node)) {
                var namespace = PseudoNamespaces.namespaceOf(identifier.value());
                if (namespace == null || findMapping(identifier) == null) {
                    continue;
                }
                if (newNamespace != null && !newNamespace.equals(namespace)) {
                    throw new NamespaceConflictException(newNamespace, namespace);
                }
                newNamespace = namespace;
                declarations.add(identifier);
            }
        }

        for (var identifier : declarations) {
            identifier.setValue(PseudoNamespaces.shortNameOf(identifier.value()));
        }
        boolean qualify = newNamespace != null || node.is(NodeKind.NAMESPACE) && node.slot(0) != null;
        boolean changed = !declarations.isEmpty();
        for (int i = node.kind().fixedSlots(); i < node.childCount(); i++) {
            if (rename(node.child(i), qualify, context)) {
                changed = true;
            }
        }

        if (newNamespace != null) {
            context.logger().debug("%s: moving declarations into namespace %s", context.file(), newNamespace);
            return RefactorResult.replace(NodeFactory.namespace(newNamespace, node.items()));
        }
        return changed ? RefactorResult.replace(node) : RefactorResult.noChange();
    }

    private boolean rename(Node node, boolean qualify, RuleContext context) {
        boolean changed = false;
        if (node.docComment() != null) {
            for (var mapping : mappings) {
                if (context.docTypeRenamer().changeUnderscoreType(node, mapping.namespacePrefix(), mapping.excludedOrEmpty())) {
                    changed = true;
                }
            }
        }
        for (var child : node.children()) {
            if (child == null) {
                continue;
            }
            if (child.is(NodeKind.NAME)) {
                if (renameName(child, qualify && !node.is(NodeKind.USE_ITEM))) {
                    changed = true;
                }
            } else if (rename(child, qualify, context)) {
                changed = true;
            }
        }
        return changed;
    }

    private boolean renameName(Node name, boolean qualify) {
        if (findMapping(name) == null) {
            return false;
        }
        var namespaced = PseudoNamespaces.toNamespaced(name.value());
        if (namespaced.equals(name.value())) {
            return false;
        }
        if (qualify && !namespaced.startsWith("\\")) {
            namespaced = "\\" + namespaced;
        }
        name.setValue(namespaced);
        return true;
    }

    /**
     * @return the mapping whose prefix the name starts with, {@code null} if there is none or the class is excluded
     */
    @Nullable
    private PseudoNamespaceMapping findMapping(Node nameOrIdentifier) {
        for (var mapping : mappings) {
            if (!Nodes.isName(nameOrIdentifier, mapping.namespacePrefix() + "*")) {
                continue;
            }
            if (Nodes.isNames(nameOrIdentifier, mapping.excludedOrEmpty())) {
                return null;
            }
            return mapping;
        }
        return null;
    }

    private static List<Node> findDeclaredIdentifiers(Node root) {
        var result = new ArrayList<Node>();
        Nodes.walk(root, node -> {
            switch (node.kind()) {
                case CLASS -> result.add(node.requireSlot(1));
                case INTERFACE, FUNCTION -> result.add(node.requireSlot(0));
                default -> {
                }
            }
        });
        return result;
    }

    @Override
    public RuleDefinition getDefinition() {
        return new RuleDefinition("Replaces defined Pseudo_Namespaces by Namespace\\Ones.",
                """
                        /** @var Some_Chicken $someService */
                        $someService = new Some_Chicken;
                        $someClassToKeep = new Some_Class_To_Keep;
                        """,
                """
                        /** @var \\Some\\Chicken $someService */
                        $someService = new Some\\Chicken;
                        $someClassToKeep = new Some_Class_To_Keep;
                        """);
    }
}
