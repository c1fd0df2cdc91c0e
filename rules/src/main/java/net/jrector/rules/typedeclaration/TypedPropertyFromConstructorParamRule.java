package net.jrector.rules.typedeclaration;

import net.jrector.api.Node;
import net.jrector.api.NodeKind;
import net.jrector.api.Nodes;
import net.jrector.api.RefactorResult;
import net.jrector.api.Rule;
import net.jrector.api.RuleContext;
import net.jrector.api.RuleDefinition;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adds a native type to an untyped property that is assigned exactly once in the class, unconditionally in the
 * constructor, from a typed constructor parameter.
 */
public class TypedPropertyFromConstructorParamRule implements Rule {
    // not allowed as property types
    private static final Set<String> INVALID_PROPERTY_TYPES = Set.of("callable", "void", "never");

    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.CLASS);
    }

    @Override
    public RefactorResult refactor(Node node, RuleContext context) {
        var constructor = findConstructor(node);
        if (constructor == null) {
            return RefactorResult.noChange();
        }
        var params = new HashMap<String, Node>();
        for (var param : constructor.requireSlot(2).items()) {
            params.put(param.requireSlot(2).value(), param);
        }
        var writes = collectPropertyWrites(node);

        boolean changed = false;
        for (var member : node.items()) {
            if (!member.is(NodeKind.PROPERTY) || member.slot(1) != null || member.itemCount() != 1
                    || Nodes.hasModifier(member.slot(0), "static")) {
                continue;
            }
            var item = member.item(0);
            if (item.slot(1) != null) {
                continue;
            }
            var propertyName = item.requireSlot(0).value();
            var type = typeFromConstructor(propertyName, writes.getOrDefault(propertyName, List.of()), constructor, params);
            if (type != null) {
                member.setSlot(1, type);
                changed = true;
            }
        }
        return changed ? RefactorResult.replace(node) : RefactorResult.noChange();
    }

    @Nullable
    private static Node typeFromConstructor(String propertyName, List<Node> writes, Node constructor, Map<String, Node> params) {
        if (writes.size() != 1) {
            return null;
        }
        var write = writes.get(0);
        if (!write.is(NodeKind.ASSIGN) || !"=".equals(write.value()) || !write.requireSlot(0).is(NodeKind.PROPERTY_FETCH)
                || !isConstructorStatement(write, constructor, propertyName)) {
            return null;
        }
        var value = write.requireSlot(1);
        if (!value.is(NodeKind.VARIABLE)) {
            return null;
        }
        var param = params.get(value.value());
        if (param == null || param.value() != null || param.slot(0) != null || param.slot(1) == null
                || isReassigned(constructor, value.value())) {
            return null;
        }
        var paramType = param.requireSlot(1);
        if (Nodes.isNames(paramType, INVALID_PROPERTY_TYPES)) {
            return null;
        }
        var type = paramType.deepCopy();
        if (isNullLiteral(param.slot(3)) && !acceptsNull(type)) {
            // implicitly nullable parameter
            type = type.is(NodeKind.UNION_TYPE) ? null : Node.of(NodeKind.NULLABLE_TYPE, type);
        }
        return type;
    }

    @Nullable
    private static Node findConstructor(Node classNode) {
        for (var member : classNode.items()) {
            if (member.is(NodeKind.METHOD) && Nodes.isName(member.requireSlot(1), "__construct") && member.slot(4) != null) {
                return member;
            }
        }
        return null;
    }

    /**
     * Everything that writes to {@code $this->property}, keyed by property name.
     */
    private static Map<String, List<Node>> collectPropertyWrites(Node classNode) {
        var writes = new HashMap<String, List<Node>>();
        Nodes.walk(classNode, node -> {
            Node target = switch (node.kind()) {
                case ASSIGN, POSTFIX_OP -> node.requireSlot(0);
                case UNARY_OP -> "++".equals(node.value()) || "--".equals(node.value()) ? node.requireSlot(0) : null;
                default -> null;
            };
            while (target != null && target.is(NodeKind.ARRAY_DIM_FETCH)) {
                target = target.requireSlot(0);
            }
            if (target != null && target.is(NodeKind.PROPERTY_FETCH) && Nodes.isThis(target.slot(0))) {
                var name = Nodes.getName(target.requireSlot(1));
                if (name != null) {
                    writes.computeIfAbsent(name, k -> new ArrayList<>()).add(node);
                }
            }
        });
        return writes;
    }

    /**
     * The assignment has to be a top-level statement of the constructor that every call reaches before the property
     * is read. Otherwise the typed property could be read uninitialized, where the untyped one was {@code null}.
     */
    private static boolean isConstructorStatement(Node assign, Node constructor, String propertyName) {
        for (var statement : constructor.requireSlot(4).items()) {
            if (statement.is(NodeKind.EXPRESSION_STMT) && statement.requireSlot(0) == assign) {
                return true;
            }
            if (containsInScope(statement, NodeKind.RETURN) || containsInScope(statement, NodeKind.THROW)
                    || readsProperty(statement, propertyName)) {
                return false;
            }
        }
        return false;
    }

    private static boolean containsInScope(Node statement, NodeKind kind) {
        return statement.is(kind) || !Nodes.findAllInScope(statement, kind).isEmpty();
    }

    private static boolean readsProperty(Node statement, String propertyName) {
        for (var fetch : Nodes.findAll(statement, NodeKind.PROPERTY_FETCH)) {
            if (Nodes.isThis(fetch.slot(0)) && propertyName.equals(Nodes.getName(fetch.requireSlot(1)))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isReassigned(Node constructor, String variable) {
        for (var assign : Nodes.findAllInScope(constructor.requireSlot(4), NodeKind.ASSIGN)) {
            if (Nodes.isName(assign.requireSlot(0), variable)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNullLiteral(@Nullable Node node) {
        return node != null && node.is(NodeKind.CONST_FETCH) && Nodes.isName(node.requireSlot(0), "null");
    }

    private static boolean acceptsNull(Node type) {
        if (type.is(NodeKind.NULLABLE_TYPE)) {
            return true;
        }
        if (type.is(NodeKind.UNION_TYPE)) {
            for (var member : type.items()) {
                if (acceptsNull(member)) {
                    return true;
                }
            }
            return false;
        }
        return Nodes.isName(type, "null") || Nodes.isName(type, "mixed");
    }

    @Override
    public RuleDefinition getDefinition() {
        return new RuleDefinition("Add typed property from assigned constructor parameter type",
                """
                        final class SomeClass
                        {
                            public $name;

                            public function __construct(string $name)
                            {
                                $this->name = $name;
                            }
                        }
                        """,
                """
                        final class SomeClass
                        {
                            public string $name;

                            public function __construct(string $name)
                            {
                                $this->name = $name;
                            }
                        }
                        """);
    }
}
