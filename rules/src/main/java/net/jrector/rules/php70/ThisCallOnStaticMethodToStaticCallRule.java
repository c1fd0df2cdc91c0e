package net.jrector.rules.php70;

import net.jrector.api.ClassFacts;
import net.jrector.api.MethodFacts;
import net.jrector.api.Node;
import net.jrector.api.NodeFactory;
import net.jrector.api.NodeKind;
import net.jrector.api.Nodes;
import net.jrector.api.RefactorResult;
import net.jrector.api.Rule;
import net.jrector.api.RuleContext;
import net.jrector.api.RuleDefinition;

import java.util.Set;

/**
 * Changes {@code $this->call()} of a static method into a static call.
 * <p>
 * {@code self::} is used where late static binding makes no difference, that is for final classes and private
 * methods, {@code static::} everywhere else.
 */
public class ThisCallOnStaticMethodToStaticCallRule implements Rule {
    // PHPUnit accepts both forms for its assertions
    private static final String TEST_CASE = "PHPUnit\\Framework\\TestCase";

    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.METHOD_CALL);
    }

    @Override
    public RefactorResult refactor(Node node, RuleContext context) {
        if (!Nodes.isThis(node.slot(0)) || Nodes.isFirstClassCallable(node)) {
            return RefactorResult.noChange();
        }
        var identifier = node.requireSlot(1);
        if (!identifier.is(NodeKind.IDENTIFIER)) {
            return RefactorResult.noChange();
        }

        var resolver = context.resolver();
        var classFacts = resolver.inClassScope(node);
        if (classFacts == null || classFacts.isInterface() || resolver.isSubclassOf(classFacts, TEST_CASE)) {
            return RefactorResult.noChange();
        }
        var method = resolver.findMethod(classFacts, identifier.value());
        if (method == null || !method.isStatic()) {
            return RefactorResult.noChange();
        }

        var staticCall = Node.of(NodeKind.STATIC_CALL, NodeFactory.name(classReference(classFacts, method)),
                identifier, node.requireSlot(2));
        return RefactorResult.replace(staticCall);
    }

    private static String classReference(ClassFacts classFacts, MethodFacts method) {
        return classFacts.isFinal() || method.isPrivate() ? "self" : "static";
    }

    @Override
    public RuleDefinition getDefinition() {
        return new RuleDefinition("Changes $this->call() to static method to static call",
                """
                        class SomeClass
                        {
                            public static function run()
                            {
                                $this->eat();
                            }

                            public static function eat()
                            {
                            }
                        }
                        """,
                """
                        class SomeClass
                        {
                            public static function run()
                            {
                                static::eat();
                            }

                            public static function eat()
                            {
                            }
                        }
                        """);
    }
}
