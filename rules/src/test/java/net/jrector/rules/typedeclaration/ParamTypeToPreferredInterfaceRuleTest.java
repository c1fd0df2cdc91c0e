package net.jrector.rules.typedeclaration;

import com.google.gson.JsonParser;
import net.jrector.api.ConfigurationException;
import net.jrector.rules.RuleTester;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParamTypeToPreferredInterfaceRuleTest {
    private static final String LOGGERS = """
            <?php

            namespace App\\Logging;

            use Psr\\Log\\LoggerInterface;

            interface Flushable
            {
            }

            class FileLogger implements LoggerInterface, Flushable
            {
            }

            class BufferedLogger extends FileLogger
            {
            }
            """;

    private static RuleTester tester(String... interfaces) throws Exception {
        var configuration = new StringBuilder();
        for (var name : interfaces) {
            if (!configuration.isEmpty()) {
                configuration.append(", ");
            }
            configuration.append('"').append(name.replace("\\", "\\\\")).append('"');
        }
        return RuleTester.create("{\"rules\": [{\"rule\": \"param-type-to-preferred-interface\", \"configuration\": ["
                + configuration + "]}]}").withClasses(LOGGERS);
    }

    @Test
    void testConcreteClassBecomesInterface() throws Exception {
        tester("Psr\\Log\\LoggerInterface").assertRewrite("""
                <?php

                namespace App;

                use App\\Logging\\FileLogger;

                final class Service
                {
                    public function __construct(FileLogger $logger, ?FileLogger $fallback = null, string $name = '')
                    {
                    }
                }
                """, """
                <?php

                namespace App;

                use App\\Logging\\FileLogger;

                final class Service
                {
                    public function __construct(\\Psr\\Log\\LoggerInterface $logger, ?\\Psr\\Log\\LoggerInterface $fallback = null, string $name = '')
                    {
                    }
                }
                """);
    }

    @Test
    void testInheritedInterfaceInSameNamespace() throws Exception {
        tester("App\\Logging\\Flushable").assertRewrite("""
                <?php

                namespace App\\Logging;

                class Flusher
                {
                    public function __construct(BufferedLogger $logger)
                    {
                    }
                }
                """, """
                <?php

                namespace App\\Logging;

                class Flusher
                {
                    public function __construct(Flushable $logger)
                    {
                    }
                }
                """);
    }

    @Test
    void testSkipAmbiguousInterfaces() throws Exception {
        tester("Psr\\Log\\LoggerInterface", "App\\Logging\\Flushable").assertUnchanged("""
                <?php

                use App\\Logging\\FileLogger;

                class Service
                {
                    public function __construct(FileLogger $logger)
                    {
                    }
                }
                """);
    }

    @Test
    void testSkipUnknownClassesAndOtherMethods() throws Exception {
        tester("Psr\\Log\\LoggerInterface").assertUnchanged("""
                <?php

                use App\\Logging\\FileLogger;

                class Service
                {
                    public function __construct(UnknownLogger $logger)
                    {
                    }

                    public function setLogger(FileLogger $logger)
                    {
                    }
                }
                """);
    }

    @Test
    void testWithoutInterfacesNothingChanges() throws Exception {
        tester().assertUnchanged("""
                <?php

                use App\\Logging\\FileLogger;

                class Service
                {
                    public function __construct(FileLogger $logger)
                    {
                    }
                }
                """);
    }

    @Test
    void testConfiguration() {
        var rule = new ParamTypeToPreferredInterfaceRule();
        rule.configure(JsonParser.parseString("[\"\\\\Psr\\\\Log\\\\LoggerInterface\"]"));
        assertThat(rule.interfaces()).containsExactly("Psr\\Log\\LoggerInterface");

        assertThatThrownBy(() -> rule.configure(JsonParser.parseString("{\"interface\": \"Foo\"}")))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> rule.configure(JsonParser.parseString("[1]")))
                .isInstanceOf(ConfigurationException.class);
    }
}
