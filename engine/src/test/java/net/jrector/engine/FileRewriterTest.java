package net.jrector.engine;

import net.jrector.api.Logger;
import net.jrector.api.NamespaceConflictException;
import net.jrector.api.NodeKind;
import net.jrector.api.ProblemId;
import net.jrector.api.ProblemLocation;
import net.jrector.api.ProblemReporter;
import net.jrector.api.ProblemSeverity;
import net.jrector.api.Problems;
import net.jrector.api.RefactorResult;
import net.jrector.php.PhpParser;
import net.jrector.php.PhpPrinter;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileRewriterTest {
    private static final String SOURCE = "<?php\n// counter\n$a = 1;\necho $a;\n";

    private final List<ProblemId> problems = new ArrayList<>();
    private final List<String> messages = new ArrayList<>();
    private final ProblemReporter reporter = new ProblemReporter() {
        @Override
        public void report(ProblemId problemId, ProblemSeverity severity, ProblemLocation location, String message) {
            problems.add(problemId);
            messages.add(message);
        }

        @Override
        public void report(ProblemId problemId, ProblemSeverity severity, String message) {
            problems.add(problemId);
        }
    };

    private FileRewriter rewriter(int maxPasses, LambdaRule... rules) {
        return new FileRewriter(new PhpParser(), new PhpPrinter(), LambdaRule.index(rules), ClassTable.EMPTY,
                maxPasses, Logger.NONE, reporter);
    }

    private static LambdaRule renameA() {
        return LambdaRule.on(NodeKind.VARIABLE, (node, context) -> {
            if (!"a".equals(node.value())) {
                return RefactorResult.noChange();
            }
            node.setValue("count");
            return RefactorResult.replace(node);
        });
    }

    @Test
    void testUnchangedFile() {
        var change = rewriter(10).rewrite("a.php", SOURCE);

        assertThat(change.status()).isEqualTo(FileStatus.UNCHANGED);
        assertThat(change.finalText()).isEqualTo(SOURCE);
        assertThat(problems).isEmpty();
    }

    @Test
    void testChangedFile() {
        var change = rewriter(10, renameA()).rewrite("a.php", SOURCE);

        assertThat(change.status()).isEqualTo(FileStatus.CHANGED);
        assertThat(change.originalText()).isEqualTo(SOURCE);
        assertThat(change.finalText()).isEqualTo("<?php\n// counter\n$count = 1;\necho $count;\n");
        assertThat(change.diff()).contains("+$count = 1;");
    }

    @Test
    void testRewritingTheOutputAgainChangesNothing() {
        var rewriter = rewriter(10, renameA());
        var first = rewriter.rewrite("a.php", SOURCE);

        var second = rewriter.rewrite("a.php", first.finalText());

        assertThat(second.status()).isEqualTo(FileStatus.UNCHANGED);
    }

    @Test
    void testParseError() {
        var change = rewriter(10, renameA()).rewrite("broken.php", "<?php\n$a = ;\n");

        assertThat(change.status()).isEqualTo(FileStatus.ERRORED);
        assertThat(change.finalText()).isEqualTo("<?php\n$a = ;\n");
        assertThat(change.error()).contains("2:6");
        assertThat(problems).containsExactly(Problems.PARSE_ERROR);
    }

    @Test
    void testNamespaceConflictLeavesFileUntouched() {
        var conflict = LambdaRule.on(NodeKind.VARIABLE, (node, context) -> {
            throw new NamespaceConflictException("Foo", "Bar");
        });

        var change = rewriter(10, renameA().withPriority(1), conflict).rewrite("a.php", SOURCE);

        assertThat(change.status()).isEqualTo(FileStatus.ERRORED);
        assertThat(change.finalText()).isEqualTo(SOURCE);
        assertThat(change.error()).contains("2 different namespaces");
        assertThat(problems).containsExactly(Problems.NAMESPACE_CONFLICT);
    }

    @Test
    void testFailingRule() {
        var failing = LambdaRule.on(NodeKind.ECHO, (node, context) -> {
            throw new IllegalArgumentException("boom");
        });

        var change = rewriter(10, failing).rewrite("a.php", SOURCE);

        assertThat(change.status()).isEqualTo(FileStatus.ERRORED);
        assertThat(change.error()).contains("boom");
        assertThat(problems).containsExactly(Problems.RULE_FAILURE);
    }

    @Test
    void testNonConvergingRuleKeepsBestRewrite() {
        var increment = LambdaRule.on(NodeKind.NUMBER, (node, context) -> {
            node.setValue(String.valueOf(Integer.parseInt(node.value()) + 1));
            return RefactorResult.replace(node);
        });

        var change = rewriter(2, increment).rewrite("a.php", SOURCE);

        assertThat(change.status()).isEqualTo(FileStatus.CHANGED);
        assertThat(change.finalText()).isEqualTo("<?php\n// counter\n$a = 3;\necho $a;\n");
        assertThat(change.warnings()).hasSize(1);
        assertThat(problems).containsExactly(Problems.NOT_CONVERGED);
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0))
                .startsWith("Not converged after 2 passes")
                .contains("--- a/a.php", "-$a = 1;", "+$a = 3;");
    }

    @Test
    void testInvalidUtf8IsLeftAlone() {
        var content = "<?php\n// café\n$a = 1;\n".getBytes(StandardCharsets.ISO_8859_1);

        var change = rewriter(10, renameA()).rewrite("latin1.php", content);

        assertThat(change.status()).isEqualTo(FileStatus.ERRORED);
        assertThat(change.finalText()).isNull();
        assertThat(change.error()).isEqualTo("not valid UTF-8");
        assertThat(problems).containsExactly(Problems.ENCODING_ERROR);
    }

    @Test
    void testUtf8BytesAreRewritten() {
        var content = "<?php\n// café\n$a = 1;\n".getBytes(StandardCharsets.UTF_8);

        var change = rewriter(10, renameA()).rewrite("utf8.php", content);

        assertThat(change.status()).isEqualTo(FileStatus.CHANGED);
        assertThat(change.finalText()).isEqualTo("<?php\n// caf\u00e9\n$count = 1;\n");
    }
}
