package net.jrector.tests;

import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import net.jrector.api.ProblemLocation;
import net.jrector.cli.FileProblemReporter;
import net.jrector.cli.Main;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Runs the command line tool in-process against the fixtures in the test data directory. Every fixture has a
 * {@code rules.json}, a {@code source} tree and the {@code expected} tree after rewriting.
 */
public class EmbeddedTest {
    private static final int EXIT_OK = 0;
    private static final int EXIT_ERROR = 1;
    private static final int EXIT_CHANGES_FOUND = 3;

    private final Path testDataRoot = Paths.get(getRequiredSystemProperty("jrector.testDataDir"));

    @TempDir
    private Path tempDir;

    @Nested
    class Rules {
        @Test
        void testArrayMergeToSpread() throws Exception {
            runTest("array_spread", EXIT_OK);
        }

        @Test
        void testConstructorParameterToInterface() throws Exception {
            runTest("preferred_interface", EXIT_OK);
        }

        @Test
        void testPropertyTypedFromConstructorParameter() throws Exception {
            runTest("typed_property", EXIT_OK);
        }

        @Test
        void testThisCallToStaticCall() throws Exception {
            runTest("static_call", EXIT_OK);
        }

        @Test
        void testPseudoNamespacesWithConflict() throws Exception {
            runTest("pseudo_namespace", EXIT_ERROR);
        }
    }

    @Nested
    class OutputModes {
        Path fixture;
        Path workDir;

        @BeforeEach
        void setUp() throws IOException {
            fixture = testDataRoot.resolve("array_spread");
            workDir = tempDir.resolve("work");
            copyDirectory(fixture.resolve("source"), workDir);
        }

        @Test
        void dryRunPrintsDiffAndKeepsFiles() throws Exception {
            var result = runTool("--dry-run", "--config", fixture.resolve("rules.json").toString(), workDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_CHANGES_FOUND);
            assertThat(result.output())
                    .contains("+++ b/" + workDir.resolve("src/Collector.php").toString().replace('\\', '/'))
                    .contains("-        return array_merge($array, ['bar']);")
                    .contains("+        return [...$array, 'bar'];")
                    .contains("1 changed");
            assertThat(loadDirToMap(workDir)).isEqualTo(loadDirToMap(fixture.resolve("source")));
        }

        @Test
        void dryRunWithoutChanges() throws Exception {
            var expectedDir = tempDir.resolve("expected");
            copyDirectory(fixture.resolve("expected"), expectedDir);

            var result = runTool("--dry-run", "--config", fixture.resolve("rules.json").toString(), expectedDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_OK);
            assertThat(result.output()).doesNotContain("+++ b/");
        }

        @Test
        void folderOutput() throws Exception {
            var outputDir = tempDir.resolve("output");

            var result = runTool("--config", fixture.resolve("rules.json").toString(), "--output", outputDir.toString(), workDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_OK);
            assertThat(loadDirToMap(outputDir)).isEqualTo(loadDirToMap(fixture.resolve("expected")));
            assertThat(loadDirToMap(workDir)).isEqualTo(loadDirToMap(fixture.resolve("source")));
        }

        @Test
        void singleFileInPlace() throws Exception {
            var file = workDir.resolve("src/Collector.php");

            var result = runTool("--config", fixture.resolve("rules.json").toString(), file.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_OK);
            assertThat(Files.readString(file)).isEqualTo(Files.readString(fixture.resolve("expected/src/Collector.php")));
        }

        @Test
        void singleFileOutputForFolderFails() throws Exception {
            var result = runTool("--config", fixture.resolve("rules.json").toString(),
                    "--output", tempDir.resolve("Output.php").toString(), "--out-format", "file", workDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_ERROR);
            assertThat(result.output()).contains("Cannot have an input with possibly more than one file when the output is a single file.");
        }

        @Test
        void fileThatIsNotUtf8IsNotTouched() throws Exception {
            var legacy = workDir.resolve("src/Legacy.php");
            var content = """
                    <?php
                    // café
                    function legacy(array $a): array
                    {
                        return array_merge($a, ['b']);
                    }
                    """.getBytes(StandardCharsets.ISO_8859_1);
            Files.write(legacy, content);

            var result = runTool("--config", fixture.resolve("rules.json").toString(), workDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_ERROR);
            assertThat(result.output()).contains("not valid UTF-8");
            assertThat(Files.readAllBytes(legacy)).isEqualTo(content);
            assertThat(Files.readString(workDir.resolve("src/Collector.php")))
                    .isEqualTo(Files.readString(fixture.resolve("expected/src/Collector.php")));
        }

        @Test
        void singleThreaded() throws Exception {
            var result = runTool("--threads", "1", "--max-queue-depth", "0", "--config", fixture.resolve("rules.json").toString(), workDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_OK);
            assertThat(loadDirToMap(workDir)).isEqualTo(loadDirToMap(fixture.resolve("expected")));
        }
    }

    @Nested
    class Configuration {
        Path workDir;

        @BeforeEach
        void setUp() throws IOException {
            workDir = tempDir.resolve("work");
            copyDirectory(testDataRoot.resolve("array_spread/source"), workDir);
        }

        @Test
        void unknownRule() throws Exception {
            var config = writeConfig("{\"rules\": [{\"rule\": \"no-such-rule\"}]}");

            var result = runTool("--config", config.toString(), workDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_ERROR);
            assertThat(result.output()).contains("Unknown rule no-such-rule");
            assertThat(loadDirToMap(workDir)).isEqualTo(loadDirToMap(testDataRoot.resolve("array_spread/source")));
        }

        @Test
        void configurationForRuleWithoutConfiguration() throws Exception {
            var config = writeConfig("{\"rules\": [{\"rule\": \"array-spread-instead-of-array-merge\", \"configuration\": [\"x\"]}]}");

            var result = runTool("--config", config.toString(), workDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_ERROR);
            assertThat(result.output()).contains("does not accept a configuration");
        }

        @Test
        void malformedConfiguration() throws Exception {
            var config = writeConfig("{\"rules\": [{\"rule\": \"pseudo-namespace-to-namespace\", \"configuration\": {\"namespacePrefix\": \"Some_\"}}]}");

            var result = runTool("--config", config.toString(), workDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_ERROR);
            assertThat(loadDirToMap(workDir)).isEqualTo(loadDirToMap(testDataRoot.resolve("array_spread/source")));
        }

        @Test
        void noRulesIsIdentity() throws Exception {
            var result = runTool(workDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_OK);
            assertThat(result.output()).contains("No rules are enabled");
            assertThat(loadDirToMap(workDir)).isEqualTo(loadDirToMap(testDataRoot.resolve("array_spread/source")));
        }

        @Test
        void maxPassesMustBePositive() throws Exception {
            var result = runTool("--max-passes", "0", "--config", testDataRoot.resolve("array_spread/rules.json").toString(), workDir.toString());

            assertThat(result.exitCode()).isEqualTo(EXIT_ERROR);
            assertThat(result.output()).contains("maxPasses must be at least 1");
        }

        @Test
        void missingPath() throws Exception {
            assertThat(runTool().exitCode()).isEqualTo(EXIT_ERROR);
            assertThat(runTool(tempDir.resolve("missing").toString()).exitCode()).isEqualTo(EXIT_ERROR);
        }

        @Test
        void listRules() throws Exception {
            var result = runTool("--list-rules");

            assertThat(result.exitCode()).isEqualTo(EXIT_OK);
            assertThat(result.output()).contains(
                    "array-spread-instead-of-array-merge",
                    "param-type-to-preferred-interface",
                    "pseudo-namespace-to-namespace",
                    "this-call-on-static-method-to-static-call",
                    "typed-property-from-constructor-param");
        }

        private Path writeConfig(String content) throws IOException {
            var config = tempDir.resolve("rules.json");
            Files.writeString(config, content);
            return config;
        }
    }

    /**
     * Rewrites a copy of the fixture's source in place and compares it to the expected tree. The rewritten tree
     * is then checked again in dry-run mode, which must not find anything left to change.
     */
    protected final void runTest(String testDirName, int expectedExitCode, String... extraArgs) throws Exception {
        var testDir = testDataRoot.resolve(testDirName);
        var workDir = tempDir.resolve("work");
        copyDirectory(testDir.resolve("source"), workDir);

        var reportFile = tempDir.resolve("report.json");
        var expectedReport = testDir.resolve("expected_report.json");

        var arguments = new ArrayList<>(Arrays.asList("--config", testDir.resolve("rules.json").toString()));
        if (Files.exists(expectedReport)) {
            arguments.add("--problems-report");
            arguments.add(reportFile.toString());
        }
        arguments.addAll(Arrays.asList(extraArgs));
        arguments.add(workDir.toString());

        var result = runTool(arguments.toArray(String[]::new));
        assertEquals(expectedExitCode, result.exitCode(), result.output());
        assertThat(loadDirToMap(workDir)).isEqualTo(loadDirToMap(testDir.resolve("expected")));

        if (Files.exists(expectedReport)) {
            var expectedRecords = FileProblemReporter.loadRecords(expectedReport);
            // Relativize the paths to make them comparable to the reference data.
            var actualRecords = FileProblemReporter.loadRecords(reportFile).stream().map(record -> {
                var location = record.location();
                if (location == null) {
                    return record;
                }
                return new FileProblemReporter.ProblemRecord(record.problemId(), record.severity(),
                        new ProblemLocation(workDir.relativize(location.file()), location.line(), location.column(),
                                location.offset(), location.length()),
                        record.message());
            }).toList();

            assertEquals(problemsToJson(expectedRecords), problemsToJson(actualRecords));
        }

        var again = runTool("--dry-run", "--config", testDir.resolve("rules.json").toString(), workDir.toString());
        assertThat(again.exitCode()).isNotEqualTo(EXIT_CHANGES_FOUND);
        assertThat(again.output()).doesNotContain("+++ b/");
    }

    private String problemsToJson(List<FileProblemReporter.ProblemRecord> problems) {
        return new GsonBuilder()
                .setPrettyPrinting()
                .registerTypeHierarchyAdapter(Path.class, new TypeAdapter<Path>() {
                    public void write(JsonWriter out, Path value) throws IOException {
                        out.value(value.toString().replace('\\', '/'));
                    }

                    public Path read(JsonReader in) throws IOException {
                        return Paths.get(in.nextString());
                    }
                })
                .create().toJson(problems);
    }

    protected ToolResult runTool(String... args) {
        // This is thread hostile, but what can I do :-[
        var oldOut = System.out;
        var oldErr = System.err;
        var capturedOut = new ByteArrayOutputStream();
        int exitCode;
        try {
            System.setErr(new PrintStream(capturedOut, true, StandardCharsets.UTF_8));
            System.setOut(new PrintStream(capturedOut, true, StandardCharsets.UTF_8));
            // Run in-process for easier debugging
            exitCode = Main.innerMain(args);
        } finally {
            System.setErr(oldErr);
            System.setOut(oldOut);
        }

        return new ToolResult(exitCode, capturedOut.toString(StandardCharsets.UTF_8));
    }

    protected record ToolResult(int exitCode, String output) {
    }

    protected static String getRequiredSystemProperty(String key) {
        var value = System.getProperty(key);
        if (value == null) {
            throw new RuntimeException("Missing system property: " + key);
        }
        return value;
    }

    private static void copyDirectory(Path source, Path target) throws IOException {
        try (Stream<Path> files = Files.walk(source)) {
            files.forEach(path -> {
                var targetPath = target.resolve(source.relativize(path).toString());
                try {
                    if (Files.isDirectory(path)) {
                        Files.createDirectories(targetPath);
                    } else {
                        Files.copy(path, targetPath);
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        }
    }

    private static Map<String, String> loadDirToMap(Path folder) throws IOException {
        var result = new TreeMap<String, String>();
        try (Stream<Path> stream = Files.walk(folder)) {
            for (var path : stream.filter(Files::isRegularFile).toList()) {
                result.put(folder.relativize(path).toString().replace('\\', '/'),
                        Files.readString(path, StandardCharsets.UTF_8).replace("\r\n", "\n"));
            }
        }
        return result;
    }
}
