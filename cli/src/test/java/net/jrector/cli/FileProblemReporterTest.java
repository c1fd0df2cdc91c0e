package net.jrector.cli;

import net.jrector.api.Logger;
import net.jrector.api.ProblemLocation;
import net.jrector.api.ProblemSeverity;
import net.jrector.api.Problems;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileProblemReporterTest {
    @TempDir
    Path tempDir;

    @Test
    void testProblemsAreWrittenSortedByLocation() throws Exception {
        var report = tempDir.resolve("problems.json");
        try (var reporter = new FileProblemReporter(Logger.NONE, report)) {
            reporter.report(Problems.NAMESPACE_CONFLICT, ProblemSeverity.ERROR, ProblemLocation.ofFile(Path.of("src/b.php")),
                    "There cannot be 2 different namespaces in one file");
            reporter.report(Problems.PARSE_ERROR, ProblemSeverity.ERROR, ProblemLocation.ofLocationInFile(Path.of("src/a.php"), 3, 7),
                    "Unexpected end of file");
        }

        var records = FileProblemReporter.loadRecords(report);
        assertThat(records).extracting(FileProblemReporter.ProblemRecord::problemId)
                .containsExactly(Problems.PARSE_ERROR, Problems.NAMESPACE_CONFLICT);
        var first = records.get(0);
        assertThat(first.severity()).isEqualTo(ProblemSeverity.ERROR);
        assertThat(first.location()).isEqualTo(ProblemLocation.ofLocationInFile(Path.of("src/a.php"), 3, 7));
        assertThat(first.message()).isEqualTo("Unexpected end of file");
    }

    @Test
    void testEmptyReport() throws Exception {
        var report = tempDir.resolve("problems.json");
        new FileProblemReporter(Logger.NONE, report).close();

        assertThat(FileProblemReporter.loadRecords(report)).isEmpty();
    }
}
