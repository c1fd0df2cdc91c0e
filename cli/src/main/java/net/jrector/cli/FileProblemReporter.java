package net.jrector.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import net.jrector.api.Logger;
import net.jrector.api.ProblemId;
import net.jrector.api.ProblemLocation;
import net.jrector.api.ProblemReporter;
import net.jrector.api.ProblemSeverity;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Collects the problems of a run and writes them to a JSON file when closed. Problems are sorted by location,
 * so the report does not depend on the order in which worker threads finished.
 */
@ApiStatus.Internal
public class FileProblemReporter implements ProblemReporter, AutoCloseable {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .registerTypeHierarchyAdapter(Path.class, new TypeAdapter<Path>() {
                @Override
                public void write(JsonWriter out, Path value) throws IOException {
                    out.value(value.toString().replace('\\', '/'));
                }

                @Override
                public Path read(JsonReader in) throws IOException {
                    return Paths.get(in.nextString());
                }
            })
            .create();

    private static final Comparator<ProblemRecord> ORDER = Comparator
            .comparing((ProblemRecord record) -> record.location() == null ? "" : record.location().file().toString())
            .thenComparing(record -> record.location() == null ? 0 : Objects.requireNonNullElse(record.location().line(), 0))
            .thenComparing(record -> record.problemId().id());

    private final Logger logger;
    private final Path problemsReport;

    private final List<ProblemRecord> problems = new ArrayList<>();

    public FileProblemReporter(Logger logger, Path problemsReport) {
        this.logger = logger;
        this.problemsReport = problemsReport;
    }

    @Override
    public synchronized void report(ProblemId problemId, ProblemSeverity severity, ProblemLocation location, String message) {
        problems.add(new ProblemRecord(problemId, severity, location, message));
    }

    @Override
    public void report(ProblemId problemId, ProblemSeverity severity, String message) {
        report(problemId, severity, null, message);
    }

    @Override
    public synchronized void close() throws IOException {
        logger.debug("Writing problems report to %s", problemsReport);
        var sorted = new ArrayList<>(problems);
        sorted.sort(ORDER);
        try (var writer = Files.newBufferedWriter(problemsReport, StandardCharsets.UTF_8)) {
            GSON.toJson(sorted, writer);
        }
    }

    @VisibleForTesting
    public static List<ProblemRecord> loadRecords(Path file) throws IOException {
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return Arrays.asList(GSON.fromJson(reader, ProblemRecord[].class));
        }
    }

    public record ProblemRecord(
            ProblemId problemId,
            ProblemSeverity severity,
            @Nullable ProblemLocation location,
            String message
    ) {
    }
}
