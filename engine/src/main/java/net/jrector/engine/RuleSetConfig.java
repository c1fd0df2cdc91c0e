package net.jrector.engine;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import net.jrector.api.ConfigurationException;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The rule-set file:
 * <pre>{@code
 * {
 *   "maxPasses": 10,
 *   "rules": [
 *     {"rule": "array-spread-instead-of-array-merge"},
 *     {"rule": "pseudo-namespace-to-namespace", "priority": 5, "configuration": [...]}
 *   ]
 * }
 * }</pre>
 *
 * @param maxPasses pass limit of the convergence driver, {@code null} for the default
 */
public record RuleSetConfig(@Nullable Integer maxPasses, List<RuleEntry> rules) {
    public static final RuleSetConfig EMPTY = new RuleSetConfig(null, List.of());

    private static final Gson GSON = new Gson();

    public RuleSetConfig {
        // List.copyOf would reject the null entries reported by read()
        rules = rules == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static RuleSetConfig of(String... ruleIds) {
        var entries = new ArrayList<RuleEntry>(ruleIds.length);
        for (var ruleId : ruleIds) {
            entries.add(new RuleEntry(ruleId, null, null));
        }
        return new RuleSetConfig(null, entries);
    }

    public static RuleSetConfig read(Path file) throws IOException {
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        }
    }

    public static RuleSetConfig parse(String json) {
        return read(new StringReader(json), "<inline>");
    }

    private static RuleSetConfig read(Reader reader, String origin) {
        RuleSetConfig config;
        try {
            config = GSON.fromJson(reader, RuleSetConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed rule-set " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Rule-set " + origin + " is empty");
        }
        checkMaxPasses(config.maxPasses);
        for (int i = 0; i < config.rules.size(); i++) {
            var entry = config.rules.get(i);
            if (entry == null || entry.rule() == null || entry.rule().isBlank()) {
                throw new ConfigurationException("Entry " + i + " of rule-set " + origin + " does not name a rule");
            }
        }
        return config;
    }

    public RuleSetConfig withMaxPasses(@Nullable Integer maxPasses) {
        checkMaxPasses(maxPasses);
        return new RuleSetConfig(maxPasses, rules);
    }

    private static void checkMaxPasses(@Nullable Integer maxPasses) {
        if (maxPasses != null && maxPasses < 1) {
            throw new ConfigurationException("maxPasses must be at least 1, got " + maxPasses);
        }
    }

    public int maxPassesOrDefault() {
        return maxPasses == null ? ConvergenceDriver.DEFAULT_MAX_PASSES : maxPasses;
    }

    /**
     * @param priority      overrides the priority declared by the rule
     * @param configuration payload passed to {@link net.jrector.api.ConfigurableRule#configure}
     */
    public record RuleEntry(String rule, @Nullable Integer priority, @Nullable JsonElement configuration) {
        public RuleEntry {
            if (configuration != null && configuration.isJsonNull()) {
                configuration = null;
            }
        }
    }
}
