package net.jrector.engine;

import com.google.gson.JsonParseException;
import net.jrector.api.ConfigurableRule;
import net.jrector.api.ConfigurationException;
import net.jrector.api.RulePlugin;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * The rules that are available to a run, and the way they are instantiated from a {@link RuleSetConfig}.
 */
public final class RuleRegistry {
    private final Map<String, RulePlugin> plugins;

    private RuleRegistry(Map<String, RulePlugin> plugins) {
        this.plugins = plugins;
    }

    /**
     * Finds all plugins on the classpath.
     */
    public static RuleRegistry load() {
        return of(ServiceLoader.load(RulePlugin.class).stream().map(ServiceLoader.Provider::get).toList());
    }

    public static RuleRegistry of(Collection<? extends RulePlugin> plugins) {
        var byName = new TreeMap<String, RulePlugin>();
        for (var plugin : plugins) {
            var previous = byName.putIfAbsent(plugin.getName(), plugin);
            if (previous != null) {
                throw new ConfigurationException("Rule " + plugin.getName() + " is provided by both "
                        + previous.getClass().getName() + " and " + plugin.getClass().getName());
            }
        }
        return new RuleRegistry(Collections.unmodifiableMap(byName));
    }

    /**
     * All plugins, sorted by name.
     */
    public Collection<RulePlugin> plugins() {
        return plugins.values();
    }

    @Nullable
    public RulePlugin get(String id) {
        return plugins.get(id);
    }

    /**
     * Creates and configures a fresh rule for every entry, in the order of the rule-set.
     *
     * @throws ConfigurationException for unknown or repeated rules and for rejected configuration
     */
    public List<RuleDescriptor> instantiate(RuleSetConfig config) {
        var descriptors = new ArrayList<RuleDescriptor>(config.rules().size());
        var seen = new HashSet<String>();
        for (var entry : config.rules()) {
            var id = entry.rule();
            var plugin = plugins.get(id);
            if (plugin == null) {
                throw new ConfigurationException("Unknown rule " + id + ". Available rules: " + String.join(", ", plugins.keySet()));
            }
            if (!seen.add(id)) {
                throw new ConfigurationException("Rule " + id + " is listed more than once");
            }

            var rule = plugin.createRule();
            var configuration = entry.configuration();
            if (configuration != null) {
                if (!(rule instanceof ConfigurableRule configurable)) {
                    throw new ConfigurationException("Rule " + id + " does not accept a configuration");
                }
                try {
                    configurable.configure(configuration);
                } catch (JsonParseException | IllegalArgumentException e) {
                    throw new ConfigurationException("Invalid configuration for rule " + id + ": " + e.getMessage(), e);
                }
            }

            var priority = entry.priority() != null ? entry.priority() : rule.getPriority();
            descriptors.add(new RuleDescriptor(id, rule, rule.getNodeKinds(), priority, descriptors.size(), configuration));
        }
        return descriptors;
    }
}
