package net.jrector.api;

import com.google.gson.JsonElement;

/**
 * A rule that accepts a configuration payload from the rule-set file.
 */
public interface ConfigurableRule extends Rule {
    /**
     * Called once before any file is processed.
     *
     * @throws ConfigurationException if the payload does not have the expected shape
     */
    void configure(JsonElement configuration);
}
