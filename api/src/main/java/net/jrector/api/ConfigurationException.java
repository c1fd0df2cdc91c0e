package net.jrector.api;

/**
 * Thrown at startup for unknown rules and invalid rule configuration.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
