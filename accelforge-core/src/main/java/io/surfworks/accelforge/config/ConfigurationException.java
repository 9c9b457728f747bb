package io.surfworks.accelforge.config;

/**
 * Thrown when a configuration file cannot be read or a configured value is invalid.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
