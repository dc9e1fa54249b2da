package io.trading.optionchain.config;

/**
 * Missing or invalid recorder setting. Fatal at startup.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
