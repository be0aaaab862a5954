package io.s24x7.exporter.server.config;

/**
 * Missing or invalid configuration. Fatal at startup.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
