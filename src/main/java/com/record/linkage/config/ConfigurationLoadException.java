package com.record.linkage.config;

/**
 * Runtime exception thrown when matching options cannot be read from their source.
 */
public class ConfigurationLoadException extends RuntimeException {

    public ConfigurationLoadException(String message) {
        super(message);
    }

    public ConfigurationLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
