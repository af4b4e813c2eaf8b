package com.example.skirmish.util;

/**
 * Thrown when the runtime configuration cannot be read.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
