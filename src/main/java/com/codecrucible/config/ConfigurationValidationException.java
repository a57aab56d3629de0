package com.codecrucible.config;

/**
 * Thrown at startup when the {@code crucible.*} settings cannot produce a
 * runnable engine.
 */
public class ConfigurationValidationException extends RuntimeException {

    public ConfigurationValidationException(String message) {
        super(message);
    }
}
