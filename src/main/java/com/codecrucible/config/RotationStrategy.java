package com.codecrucible.config;

import java.util.Locale;

public enum RotationStrategy {

    /** Persistent per-task cursor, advanced on every selection. */
    ROUND_ROBIN,
    /** Uniform draw from the task's pool. */
    RANDOM,
    /** Cumulative-weight scan; models without a weight count as 1. */
    WEIGHTED;

    public static RotationStrategy fromKey(String key) {
        if (key == null || key.isBlank()) {
            return ROUND_ROBIN;
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationValidationException("Unknown rotation strategy: " + key);
        }
    }
}
