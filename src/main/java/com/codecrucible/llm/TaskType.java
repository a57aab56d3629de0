package com.codecrucible.llm;

import java.util.Locale;

/**
 * Task types a backend can be configured for. Each one carries the action tag
 * sent on the wire and used in cache keys and analytics.
 */
public enum TaskType {

    GENERATION("generation", "generate"),
    CHECKING("checking", "check_bugs"),
    FIXING("fixing", "fix"),
    FEATURE("feature", "apply_feature");

    private final String key;
    private final String action;

    TaskType(String key, String action) {
        this.key    = key;
        this.action = action;
    }

    /** Configuration key, e.g. {@code crucible.tasks.checking}. */
    public String getKey() {
        return key;
    }

    public String getAction() {
        return action;
    }

    public static TaskType fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Task type key cannot be null");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (TaskType type : values()) {
            if (type.key.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + key);
    }
}
