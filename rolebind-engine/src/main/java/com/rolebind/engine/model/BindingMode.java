package com.rolebind.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Conflict-resolution policy of a binding.
 */
public enum BindingMode {
    /** Independent toggle. */
    NORMAL,
    /** At most one role per scope (role message, or category for menus). */
    UNIQUE,
    /** Holding the role excludes every other bound role in the guild. */
    EXCLUSIVE;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static BindingMode fromKey(String key) {
        if (key == null || key.isBlank())
            return NORMAL;
        for (BindingMode mode : values()) {
            if (mode.key().equalsIgnoreCase(key.trim()))
                return mode;
        }
        throw new IllegalArgumentException("Unknown binding mode: " + key);
    }
}
