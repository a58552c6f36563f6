package com.rolebind.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the triggers of a role message are presented on the platform.
 */
public enum TriggerStyle {
    REACTION,
    BUTTON,
    MENU;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }

    /**
     * Parse a style key. Accepts the plural forms ("reactions", "buttons") used by
     * the legacy configuration layout.
     */
    @JsonCreator
    public static TriggerStyle fromKey(String key) {
        if (key == null || key.isBlank())
            return REACTION;
        return switch (key.trim().toLowerCase()) {
            case "reaction", "reactions" -> REACTION;
            case "button", "buttons" -> BUTTON;
            case "menu", "menus" -> MENU;
            default -> throw new IllegalArgumentException("Unknown trigger style: " + key);
        };
    }

    /** Whether messages of this style carry interactive components. */
    public boolean interactive() {
        return this != REACTION;
    }
}
