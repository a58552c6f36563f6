package com.rolebind.app.commands;

import com.rolebind.engine.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named options of a slash command. Role, channel and user options arrive as
 * their ids.
 */
public final class CommandOptions {

    private final Map<String, String> values;

    public CommandOptions(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values != null ? values : Map.of()));
    }

    public static CommandOptions of(String... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("options must be name/value pairs");
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return new CommandOptions(map);
    }

    /** Trimmed value, or null when absent or blank. */
    public String optional(String name) {
        String value = values.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public String required(String name) {
        String value = optional(name);
        if (value == null) {
            throw new ConfigurationException("Missing option: " + name);
        }
        return value;
    }

    public Integer integer(String name) {
        String value = optional(name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option " + name + " must be a number: " + value);
        }
    }

    public boolean flag(String name) {
        return Boolean.parseBoolean(optional(name));
    }

    public Map<String, String> asMap() {
        return values;
    }
}
