package com.rolebind.engine.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for reaction trigger keys. Custom emojis are keyed by their
 * formatted form ({@code <:name:id>}); the legacy layout keyed them by bare
 * name.
 */
public final class TriggerKeys {

    private static final Pattern CUSTOM = Pattern.compile("<a?:([A-Za-z0-9_]{2,32}):(\\d+)>");
    private static final Pattern BARE_NAME = Pattern.compile("[A-Za-z0-9_]{2,32}");

    private TriggerKeys() {
    }

    /** Name part of a formatted custom emoji, or null for anything else. */
    public static String customEmojiName(String key) {
        if (key == null) {
            return null;
        }
        Matcher matcher = CUSTOM.matcher(key);
        return matcher.matches() ? matcher.group(1) : null;
    }

    /** Whether the key looks like a custom emoji stored by name only. */
    public static boolean isBareEmojiName(String key) {
        return key != null && BARE_NAME.matcher(key).matches();
    }
}
