package com.rolebind.app.commands;

import com.rolebind.discord.DiscordEmoji;
import com.rolebind.engine.ConfigurationException;
import com.rolebind.engine.model.BindingMode;
import com.rolebind.engine.model.TriggerStyle;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shared parsing and formatting helpers used across command handlers.
 */
public final class CommandUtils {

    private CommandUtils() {
    }

    private static final Pattern HEX_COLOR = Pattern.compile("#?[0-9A-Fa-f]{6}");

    /** Normalize a hex colour to "#RRGGBB", or null when absent. */
    public static String parseColor(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        String trimmed = raw.trim();
        if (!HEX_COLOR.matcher(trimmed).matches()) {
            throw new ConfigurationException("Invalid color " + raw + "; use a hex code like #FF0000");
        }
        String hex = trimmed.startsWith("#") ? trimmed.substring(1) : trimmed;
        return "#" + hex.toUpperCase(Locale.ROOT);
    }

    public static BindingMode parseMode(String raw) {
        try {
            return BindingMode.fromKey(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown mode " + raw + "; use normal, unique or exclusive");
        }
    }

    public static TriggerStyle parseStyle(String raw, TriggerStyle fallback) {
        if (raw == null || raw.isBlank())
            return fallback;
        try {
            return TriggerStyle.fromKey(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown style " + raw + "; use reactions or buttons");
        }
    }

    /**
     * Trigger key from user input. Reaction triggers must be emojis; button
     * triggers may be an emoji or a label.
     */
    public static String parseTrigger(String raw, TriggerStyle style) {
        String key = DiscordEmoji.normalize(raw);
        if (key == null || key.isEmpty()) {
            throw new ConfigurationException("A trigger is required");
        }
        if (style == TriggerStyle.REACTION && !DiscordEmoji.isEmoji(key)) {
            throw new ConfigurationException(raw + " is not an emoji");
        }
        return key;
    }

    /** Optional display emoji from user input, or null. */
    public static String parseEmoji(String raw) {
        String emoji = DiscordEmoji.normalize(raw);
        if (emoji == null || emoji.isEmpty())
            return null;
        if (!DiscordEmoji.isEmoji(emoji)) {
            throw new ConfigurationException(raw + " is not an emoji");
        }
        return emoji;
    }

    public static String roleMention(String roleId) {
        return "<@&" + roleId + ">";
    }

    public static String channelMention(String channelId) {
        return channelId != null ? "<#" + channelId + ">" : "an unknown channel";
    }

    public static String plural(long count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
