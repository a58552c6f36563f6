package com.rolebind.discord;

import net.dv8tion.jda.api.entities.emoji.Emoji;

import java.util.regex.Pattern;

/**
 * Emoji handling for trigger keys. Keys are stored in the formatted form
 * ({@code 🔴}, {@code <:name:123>}, {@code <a:name:123>}) so that a reaction
 * event maps to the same key that was configured.
 */
public final class DiscordEmoji {

    private DiscordEmoji() {
    }

    private static final Pattern CUSTOM = Pattern.compile("<a?:[A-Za-z0-9_~]{2,32}:\\d{15,21}>");
    private static final Pattern CUSTOM_SHORT = Pattern.compile(":?[A-Za-z0-9_~]{2,32}:\\d{15,21}");
    private static final int KEYCAP = 0x20E3;
    private static final int MAX_UNICODE_CODEPOINTS = 10;

    /**
     * Normalize user input to the formatted emoji form. Accepts
     * {@code name:123} shorthand for custom emojis; anything else is returned
     * trimmed.
     */
    public static String normalize(String raw) {
        if (raw == null)
            return null;
        String trimmed = raw.trim();
        if (trimmed.isEmpty())
            return trimmed;
        if (CUSTOM.matcher(trimmed).matches()) {
            return Emoji.fromFormatted(trimmed).getFormatted();
        }
        if (CUSTOM_SHORT.matcher(trimmed).matches()) {
            String bare = trimmed.startsWith(":") ? trimmed.substring(1) : trimmed;
            return Emoji.fromFormatted("<:" + bare + ">").getFormatted();
        }
        return trimmed;
    }

    /**
     * Whether the text is an emoji (custom or unicode) rather than a plain
     * label.
     */
    public static boolean isEmoji(String text) {
        if (text == null || text.isBlank())
            return false;
        if (CUSTOM.matcher(text).matches())
            return true;
        if (text.codePointCount(0, text.length()) > MAX_UNICODE_CODEPOINTS)
            return false;
        if (text.codePoints().anyMatch(cp -> cp == KEYCAP))
            return true;
        return text.codePoints().noneMatch(cp -> cp < 0x80 || Character.isWhitespace(cp)
                || Character.isLetterOrDigit(cp));
    }

    /** JDA emoji for a formatted key. */
    public static Emoji toEmoji(String formatted) {
        return Emoji.fromFormatted(formatted);
    }
}
