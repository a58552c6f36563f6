package com.rolebind.discord;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiscordEmojiTest {

    // =========================================================================
    // normalize
    // =========================================================================

    @Test
    void normalize_keepsFormattedCustomEmoji() {
        assertEquals("<:party:123456789012345678>", DiscordEmoji.normalize(" <:party:123456789012345678> "));
        assertEquals("<a:wave:123456789012345678>", DiscordEmoji.normalize("<a:wave:123456789012345678>"));
    }

    @Test
    void normalize_expandsShorthand() {
        assertEquals("<:party:123456789012345678>", DiscordEmoji.normalize("party:123456789012345678"));
        assertEquals("<:party:123456789012345678>", DiscordEmoji.normalize(":party:123456789012345678"));
    }

    @Test
    void normalize_leavesUnicodeAndLabelsAlone() {
        assertEquals("🔴", DiscordEmoji.normalize(" 🔴"));
        assertEquals("Red Team", DiscordEmoji.normalize("Red Team"));
        assertNull(DiscordEmoji.normalize(null));
    }

    // =========================================================================
    // isEmoji
    // =========================================================================

    @Test
    void isEmoji_detectsUnicodeAndCustom() {
        assertTrue(DiscordEmoji.isEmoji("🔴"));
        assertTrue(DiscordEmoji.isEmoji("👍🏽"));
        assertTrue(DiscordEmoji.isEmoji("1️⃣"));
        assertTrue(DiscordEmoji.isEmoji("<:party:123456789012345678>"));
    }

    @Test
    void isEmoji_rejectsLabels() {
        assertFalse(DiscordEmoji.isEmoji("Red"));
        assertFalse(DiscordEmoji.isEmoji("Red 🔴"));
        assertFalse(DiscordEmoji.isEmoji(""));
        assertFalse(DiscordEmoji.isEmoji(null));
    }

    @Test
    void toEmoji_roundTripsFormattedForm() {
        assertEquals("<:party:123456789012345678>",
                DiscordEmoji.toEmoji("<:party:123456789012345678>").getFormatted());
        assertEquals("🔴", DiscordEmoji.toEmoji("🔴").getFormatted());
    }
}
