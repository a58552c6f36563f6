package com.rolebind.app.commands;

import com.rolebind.engine.ConfigurationException;
import com.rolebind.engine.model.BindingMode;
import com.rolebind.engine.model.TriggerStyle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandUtilsTest {

    @Test
    void parseColor_normalizesHex() {
        assertEquals("#FF00AA", CommandUtils.parseColor("ff00aa"));
        assertEquals("#12AB34", CommandUtils.parseColor(" #12ab34 "));
        assertNull(CommandUtils.parseColor(null));
        assertNull(CommandUtils.parseColor(""));
    }

    @Test
    void parseColor_rejectsNamesAndShortCodes() {
        assertThrows(ConfigurationException.class, () -> CommandUtils.parseColor("red"));
        assertThrows(ConfigurationException.class, () -> CommandUtils.parseColor("#FFF"));
    }

    @Test
    void parseMode_defaultsToNormal() {
        assertEquals(BindingMode.NORMAL, CommandUtils.parseMode(null));
        assertEquals(BindingMode.EXCLUSIVE, CommandUtils.parseMode("exclusive"));
        var e = assertThrows(ConfigurationException.class, () -> CommandUtils.parseMode("only"));
        assertTrue(e.getMessage().contains("normal, unique or exclusive"));
    }

    @Test
    void parseStyle_acceptsPluralForms() {
        assertEquals(TriggerStyle.BUTTON, CommandUtils.parseStyle("buttons", TriggerStyle.REACTION));
        assertEquals(TriggerStyle.REACTION, CommandUtils.parseStyle(null, TriggerStyle.REACTION));
        assertThrows(ConfigurationException.class, () -> CommandUtils.parseStyle("links", TriggerStyle.REACTION));
    }

    @Test
    void parseTrigger_reactionNeedsEmoji_buttonTakesLabel() {
        assertEquals("🔴", CommandUtils.parseTrigger("🔴", TriggerStyle.REACTION));
        assertThrows(ConfigurationException.class, () -> CommandUtils.parseTrigger("Red", TriggerStyle.REACTION));
        assertEquals("Red", CommandUtils.parseTrigger("Red", TriggerStyle.BUTTON));
        assertThrows(ConfigurationException.class, () -> CommandUtils.parseTrigger(" ", TriggerStyle.BUTTON));
    }

    @Test
    void parseEmoji_optional() {
        assertNull(CommandUtils.parseEmoji(null));
        assertEquals("🎨", CommandUtils.parseEmoji("🎨"));
        assertThrows(ConfigurationException.class, () -> CommandUtils.parseEmoji("paint"));
    }

    @Test
    void formatting() {
        assertEquals("<@&7>", CommandUtils.roleMention("7"));
        assertEquals("<#8>", CommandUtils.channelMention("8"));
        assertEquals("an unknown channel", CommandUtils.channelMention(null));
        assertEquals("1 role", CommandUtils.plural(1, "role"));
        assertEquals("0 roles", CommandUtils.plural(0, "role"));
    }
}
