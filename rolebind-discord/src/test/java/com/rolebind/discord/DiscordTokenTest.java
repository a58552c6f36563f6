package com.rolebind.discord;

import com.rolebind.common.config.RoleBindConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiscordTokenTest {

    @Test
    void normalize_stripsBotPrefixAndWhitespace() {
        assertEquals("abc.def", DiscordToken.normalize("  Bot abc.def "));
        assertEquals("abc.def", DiscordToken.normalize("bot   abc.def"));
        assertEquals("abc.def", DiscordToken.normalize("abc.def"));
    }

    @Test
    void normalize_blankIsNull() {
        assertNull(DiscordToken.normalize(null));
        assertNull(DiscordToken.normalize("   "));
        assertNull(DiscordToken.normalize("Bot "));
    }

    @Test
    void resolve_prefersConfigToken() {
        var config = new RoleBindConfig.DiscordConfig();
        config.setToken("Bot from-config");
        var resolution = DiscordToken.resolve(config, "from-env");
        assertEquals("from-config", resolution.token());
        assertEquals(DiscordToken.Source.CONFIG, resolution.source());
    }

    @Test
    void resolve_fallsBackToEnvironment() {
        var resolution = DiscordToken.resolve(new RoleBindConfig.DiscordConfig(), "from-env");
        assertEquals("from-env", resolution.token());
        assertEquals(DiscordToken.Source.ENV, resolution.source());
        assertTrue(resolution.present());
    }

    @Test
    void resolve_noneWhenNothingConfigured() {
        var resolution = DiscordToken.resolve(null, "");
        assertFalse(resolution.present());
        assertEquals("", resolution.token());
    }
}
