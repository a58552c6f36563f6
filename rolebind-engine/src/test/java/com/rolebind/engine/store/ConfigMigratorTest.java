package com.rolebind.engine.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolebind.engine.PersistenceException;
import com.rolebind.engine.model.BindingMode;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.TriggerStyle;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfigMigratorTest {

    private final ObjectMapper mapper = JsonFileBindingStore.defaultMapper();

    private BindingDocument migrate(String json) throws Exception {
        return ConfigMigrator.migrate(mapper.readTree(json), mapper);
    }

    @Test
    void nullRootIsEmptyDocument() {
        BindingDocument document = ConfigMigrator.migrate(null, mapper);
        assertEquals(ConfigMigrator.CURRENT_VERSION, document.version());
        assertTrue(document.guilds().isEmpty());
    }

    @Test
    void legacyReactionMessage() throws Exception {
        BindingDocument document = migrate("""
                {"111": {"222": {
                  "🔴": {"role_id": "333", "mode": "unique", "label": "Red"},
                  "🔵": 444,
                  "settings": {"required_roles": ["555"], "max_roles": 2, "style": "reactions",
                               "embed_data": {"title": "Colors", "description": "Pick", "color": "ff0000"}}
                }}}
                """);

        RoleMessage message = document.guilds().get("111").get("222");
        assertEquals(TriggerStyle.REACTION, message.style());
        assertNull(message.channelId());
        assertEquals("333", message.triggers().get("🔴").roleId());
        assertEquals(BindingMode.UNIQUE, message.triggers().get("🔴").mode());
        assertEquals("Red", message.triggers().get("🔴").label());
        assertEquals("444", message.triggers().get("🔵").roleId());
        assertEquals(BindingMode.NORMAL, message.triggers().get("🔵").mode());
        assertEquals(Set.of("555"), message.settings().requiredRoles());
        assertEquals(2, message.settings().maxRoles());
        assertEquals("Colors", message.content().title());
        assertEquals("#FF0000", message.content().color());
    }

    @Test
    void legacyMenuMessage() throws Exception {
        BindingDocument document = migrate("""
                {"111": {"222": {"settings": {"style": "menu", "max_roles": null, "required_roles": null,
                  "categories": {"games": {"name": "Games", "description": "Play", "emoji": "🎮",
                    "roles": [{"role_id": "1", "mode": "normal", "description": "Chess"},
                              {"role_id": "2", "mode": "exclusive"}]}}}}}}
                """);

        RoleMessage message = document.guilds().get("111").get("222");
        assertEquals(TriggerStyle.MENU, message.style());
        assertTrue(message.triggers().isEmpty());
        assertNull(message.settings().maxRoles());
        var games = message.categories().get("games");
        assertEquals("Games", games.name());
        assertEquals(List.of("1", "2"), games.bindings().stream().map(b -> b.roleId()).toList());
        assertEquals(BindingMode.EXCLUSIVE, games.bindings().get(1).mode());
        assertEquals(Set.of("1", "2"), message.boundRoleIds());
    }

    @Test
    void legacyLimitAndNamedColour() throws Exception {
        RoleMessage message = migrate("""
                {"1": {"2": {"✅": "3", "settings": {"limit": 1, "embed_data": {"title": "T", "color": "blue"}}}}}
                """).guilds().get("1").get("2");

        assertEquals(1, message.settings().maxRoles());
        assertNull(message.content().color());
    }

    @Test
    void currentVersionReadsAsIs() throws Exception {
        BindingDocument document = migrate("""
                {"version": 1, "guilds": {"1": {"2": {"id": "2", "style": "button",
                  "triggers": {"🔴": {"roleId": "3", "mode": "unique"}}, "futureField": true}}}}
                """);

        RoleMessage message = document.guilds().get("1").get("2");
        assertEquals(TriggerStyle.BUTTON, message.style());
        assertEquals(BindingMode.UNIQUE, message.triggers().get("🔴").mode());
    }

    @Test
    void futureVersionIsRefused() {
        var e = assertThrows(PersistenceException.class, () -> migrate("{\"version\": 2, \"guilds\": {}}"));
        assertTrue(e.getMessage().contains("Unsupported"));
    }

    @Test
    void legacyBindingWithoutRoleFails() {
        assertThrows(PersistenceException.class, () -> migrate("{\"1\": {\"2\": {\"🔴\": {\"mode\": \"normal\"}}}}"));
    }

    @Test
    void legacyCustomEmojiKeysAreFlagged() throws Exception {
        RoleMessage message = migrate("""
                {"111": {"222": {"blob": "333", "🔴": "444", "settings": {"style": "reactions"}}}}
                """).guilds().get("111").get("222");

        assertEquals(List.of("blob", "🔴"), List.copyOf(message.triggers().keySet()));
        assertEquals(List.of("blob"), ConfigMigrator.bareEmojiKeys(message));
    }

    @Test
    void buttonLabelsAreNotFlaggedAsEmojiNames() throws Exception {
        RoleMessage message = migrate("""
                {"111": {"222": {"Red": "333", "settings": {"style": "buttons"}}}}
                """).guilds().get("111").get("222");

        assertTrue(ConfigMigrator.bareEmojiKeys(message).isEmpty());
    }

    @Test
    void interactiveMessagesNeedRebuildAfterMigration() throws Exception {
        var guild = migrate("""
                {"111": {
                  "222": {"Red": "333", "settings": {"style": "buttons"}},
                  "223": {"🔴": "444", "settings": {"style": "reactions"}},
                  "224": {"blob": "555", "settings": {"style": "reactions"}}
                }}
                """).guilds().get("111");

        assertTrue(ConfigMigrator.needsRebuild(guild.get("222")));
        assertFalse(ConfigMigrator.needsRebuild(guild.get("223")));
        assertTrue(ConfigMigrator.needsRebuild(guild.get("224")));
    }
}
