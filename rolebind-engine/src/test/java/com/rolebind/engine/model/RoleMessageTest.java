package com.rolebind.engine.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoleMessageTest {

    private static RoleMessage menu() {
        return RoleMessage.create("m", "c", TriggerStyle.MENU, null)
                .withCategory("games", new Category("Games", null, null, List.of(
                        Binding.of("chess", BindingMode.NORMAL),
                        Binding.of("go", BindingMode.UNIQUE).withOrphaned(true))))
                .withCategory("teams", new Category("Teams", null, null, List.of(
                        Binding.of("red", BindingMode.UNIQUE),
                        Binding.of("blue", BindingMode.EXCLUSIVE))));
    }

    @Test
    void menuTriggersAreKeyedByRole() {
        assertEquals(List.of("chess", "go", "red", "blue"), List.copyOf(menu().effectiveTriggers().keySet()));
        assertEquals(Set.of("chess", "red", "blue"), menu().boundRoleIds());
        assertEquals(Set.of("blue"), menu().exclusiveRoleIds());
        assertEquals("red", menu().triggerKeyOf("red"));
        assertEquals("teams", menu().categoryIdOf("blue"));
    }

    @Test
    void uniqueScopeOfMenuIsTheCategory() {
        assertEquals(Set.of("red", "blue"), menu().uniqueScopeOf("red"));
        assertEquals(Set.of("chess"), menu().uniqueScopeOf("go"));
        assertEquals(Set.of(), menu().uniqueScopeOf("unknown"));
    }

    @Test
    void removeBindingReachesIntoCategories() {
        RoleMessage updated = menu().removeBinding("red");

        assertEquals(1, updated.categories().get("teams").bindings().size());
        assertNull(updated.triggerKeyOf("red"));
    }

    @Test
    void replaceBindingKeepsTriggerKey() {
        RoleMessage message = RoleMessage.create("m", "c", TriggerStyle.REACTION, null)
                .withTrigger("🔴", Binding.of("red", BindingMode.NORMAL))
                .withTrigger("🔵", Binding.of("blue", BindingMode.NORMAL));

        RoleMessage updated = message.replaceBinding("red", Binding.of("red", BindingMode.NORMAL).withOrphaned(true));

        assertEquals(List.of("🔴", "🔵"), List.copyOf(updated.triggers().keySet()));
        assertTrue(updated.triggers().get("🔴").orphaned());
        assertEquals(Set.of("blue"), updated.boundRoleIds());
    }

    @Test
    void categorySlug() {
        assertEquals("color_team", Category.slug("  Color   Team "));
        assertEquals("games", Category.slug("GAMES"));
    }

    @Test
    void styleKeysAcceptLegacyPlurals() {
        assertEquals(TriggerStyle.BUTTON, TriggerStyle.fromKey("buttons"));
        assertEquals(TriggerStyle.REACTION, TriggerStyle.fromKey(null));
        assertThrows(IllegalArgumentException.class, () -> TriggerStyle.fromKey("dropdown"));
        assertEquals(BindingMode.NORMAL, BindingMode.fromKey(""));
        assertEquals(BindingMode.EXCLUSIVE, BindingMode.fromKey("Exclusive"));
    }
}
