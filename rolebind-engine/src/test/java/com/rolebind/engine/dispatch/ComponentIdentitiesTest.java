package com.rolebind.engine.dispatch;

import com.rolebind.engine.model.Binding;
import com.rolebind.engine.model.BindingMode;
import com.rolebind.engine.model.Category;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.Settings;
import com.rolebind.engine.model.TriggerStyle;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ComponentIdentitiesTest {

    private static RoleMessage buttons() {
        return RoleMessage.create("200", "c1", TriggerStyle.BUTTON, null)
                .withTrigger("🔴", Binding.of("red", BindingMode.NORMAL))
                .withTrigger("Blue team", Binding.of("blue", BindingMode.NORMAL));
    }

    @Test
    void buttonMessageYieldsOneIdentityPerTrigger() {
        List<ComponentIdentity> ids = ComponentIdentities.derive("100", buttons());

        assertEquals(2, ids.size());
        assertEquals(new ComponentIdentity("100", "200", ComponentIdentity.Kind.BUTTON, "🔴"), ids.get(0));
        assertEquals("Blue team", ids.get(1).key());
        assertTrue(ids.get(0).value().startsWith("rb:100:200:b:"));
    }

    @Test
    void derivationIsDeterministic() {
        assertEquals(ComponentIdentities.derive("100", buttons()), ComponentIdentities.derive("100", buttons()));
        assertEquals(ComponentIdentities.derive("100", buttons()).get(0).value(),
                ComponentIdentities.derive("100", buttons()).get(0).value());
    }

    @Test
    void menuMessageYieldsOneIdentityPerNonEmptyCategory() {
        RoleMessage menu = new RoleMessage("300", "c1", TriggerStyle.MENU, Settings.DEFAULT, null, false, Map.of(),
                Map.of("games", new Category("Games", null, null, List.of(Binding.of("chess", BindingMode.NORMAL))),
                        "empty", new Category("Empty", null, null, List.of())));

        List<ComponentIdentity> ids = ComponentIdentities.derive("100", menu);

        assertEquals(1, ids.size());
        assertEquals(ComponentIdentity.Kind.MENU, ids.get(0).kind());
        assertEquals("games", ids.get(0).key());
    }

    @Test
    void reactionAndStaleMessagesYieldNothing() {
        RoleMessage reactions = RoleMessage.create("400", "c1", TriggerStyle.REACTION, null)
                .withTrigger("🔴", Binding.of("red", BindingMode.NORMAL));

        assertTrue(ComponentIdentities.derive("100", reactions).isEmpty());
        assertTrue(ComponentIdentities.derive("100", buttons().withStale(true)).isEmpty());
    }

    @Test
    void parseReversesFormat() {
        var identity = new ComponentIdentity("100", "200", ComponentIdentity.Kind.BUTTON, "<:party:123456789>");
        assertEquals(identity, ComponentIdentities.parse(identity.value()));
    }

    @Test
    void parseRejectsForeignAndMalformedIds() {
        assertNull(ComponentIdentities.parse(null));
        assertNull(ComponentIdentities.parse("role_123_456"));
        assertNull(ComponentIdentities.parse("rb:100:200:x:YQ"));
        assertNull(ComponentIdentities.parse("rb:100:200:b"));
        assertNull(ComponentIdentities.parse("rb:100:200:b:***"));
        assertNull(ComponentIdentities.parse("rb:100:200:b:"));
    }

    @Test
    void longKeysDoNotFit() {
        var shortKey = new ComponentIdentity("123456789012345678", "123456789012345678",
                ComponentIdentity.Kind.BUTTON, "🔴");
        var longKey = new ComponentIdentity("123456789012345678", "123456789012345678",
                ComponentIdentity.Kind.BUTTON, "x".repeat(60));

        assertTrue(ComponentIdentities.fits(shortKey));
        assertFalse(ComponentIdentities.fits(longKey));
    }
}
