package com.rolebind.discord;

import com.rolebind.engine.ActivationResult;
import com.rolebind.engine.MutationFailure;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.Settings;
import com.rolebind.engine.model.TriggerStyle;
import com.rolebind.engine.platform.MutationStatus;
import com.rolebind.engine.resolve.Outcome;
import com.rolebind.engine.resolve.RejectReason;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ActivationMessagesTest {

    private static final RoleMessage MESSAGE = RoleMessage.create("200", "300", TriggerStyle.BUTTON, null)
            .withSettings(new Settings(Set.of("9"), 2));

    @Test
    void render_addedAndRemoved() {
        var result = new ActivationResult(new Outcome.Applied(Set.of("1"), Set.of("2")), List.of(), MESSAGE);
        assertEquals("Added role: <@&1>\nRemoved role: <@&2>", ActivationMessages.render(result));
    }

    @Test
    void render_pluralForms() {
        var result = new ActivationResult(new Outcome.Applied(Set.of(), new LinkedHashSet<>(List.of("2", "3"))), List.of(), MESSAGE);
        assertEquals("Removed roles: <@&2>, <@&3>", ActivationMessages.render(result));
    }

    @Test
    void render_noop() {
        var result = new ActivationResult(Outcome.Applied.empty(), List.of(), MESSAGE);
        assertEquals(ActivationMessages.NO_CHANGES, ActivationMessages.render(result));
    }

    @Test
    void render_rejections() {
        assertEquals(ActivationMessages.UNAVAILABLE, ActivationMessages.render(
                ActivationResult.rejected(new Outcome.Rejected(RejectReason.MISSING_BINDING), null)));
        assertEquals("You need one of these roles to use this: <@&9>", ActivationMessages.render(
                ActivationResult.rejected(new Outcome.Rejected(RejectReason.MISSING_REQUIRED_ROLE), MESSAGE)));
        assertEquals("You can only have 2 roles from this message.", ActivationMessages.render(
                ActivationResult.rejected(new Outcome.Rejected(RejectReason.CAP_REACHED), MESSAGE)));
    }

    @Test
    void render_failedAddIsReportedNotClaimed() {
        var failure = new MutationFailure("1", MutationFailure.Operation.ADD, MutationStatus.FORBIDDEN, "denied");
        var result = new ActivationResult(new Outcome.Applied(Set.of("1"), Set.of("2")), List.of(failure), MESSAGE);
        String text = ActivationMessages.render(result);
        assertFalse(text.contains("Added role"));
        assertTrue(text.startsWith("Removed role: <@&2>"));
        assertTrue(text.contains("I don't have permission to manage <@&1>."));
    }

    @Test
    void render_memberLookupFailure() {
        var failure = new MutationFailure(null, MutationFailure.Operation.FETCH_MEMBER, MutationStatus.FAILED, "x");
        var result = new ActivationResult(Outcome.Applied.empty(), List.of(failure), MESSAGE);
        assertEquals(ActivationMessages.FETCH_FAILED, ActivationMessages.render(result));
    }
}
