package com.rolebind.discord;

import com.rolebind.engine.ActivationResult;
import com.rolebind.engine.resolve.Outcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdaInteractionRouterTest {

    private final JdaInteractionRouter router = new JdaInteractionRouter(Runnable::run);

    @Test
    void dispatch_runsRegisteredHandler() {
        List<String> seen = new ArrayList<>();
        router.register("rb:1:2:m:Y29sb3Jz", (memberId, values) -> {
            seen.add(memberId + "=" + values);
            return new ActivationResult(new Outcome.Applied(Set.of("5"), Set.of()), List.of(), null);
        });

        ActivationResult result = router.dispatch("rb:1:2:m:Y29sb3Jz", "42", List.of("5"));

        assertNotNull(result);
        assertEquals(List.of("42=[5]"), seen);
        assertEquals("Added role: <@&5>", router.reply("rb:1:2:m:Y29sb3Jz", "42", List.of("5")));
    }

    @Test
    void dispatch_unregisteredIdIsInactive() {
        assertNull(router.dispatch("rb:1:2:b:eA", "42", List.of()));
        assertEquals(ActivationMessages.INACTIVE, router.reply("rb:1:2:b:eA", "42", List.of()));
    }

    @Test
    void register_replacesAndUnregisterRemoves() {
        router.register("a", (m, v) -> null);
        router.register("b", (m, v) -> null);
        router.register("a", (m, v) -> null);
        assertEquals(Set.of("a", "b"), router.registeredIds());

        router.unregister("a");
        router.unregister("missing");
        assertEquals(Set.of("b"), router.registeredIds());
    }

    @Test
    void reply_handlerFailureGivesGenericError() {
        router.register("boom", (m, v) -> {
            throw new IllegalStateException("boom");
        });
        assertEquals(ActivationMessages.INTERNAL_ERROR, router.reply("boom", "42", List.of()));
    }
}
