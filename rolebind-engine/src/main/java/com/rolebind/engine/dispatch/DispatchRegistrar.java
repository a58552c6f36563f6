package com.rolebind.engine.dispatch;

import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.resolve.ActivationKind;
import com.rolebind.engine.store.BindingStore;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the interaction router in line with the stored configuration.
 * <p>
 * Every method is idempotent: registering the same message twice leaves the
 * router as after the first call.
 */
@Slf4j
public class DispatchRegistrar {

    private final BindingStore store;
    private final InteractionRouter router;
    private final ActivationHandler activations;

    /** "guildId/messageId" to the ids registered for that message. */
    private final Map<String, Set<String>> registered = new ConcurrentHashMap<>();

    public DispatchRegistrar(BindingStore store, InteractionRouter router, ActivationHandler activations) {
        this.store = store;
        this.router = router;
        this.activations = activations;
    }

    /**
     * Register every button and menu message of every guild.
     *
     * @return number of identities registered
     */
    public int registerAll() {
        int count = 0;
        for (String guildId : store.guildIds()) {
            for (RoleMessage message : store.get(guildId)) {
                count += register(guildId, message).size();
            }
        }
        log.info("Registered {} component identities", count);
        return count;
    }

    /**
     * Register the message's current identities and drop the ones it no longer
     * has.
     */
    public List<ComponentIdentity> register(String guildId, RoleMessage message) {
        List<ComponentIdentity> identities = ComponentIdentities.derive(guildId, message);
        Set<String> current = new LinkedHashSet<>();
        for (ComponentIdentity identity : identities) {
            String id = identity.value();
            router.register(id, handlerFor(identity));
            current.add(id);
        }
        String slot = slot(guildId, message.id());
        Set<String> previous = current.isEmpty() ? registered.remove(slot) : registered.put(slot, current);
        if (previous != null) {
            for (String id : previous) {
                if (!current.contains(id)) {
                    router.unregister(id);
                }
            }
        }
        log.debug("Registered {} identities for message {}/{}", current.size(), guildId, message.id());
        return identities;
    }

    public void unregister(String guildId, String messageId) {
        Set<String> previous = registered.remove(slot(guildId, messageId));
        if (previous != null) {
            previous.forEach(router::unregister);
            log.debug("Unregistered {} identities for message {}/{}", previous.size(), guildId, messageId);
        }
    }

    /** Ids this registrar currently owns for the message. */
    public Set<String> registeredFor(String guildId, String messageId) {
        return Set.copyOf(registered.getOrDefault(slot(guildId, messageId), Set.of()));
    }

    private InteractionHandler handlerFor(ComponentIdentity identity) {
        String guildId = identity.guildId();
        String messageId = identity.messageId();
        String key = identity.key();
        return switch (identity.kind()) {
            case BUTTON -> (memberId, values) -> activations.activate(guildId, messageId, key, memberId,
                    ActivationKind.SELECT);
            case MENU -> (memberId, values) -> activations.selectMenu(guildId, messageId, key, memberId, values);
        };
    }

    private static String slot(String guildId, String messageId) {
        return guildId + "/" + messageId;
    }
}
