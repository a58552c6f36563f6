package com.rolebind.engine.reconcile;

import com.rolebind.engine.PlatformException;
import com.rolebind.engine.dispatch.DispatchRegistrar;
import com.rolebind.engine.model.Binding;
import com.rolebind.engine.model.Category;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.TriggerKeys;
import com.rolebind.engine.model.TriggerStyle;
import com.rolebind.engine.platform.GuildRole;
import com.rolebind.engine.platform.MessagePlatform;
import com.rolebind.engine.platform.RolePlatform;
import com.rolebind.engine.store.BindingStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares stored configuration with the live guild and repairs drift.
 * <p>
 * {@link #verify} is read-only. {@link #cleanup} applies what verify found and
 * reaches a fixed point: a second run finds nothing to change.
 * {@link #rebuild} re-creates reactions and components on the platform.
 */
@Slf4j
public class Reconciler {

    private final BindingStore store;
    private final RolePlatform roles;
    private final MessagePlatform messages;
    private final DispatchRegistrar registrar;

    public Reconciler(BindingStore store, RolePlatform roles, MessagePlatform messages, DispatchRegistrar registrar) {
        this.store = store;
        this.roles = roles;
        this.messages = messages;
        this.registrar = registrar;
    }

    // =========================================================================
    // verify
    // =========================================================================

    public ReconcileReport verify(String guildId) {
        Map<String, GuildRole> guildRoles = guildRoles(guildId);
        int topPosition = roles.selfTopRolePosition(guildId);

        List<MessageReport> reports = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        for (RoleMessage message : store.get(guildId)) {
            if (message.stale()) {
                stale.add(message.id());
                continue;
            }
            reports.add(inspect(guildId, message, guildRoles, topPosition));
        }
        ReconcileReport report = new ReconcileReport(guildId, reports, stale, false);
        log.info("Verified guild {}: {} messages, {} issues", guildId, reports.size(), report.issueCount());
        return report;
    }

    private Map<String, GuildRole> guildRoles(String guildId) {
        Map<String, GuildRole> guildRoles = new HashMap<>();
        for (GuildRole role : roles.fetchGuildRoles(guildId)) {
            guildRoles.put(role.id(), role);
        }
        return guildRoles;
    }

    private MessageReport inspect(String guildId, RoleMessage message, Map<String, GuildRole> guildRoles,
            int topPosition) {
        String channelId = message.channelId();
        boolean missing = false;
        String lookupError = null;
        try {
            String located = messages.locateMessage(guildId, message.channelId(), message.id());
            if (located == null) {
                missing = true;
            } else {
                channelId = located;
            }
        } catch (PlatformException e) {
            lookupError = e.getMessage();
            log.warn("Could not look up message {}/{}: {}", guildId, message.id(), e.getMessage());
        }

        List<OrphanedBinding> orphaned = new ArrayList<>();
        List<String> unmanageable = new ArrayList<>();
        for (Map.Entry<String, Binding> entry : message.effectiveTriggers().entrySet()) {
            Binding binding = entry.getValue();
            GuildRole role = guildRoles.get(binding.roleId());
            if (binding.orphaned() || role == null) {
                orphaned.add(new OrphanedBinding(entry.getKey(), binding.roleId(),
                        message.categoryIdOf(binding.roleId())));
            } else if (role.managed() || role.position() >= topPosition) {
                unmanageable.add(role.id());
            }
        }

        List<String> emptyCategories = new ArrayList<>();
        for (Map.Entry<String, Category> entry : message.categories().entrySet()) {
            long remaining = entry.getValue().bindings().stream()
                    .filter(b -> orphaned.stream().noneMatch(o -> o.roleId().equals(b.roleId())))
                    .count();
            if (remaining == 0) {
                emptyCategories.add(entry.getKey());
            }
        }
        return new MessageReport(message.id(), channelId, missing, lookupError, orphaned, emptyCategories,
                unmanageable);
    }

    // =========================================================================
    // cleanup
    // =========================================================================

    /**
     * Mark missing messages stale, drop orphaned bindings and the categories
     * that removal empties.
     *
     * @throws com.rolebind.engine.PersistenceException if a change could not be
     *                                                  persisted
     */
    public ReconcileReport cleanup(String guildId) {
        ReconcileReport report = verify(guildId);
        for (MessageReport found : report.messages()) {
            RoleMessage message = store.getMessage(guildId, found.messageId());
            if (message == null) {
                continue;
            }
            if (found.missing()) {
                store.put(guildId, removeOrphans(message, found.orphanedBindings()).withStale(true));
                registrar.unregister(guildId, message.id());
                log.info("Marked role message {}/{} stale, dropping {} orphaned bindings", guildId, message.id(),
                        found.orphanedBindings().size());
                continue;
            }
            if (found.orphanedBindings().isEmpty()) {
                continue;
            }
            RoleMessage updated = removeOrphans(message, found.orphanedBindings());
            store.put(guildId, updated);
            registrar.register(guildId, updated);
            log.info("Removed {} orphaned bindings from {}/{}", found.orphanedBindings().size(), guildId,
                    message.id());
            refreshView(guildId, found.channelId(), updated, found.orphanedBindings());
        }
        scrubStale(guildId, report.staleMessageIds());
        return report.asRepaired();
    }

    /**
     * Drop bindings of deleted roles from messages that were already stale, so
     * adopting or cloning them later carries no dead bindings forward.
     */
    private void scrubStale(String guildId, List<String> staleIds) {
        if (staleIds.isEmpty()) {
            return;
        }
        Map<String, GuildRole> guildRoles = guildRoles(guildId);
        for (String messageId : staleIds) {
            RoleMessage message = store.getMessage(guildId, messageId);
            if (message == null) {
                continue;
            }
            List<OrphanedBinding> orphaned = orphansOf(message, guildRoles);
            if (!orphaned.isEmpty()) {
                store.put(guildId, removeOrphans(message, orphaned));
                log.info("Removed {} orphaned bindings from stale message {}/{}", orphaned.size(), guildId,
                        messageId);
            }
        }
    }

    private static List<OrphanedBinding> orphansOf(RoleMessage message, Map<String, GuildRole> guildRoles) {
        List<OrphanedBinding> orphaned = new ArrayList<>();
        for (Map.Entry<String, Binding> entry : message.effectiveTriggers().entrySet()) {
            Binding binding = entry.getValue();
            if (binding.orphaned() || !guildRoles.containsKey(binding.roleId())) {
                orphaned.add(new OrphanedBinding(entry.getKey(), binding.roleId(),
                        message.categoryIdOf(binding.roleId())));
            }
        }
        return orphaned;
    }

    private static RoleMessage removeOrphans(RoleMessage message, List<OrphanedBinding> orphaned) {
        RoleMessage updated = message;
        for (OrphanedBinding binding : orphaned) {
            updated = updated.removeBinding(binding.roleId());
        }
        // drop categories emptied by this removal; ones that were already empty stay
        for (Map.Entry<String, Category> entry : new LinkedHashMap<>(updated.categories()).entrySet()) {
            boolean wasEmpty = message.categories().get(entry.getKey()).bindings().isEmpty();
            if (entry.getValue().bindings().isEmpty() && !wasEmpty) {
                updated = updated.withoutCategory(entry.getKey());
            }
        }
        return updated;
    }

    private void refreshView(String guildId, String channelId, RoleMessage message, List<OrphanedBinding> removed) {
        try {
            if (message.style() == TriggerStyle.REACTION) {
                for (OrphanedBinding binding : removed) {
                    messages.clearReaction(guildId, channelId, message.id(), binding.triggerKey());
                }
            } else {
                messages.renderView(guildId, message.withChannelId(channelId));
            }
        } catch (PlatformException e) {
            log.warn("Could not refresh view of {}/{}: {}", guildId, message.id(), e.getMessage());
        }
    }

    // =========================================================================
    // rebuild
    // =========================================================================

    /**
     * Re-create reactions or components of every active message that still
     * exists, and re-register its dispatch.
     *
     * @throws com.rolebind.engine.PersistenceException if a discovered channel
     *                                                  could not be persisted
     */
    public RebuildReport rebuild(String guildId) {
        List<String> rebuilt = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (RoleMessage stored : store.get(guildId)) {
            if (stored.stale()) {
                continue;
            }
            RoleMessage message = stored;
            try {
                String channelId = messages.locateMessage(guildId, message.channelId(), message.id());
                if (channelId == null) {
                    missing.add(message.id());
                    continue;
                }
                if (!channelId.equals(message.channelId())) {
                    message = message.withChannelId(channelId);
                    store.put(guildId, message);
                }
                if (message.style() == TriggerStyle.REACTION) {
                    RoleMessage rekeyed = resolveLegacyKeys(guildId, message);
                    if (rekeyed != message) {
                        message = rekeyed;
                        store.put(guildId, message);
                    }
                    messages.syncReactions(guildId, channelId, message.id(), activeTriggerKeys(message));
                } else {
                    messages.renderView(guildId, message);
                }
                registrar.register(guildId, message);
                rebuilt.add(message.id());
            } catch (PlatformException e) {
                failed.put(message.id(), e.getMessage());
                log.warn("Rebuild of {}/{} failed: {}", guildId, message.id(), e.getMessage());
            }
        }
        log.info("Rebuilt guild {}: {} rebuilt, {} missing, {} failed", guildId, rebuilt.size(), missing.size(),
                failed.size());
        return new RebuildReport(guildId, rebuilt, missing, failed);
    }

    /**
     * Re-key custom emoji triggers that the legacy layout stored by bare name,
     * using the guild's emoji list. Names the guild no longer has stay as they are.
     */
    private RoleMessage resolveLegacyKeys(String guildId, RoleMessage message) {
        RoleMessage updated = message;
        for (String key : message.triggers().keySet()) {
            if (!TriggerKeys.isBareEmojiName(key)) {
                continue;
            }
            String formatted = messages.resolveCustomEmoji(guildId, key);
            if (formatted != null && !updated.triggers().containsKey(formatted)) {
                updated = updated.withRenamedTrigger(key, formatted);
                log.info("Re-keyed legacy trigger {} to {} on {}/{}", key, formatted, guildId, message.id());
            } else if (formatted == null) {
                log.warn("Trigger {} on {}/{} names no emoji of the guild", key, guildId, message.id());
            }
        }
        return updated;
    }

    private static List<String> activeTriggerKeys(RoleMessage message) {
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, Binding> entry : message.triggers().entrySet()) {
            if (!entry.getValue().orphaned()) {
                keys.add(entry.getKey());
            }
        }
        return keys;
    }
}
