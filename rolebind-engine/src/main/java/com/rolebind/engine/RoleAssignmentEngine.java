package com.rolebind.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rolebind.engine.dispatch.ActivationHandler;
import com.rolebind.engine.dispatch.ComponentIdentities;
import com.rolebind.engine.dispatch.ComponentIdentity;
import com.rolebind.engine.dispatch.DispatchRegistrar;
import com.rolebind.engine.dispatch.InteractionRouter;
import com.rolebind.engine.model.Binding;
import com.rolebind.engine.model.Category;
import com.rolebind.engine.model.MessageContent;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.Settings;
import com.rolebind.engine.model.TriggerKeys;
import com.rolebind.engine.model.TriggerStyle;
import com.rolebind.engine.platform.GuildRole;
import com.rolebind.engine.platform.MessagePlatform;
import com.rolebind.engine.platform.MutationStatus;
import com.rolebind.engine.platform.RolePlatform;
import com.rolebind.engine.reconcile.RebuildReport;
import com.rolebind.engine.reconcile.ReconcileReport;
import com.rolebind.engine.reconcile.Reconciler;
import com.rolebind.engine.resolve.ActivationKind;
import com.rolebind.engine.resolve.AssignmentResolver;
import com.rolebind.engine.resolve.Outcome;
import com.rolebind.engine.resolve.RejectReason;
import com.rolebind.engine.store.BindingStore;
import com.rolebind.engine.store.ConfigMigrator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single entry point of the role assignment engine: activations coming from
 * the platform, configuration changes coming from administrators, and
 * reconciliation.
 * <p>
 * The engine keeps no per-member or per-message lock. Each activation works on
 * a freshly fetched role set and relies on idempotent platform mutations;
 * concurrent activations are last-writer-wins.
 */
@Slf4j
public class RoleAssignmentEngine implements ActivationHandler {

    /** Discord allows 25 components per message and 25 options per select menu. */
    public static final int MAX_BUTTONS = 25;
    public static final int MAX_MENU_OPTIONS = 25;
    /** One action row per category select menu, five rows per message. */
    public static final int MAX_MENU_CATEGORIES = 5;

    static final MessageContent DEFAULT_CONTENT = new MessageContent("Role Selection",
            "Pick a role below.", null);

    private final BindingStore store;
    private final RolePlatform roles;
    private final MessagePlatform messages;
    private final AssignmentResolver resolver = new AssignmentResolver();
    private final DispatchRegistrar registrar;
    private final Reconciler reconciler;
    private final Clock clock;
    private final ObjectMapper exportMapper;

    public RoleAssignmentEngine(BindingStore store, RolePlatform roles, MessagePlatform messages,
            InteractionRouter router) {
        this(store, roles, messages, router, Clock.systemUTC());
    }

    public RoleAssignmentEngine(BindingStore store, RolePlatform roles, MessagePlatform messages,
            InteractionRouter router, Clock clock) {
        this.store = store;
        this.roles = roles;
        this.messages = messages;
        this.clock = clock;
        this.registrar = new DispatchRegistrar(store, router, this);
        this.reconciler = new Reconciler(store, roles, messages, registrar);
        this.exportMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public DispatchRegistrar getRegistrar() {
        return registrar;
    }

    public BindingStore getStore() {
        return store;
    }

    // =========================================================================
    // Activation
    // =========================================================================

    @Override
    public ActivationResult activate(String guildId, String messageId, String triggerKey, String memberId,
            ActivationKind kind) {
        RoleMessage message = store.getMessage(guildId, messageId);
        if (message == null || message.stale()) {
            return ActivationResult.rejected(Outcome.rejected(RejectReason.MISSING_BINDING), message);
        }
        if (!message.effectiveTriggers().containsKey(triggerKey)) {
            message = adoptLegacyKey(guildId, message, triggerKey);
        }
        Binding binding = message.effectiveTriggers().get(triggerKey);
        if (binding == null || binding.orphaned()) {
            log.debug("No usable binding for trigger {} on {}/{}", triggerKey, guildId, messageId);
            return ActivationResult.rejected(Outcome.rejected(RejectReason.MISSING_BINDING), message);
        }
        RoleMessage target = message;
        return resolveAndApply(guildId, memberId, target,
                memberRoles -> resolver.resolve(memberRoles, store.get(guildId), target, triggerKey, kind));
    }

    /**
     * Re-key a custom emoji binding still stored under its bare name by the
     * legacy layout. Returns the message unchanged when there is none.
     */
    private RoleMessage adoptLegacyKey(String guildId, RoleMessage message, String triggerKey) {
        String name = TriggerKeys.customEmojiName(triggerKey);
        if (message.style() != TriggerStyle.REACTION || name == null || !message.triggers().containsKey(name)) {
            return message;
        }
        RoleMessage updated = message.withRenamedTrigger(name, triggerKey);
        persist(guildId, updated);
        log.info("Re-keyed legacy trigger {} to {} on {}/{}", name, triggerKey, guildId, message.id());
        return updated;
    }

    @Override
    public ActivationResult selectMenu(String guildId, String messageId, String categoryId, String memberId,
            List<String> desiredRoleIds) {
        RoleMessage message = store.getMessage(guildId, messageId);
        if (message == null || message.stale() || message.style() != TriggerStyle.MENU
                || !message.categories().containsKey(categoryId)) {
            return ActivationResult.rejected(Outcome.rejected(RejectReason.MISSING_BINDING), message);
        }
        return resolveAndApply(guildId, memberId, message,
                memberRoles -> resolver.resolveMenu(memberRoles, store.get(guildId), message, categoryId,
                        desiredRoleIds));
    }

    private ActivationResult resolveAndApply(String guildId, String memberId, RoleMessage message,
            Function<Set<String>, Outcome> resolve) {
        Set<String> memberRoles;
        try {
            memberRoles = roles.fetchMemberRoles(guildId, memberId);
        } catch (PlatformException e) {
            log.warn("Could not fetch member {} in guild {}: {}", memberId, guildId, e.getMessage());
            return new ActivationResult(Outcome.Applied.empty(), List.of(new MutationFailure(null,
                    MutationFailure.Operation.FETCH_MEMBER, e.getStatus(), e.getMessage())), message);
        }

        Outcome outcome = resolve.apply(memberRoles);
        if (outcome instanceof Outcome.Rejected rejected) {
            log.debug("Activation by {} on {}/{} rejected: {}", memberId, guildId, message.id(), rejected.reason());
            return ActivationResult.rejected(rejected, message);
        }
        Outcome.Applied applied = (Outcome.Applied) outcome;
        List<MutationFailure> failures = new ArrayList<>();
        for (String roleId : applied.remove()) {
            MutationStatus status = mutate(() -> roles.removeRole(guildId, memberId, roleId));
            if (!status.ok()) {
                failures.add(new MutationFailure(roleId, MutationFailure.Operation.REMOVE, status,
                        "Removing role " + roleId + " failed: " + status));
            }
        }
        for (String roleId : applied.add()) {
            MutationStatus status = mutate(() -> roles.addRole(guildId, memberId, roleId));
            if (!status.ok()) {
                failures.add(new MutationFailure(roleId, MutationFailure.Operation.ADD, status,
                        "Adding role " + roleId + " failed: " + status));
                if (status == MutationStatus.NOT_FOUND) {
                    markOrphaned(guildId, message.id(), roleId);
                }
            }
        }
        if (!failures.isEmpty()) {
            log.warn("Activation by {} on {}/{} had {} failed mutations", memberId, guildId, message.id(),
                    failures.size());
        }
        return new ActivationResult(applied, failures, message);
    }

    private static MutationStatus mutate(Supplier<MutationStatus> call) {
        try {
            MutationStatus status = call.get();
            return status != null ? status : MutationStatus.FAILED;
        } catch (PlatformException e) {
            log.warn("Role mutation failed: {}", e.getMessage());
            return e.getStatus() != null ? e.getStatus() : MutationStatus.FAILED;
        }
    }

    private void markOrphaned(String guildId, String messageId, String roleId) {
        RoleMessage current = store.getMessage(guildId, messageId);
        if (current == null) {
            return;
        }
        String key = current.triggerKeyOf(roleId);
        if (key == null) {
            return;
        }
        Binding binding = current.effectiveTriggers().get(key);
        log.warn("Role {} no longer exists; marking its binding on {}/{} orphaned", roleId, guildId, messageId);
        persist(guildId, current.replaceBinding(roleId, binding.withOrphaned(true)));
    }

    // =========================================================================
    // Configuration: messages
    // =========================================================================

    /**
     * Post a new role message and start tracking it.
     */
    public RoleMessage createRoleMessage(String guildId, String channelId, TriggerStyle style,
            MessageContent content) {
        require(channelId != null && !channelId.isBlank(), "A channel is required");
        require(style != null, "A style is required");
        MessageContent text = content != null ? content : DEFAULT_CONTENT;
        String messageId = messages.createMessage(guildId, channelId, text);
        RoleMessage message = RoleMessage.create(messageId, channelId, style, text);
        persist(guildId, message);
        log.info("Created {} role message {}/{} in channel {}", style.key(), guildId, messageId, channelId);
        return message;
    }

    /**
     * Start tracking a message that already exists. A stale entry for the same
     * message is revived with its configuration.
     */
    public RoleMessage registerExistingMessage(String guildId, String channelId, String messageId,
            TriggerStyle style) {
        require(messageId != null && !messageId.isBlank(), "A message id is required");
        RoleMessage existing = store.getMessage(guildId, messageId);
        if (existing != null && !existing.stale()) {
            throw new ConfigurationException("Message " + messageId + " is already a role message");
        }
        String located = messages.locateMessage(guildId, channelId, messageId);
        if (located == null) {
            throw new ConfigurationException("Message " + messageId + " was not found");
        }
        RoleMessage message = existing != null
                ? existing.withStale(false).withChannelId(located)
                : RoleMessage.create(messageId, located, style != null ? style : TriggerStyle.REACTION, null);
        persist(guildId, message);
        syncView(guildId, message);
        registrar.register(guildId, message);
        log.info("Registered existing message {}/{} as {}", guildId, messageId, message.style().key());
        return message;
    }

    /**
     * Stop tracking a role message. The platform message itself is left alone.
     */
    public void deleteRoleMessage(String guildId, String messageId) {
        requireMessage(guildId, messageId);
        try {
            store.deleteMessage(guildId, messageId);
        } catch (PersistenceException e) {
            log.warn("Deleting {}/{} not persisted yet: {}", guildId, messageId, e.getMessage());
        }
        registrar.unregister(guildId, messageId);
        log.info("Deleted role message {}/{}", guildId, messageId);
    }

    public List<RoleMessage> list(String guildId) {
        return store.get(guildId);
    }

    // =========================================================================
    // Configuration: reaction and button triggers
    // =========================================================================

    public RoleMessage addBinding(String guildId, String messageId, String triggerKey, Binding binding) {
        RoleMessage active = requireActive(guildId, messageId);
        require(active.style() != TriggerStyle.MENU, "Menu messages take roles through categories");
        require(triggerKey != null && !triggerKey.isBlank(), "A trigger is required");
        String replacedKey = orphanedKeyOf(active, binding.roleId());
        RoleMessage message = replacedKey != null ? active.removeBinding(binding.roleId()) : active;
        require(!message.triggers().containsKey(triggerKey), "Trigger " + triggerKey + " is already bound");
        requireUnbound(message, binding.roleId());
        if (message.style() == TriggerStyle.BUTTON) {
            require(message.triggers().size() < MAX_BUTTONS,
                    "A message can hold at most " + MAX_BUTTONS + " buttons");
            requireFits(new ComponentIdentity(guildId, messageId, ComponentIdentity.Kind.BUTTON, triggerKey));
        }
        requireAssignable(guildId, binding.roleId());

        RoleMessage updated = message.withTrigger(triggerKey, binding.withOrphaned(false));
        persist(guildId, updated);
        if (updated.style() == TriggerStyle.REACTION && replacedKey != null && !replacedKey.equals(triggerKey)) {
            bestEffort(guildId, messageId,
                    () -> messages.clearReaction(guildId, updated.channelId(), messageId, replacedKey));
        }
        if (updated.style() == TriggerStyle.REACTION) {
            bestEffort(guildId, messageId,
                    () -> messages.addReaction(guildId, updated.channelId(), messageId, triggerKey));
        } else {
            syncView(guildId, updated);
        }
        registrar.register(guildId, updated);
        log.info("Bound {} to role {} ({}) on {}/{}", triggerKey, binding.roleId(), binding.mode().key(), guildId,
                messageId);
        return updated;
    }

    public RoleMessage removeBinding(String guildId, String messageId, String triggerKey) {
        RoleMessage message = requireActive(guildId, messageId);
        require(message.triggers().containsKey(triggerKey), "Trigger " + triggerKey + " is not bound");

        RoleMessage updated = message.withoutTrigger(triggerKey);
        persist(guildId, updated);
        if (updated.style() == TriggerStyle.REACTION) {
            bestEffort(guildId, messageId,
                    () -> messages.clearReaction(guildId, updated.channelId(), messageId, triggerKey));
        } else {
            syncView(guildId, updated);
        }
        registrar.register(guildId, updated);
        log.info("Unbound {} on {}/{}", triggerKey, guildId, messageId);
        return updated;
    }

    // =========================================================================
    // Configuration: menu categories
    // =========================================================================

    public RoleMessage addCategory(String guildId, String messageId, String name, String emoji,
            String description) {
        RoleMessage message = requireMenu(guildId, messageId);
        require(name != null && !name.isBlank(), "A category name is required");
        String categoryId = Category.slug(name);
        require(!message.categories().containsKey(categoryId), "Category " + name + " already exists");
        require(message.categories().size() < MAX_MENU_CATEGORIES,
                "A menu can hold at most " + MAX_MENU_CATEGORIES + " categories");
        requireFits(new ComponentIdentity(guildId, messageId, ComponentIdentity.Kind.MENU, categoryId));

        RoleMessage updated = message.withCategory(categoryId, new Category(name.trim(), emoji, description,
                List.of()));
        persist(guildId, updated);
        log.info("Added category {} to {}/{}", categoryId, guildId, messageId);
        return updated;
    }

    public RoleMessage removeCategory(String guildId, String messageId, String name) {
        RoleMessage message = requireMenu(guildId, messageId);
        String categoryId = requireCategory(message, name);

        RoleMessage updated = message.withoutCategory(categoryId);
        persist(guildId, updated);
        syncView(guildId, updated);
        registrar.register(guildId, updated);
        log.info("Removed category {} from {}/{}", categoryId, guildId, messageId);
        return updated;
    }

    public RoleMessage addMenuBinding(String guildId, String messageId, String categoryName, Binding binding) {
        RoleMessage menu = requireMenu(guildId, messageId);
        String categoryId = requireCategory(menu, categoryName);
        RoleMessage message = orphanedKeyOf(menu, binding.roleId()) != null
                ? menu.removeBinding(binding.roleId())
                : menu;
        Category category = message.categories().get(categoryId);
        requireUnbound(message, binding.roleId());
        require(category.bindings().size() < MAX_MENU_OPTIONS,
                "A category can hold at most " + MAX_MENU_OPTIONS + " roles");
        requireAssignable(guildId, binding.roleId());

        List<Binding> bindings = new ArrayList<>(category.bindings());
        bindings.add(binding.withOrphaned(false));
        RoleMessage updated = message.withCategory(categoryId, category.withBindings(bindings));
        persist(guildId, updated);
        syncView(guildId, updated);
        registrar.register(guildId, updated);
        log.info("Added role {} ({}) to category {} of {}/{}", binding.roleId(), binding.mode().key(), categoryId,
                guildId, messageId);
        return updated;
    }

    public RoleMessage removeMenuBinding(String guildId, String messageId, String roleId) {
        RoleMessage message = requireMenu(guildId, messageId);
        require(message.categoryIdOf(roleId) != null, "Role " + roleId + " is not on this menu");

        RoleMessage updated = message.removeBinding(roleId);
        persist(guildId, updated);
        syncView(guildId, updated);
        registrar.register(guildId, updated);
        log.info("Removed role {} from menu {}/{}", roleId, guildId, messageId);
        return updated;
    }

    // =========================================================================
    // Configuration: settings
    // =========================================================================

    /**
     * @param maxRoles        new cap, or null to leave unchanged
     * @param addRequiredRole role to add to the required set, nullable
     * @param clearRequired   empty the required set before adding
     */
    public RoleMessage updateSettings(String guildId, String messageId, Integer maxRoles, String addRequiredRole,
            boolean clearRequired) {
        RoleMessage message = requireMessage(guildId, messageId);
        require(maxRoles == null || maxRoles >= 1, "max roles must be at least 1");
        if (addRequiredRole != null) {
            require(findRole(guildId, addRequiredRole) != null, "Role " + addRequiredRole + " does not exist");
        }
        Settings settings = message.settings();
        if (clearRequired) {
            settings = settings.withoutRequiredRoles();
        }
        if (addRequiredRole != null) {
            settings = settings.withRequiredRole(addRequiredRole);
        }
        if (maxRoles != null) {
            settings = settings.withMaxRoles(maxRoles);
        }
        RoleMessage updated = message.withSettings(settings);
        persist(guildId, updated);
        log.info("Updated settings of {}/{}: maxRoles={}, requiredRoles={}", guildId, messageId,
                settings.maxRoles(), settings.requiredRoles());
        return updated;
    }

    /** Remove the role cap of a message. */
    public RoleMessage clearMaxRoles(String guildId, String messageId) {
        RoleMessage message = requireMessage(guildId, messageId);
        RoleMessage updated = message.withSettings(message.settings().withMaxRoles(null));
        persist(guildId, updated);
        return updated;
    }

    /**
     * Change the embed text of a role message and re-render it. Null arguments
     * keep the current value.
     */
    public RoleMessage editContent(String guildId, String messageId, String title, String description,
            String color) {
        RoleMessage message = requireActive(guildId, messageId);
        require(title != null || description != null || color != null,
                "Give a new title, description or color");
        MessageContent current = message.content() != null ? message.content() : DEFAULT_CONTENT;
        MessageContent content = new MessageContent(
                title != null ? title : current.title(),
                description != null ? description : current.description(),
                color != null ? color : current.color());
        RoleMessage updated = message.withContent(content);
        persist(guildId, updated);
        bestEffort(guildId, messageId, () -> messages.renderView(guildId, updated));
        log.info("Edited content of {}/{}", guildId, messageId);
        return updated;
    }

    // =========================================================================
    // Clone and export
    // =========================================================================

    /**
     * Post a copy of a role message in another channel, with the same settings
     * and live bindings. Works for stale sources too.
     */
    public RoleMessage clone(String guildId, String messageId, String targetChannelId) {
        RoleMessage source = requireMessage(guildId, messageId);
        require(targetChannelId != null && !targetChannelId.isBlank(), "A target channel is required");

        MessageContent text = source.content() != null ? source.content() : DEFAULT_CONTENT;
        String newId = messages.createMessage(guildId, targetChannelId, text);
        RoleMessage copy = withoutOrphans(source)
                .withId(newId)
                .withChannelId(targetChannelId)
                .withContent(text)
                .withStale(false);
        persist(guildId, copy);
        syncView(guildId, copy);
        registrar.register(guildId, copy);
        log.info("Cloned {}/{} to {} in channel {}", guildId, messageId, newId, targetChannelId);
        return copy;
    }

    /**
     * Pretty-printed JSON of the guild's configuration.
     */
    public String export(String guildId) {
        ExportDocument document = new ExportDocument(guildId, Instant.now(clock), ConfigMigrator.CURRENT_VERSION,
                store.get(guildId));
        try {
            return exportMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new RoleBindException("Failed to export guild " + guildId + ": " + e.getMessage(), e);
        }
    }

    public record ExportDocument(String guildId, Instant exportedAt, int version, List<RoleMessage> messages) {
    }

    // =========================================================================
    // Reconciliation
    // =========================================================================

    public ReconcileReport verify(String guildId) {
        return reconciler.verify(guildId);
    }

    public ReconcileReport cleanup(String guildId) {
        return reconciler.cleanup(guildId);
    }

    public RebuildReport rebuild(String guildId) {
        return reconciler.rebuild(guildId);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void persist(String guildId, RoleMessage message) {
        try {
            store.put(guildId, message);
        } catch (PersistenceException e) {
            log.warn("Change to {}/{} kept in memory, not persisted yet: {}", guildId, message.id(),
                    e.getMessage());
        }
    }

    private void syncView(String guildId, RoleMessage message) {
        if (message.style() == TriggerStyle.REACTION) {
            List<String> emojis = new ArrayList<>();
            for (Map.Entry<String, Binding> entry : message.triggers().entrySet()) {
                if (!entry.getValue().orphaned()) {
                    emojis.add(entry.getKey());
                }
            }
            bestEffort(guildId, message.id(),
                    () -> messages.syncReactions(guildId, message.channelId(), message.id(), emojis));
        } else {
            bestEffort(guildId, message.id(), () -> messages.renderView(guildId, message));
        }
    }

    private static void bestEffort(String guildId, String messageId, Runnable action) {
        try {
            action.run();
        } catch (PlatformException e) {
            log.warn("Could not update message {}/{} on the platform: {}", guildId, messageId, e.getMessage());
        }
    }

    private static RoleMessage withoutOrphans(RoleMessage message) {
        RoleMessage result = message;
        for (Binding binding : message.effectiveTriggers().values()) {
            if (binding.orphaned()) {
                result = result.removeBinding(binding.roleId());
            }
        }
        return result;
    }

    private RoleMessage requireMessage(String guildId, String messageId) {
        RoleMessage message = messageId != null ? store.getMessage(guildId, messageId) : null;
        if (message == null) {
            throw new ConfigurationException("Message " + messageId + " is not a role message");
        }
        return message;
    }

    private RoleMessage requireActive(String guildId, String messageId) {
        RoleMessage message = requireMessage(guildId, messageId);
        require(!message.stale(), "Message " + messageId + " no longer exists; run cleanup or delete it");
        return message;
    }

    private RoleMessage requireMenu(String guildId, String messageId) {
        RoleMessage message = requireActive(guildId, messageId);
        require(message.style() == TriggerStyle.MENU, "Message " + messageId + " is not a menu");
        return message;
    }

    private static String requireCategory(RoleMessage message, String name) {
        require(name != null && !name.isBlank(), "A category name is required");
        String categoryId = Category.slug(name);
        require(message.categories().containsKey(categoryId), "Category " + name + " does not exist");
        return categoryId;
    }

    /**
     * Trigger key of the role's binding if that binding is orphaned. A role
     * re-created under the same id may be bound again without a cleanup first.
     */
    private static String orphanedKeyOf(RoleMessage message, String roleId) {
        String key = message.triggerKeyOf(roleId);
        return key != null && message.effectiveTriggers().get(key).orphaned() ? key : null;
    }

    private static void requireUnbound(RoleMessage message, String roleId) {
        require(message.triggerKeyOf(roleId) == null, "Role " + roleId + " is already bound on this message");
    }

    private static void requireFits(ComponentIdentity identity) {
        require(ComponentIdentities.fits(identity),
                "Trigger is too long to be used as a component id (" + identity.value().length() + " > "
                        + ComponentIdentities.MAX_LENGTH + ")");
    }

    private void requireAssignable(String guildId, String roleId) {
        GuildRole role = findRole(guildId, roleId);
        require(role != null, "Role " + roleId + " does not exist");
        require(!role.managed(), "Role " + role.name() + " is managed by an integration");
        require(role.position() < roles.selfTopRolePosition(guildId),
                "Role " + role.name() + " is at or above my highest role");
    }

    private GuildRole findRole(String guildId, String roleId) {
        for (GuildRole role : roles.fetchGuildRoles(guildId)) {
            if (role.id().equals(roleId)) {
                return role;
            }
        }
        return null;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }
}
