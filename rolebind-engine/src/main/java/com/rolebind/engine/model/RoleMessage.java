package com.rolebind.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persisted configuration attached to one platform message. Identity is
 * {@code (guildId, id)}; the guild is the store key and not part of the
 * record.
 * <p>
 * Instances are immutable. The store replaces whole messages, so every change
 * goes through one of the {@code with*} copies followed by a {@code put}.
 * <p>
 * For {@link TriggerStyle#MENU} messages {@code triggers} stays empty and the
 * effective trigger map is the union of the categories' bindings keyed by
 * role id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoleMessage(
        String id,
        String channelId,
        TriggerStyle style,
        Settings settings,
        MessageContent content,
        boolean stale,
        Map<String, Binding> triggers,
        Map<String, Category> categories) {

    public RoleMessage {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("message id is required");
        }
        style = style != null ? style : TriggerStyle.REACTION;
        settings = settings != null ? settings : Settings.DEFAULT;
        triggers = Collections.unmodifiableMap(new LinkedHashMap<>(triggers != null ? triggers : Map.of()));
        categories = Collections.unmodifiableMap(
                new LinkedHashMap<>(categories != null ? categories : Map.of()));
    }

    public static RoleMessage create(String id, String channelId, TriggerStyle style, MessageContent content) {
        return new RoleMessage(id, channelId, style, Settings.DEFAULT, content, false, Map.of(), Map.of());
    }

    // =========================================================================
    // Derived views
    // =========================================================================

    /**
     * Trigger key to binding, including orphaned bindings. Menu messages are
     * keyed by role id across all categories, in category order.
     */
    public Map<String, Binding> effectiveTriggers() {
        if (style != TriggerStyle.MENU) {
            return triggers;
        }
        Map<String, Binding> union = new LinkedHashMap<>();
        for (Category category : categories.values()) {
            for (Binding binding : category.bindings()) {
                union.putIfAbsent(binding.roleId(), binding);
            }
        }
        return union;
    }

    /** Role ids of every non-orphaned binding. */
    public Set<String> boundRoleIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Binding binding : effectiveTriggers().values()) {
            if (!binding.orphaned()) {
                ids.add(binding.roleId());
            }
        }
        return ids;
    }

    /** Role ids of every non-orphaned exclusive binding. */
    public Set<String> exclusiveRoleIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Binding binding : effectiveTriggers().values()) {
            if (!binding.orphaned() && binding.mode() == BindingMode.EXCLUSIVE) {
                ids.add(binding.roleId());
            }
        }
        return ids;
    }

    /** Trigger key bound to the role, or null. */
    public String triggerKeyOf(String roleId) {
        for (var entry : effectiveTriggers().entrySet()) {
            if (entry.getValue().roleId().equals(roleId)) {
                return entry.getKey();
            }
        }
        return null;
    }

    /** Id of the category holding the role, or null. */
    public String categoryIdOf(String roleId) {
        for (var entry : categories.entrySet()) {
            for (Binding binding : entry.getValue().bindings()) {
                if (binding.roleId().equals(roleId)) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    /**
     * Non-orphaned role ids sharing the unique scope of the given role: the whole
     * message, or the role's category for menus.
     */
    public Set<String> uniqueScopeOf(String roleId) {
        if (style != TriggerStyle.MENU) {
            return boundRoleIds();
        }
        String categoryId = categoryIdOf(roleId);
        Set<String> ids = new LinkedHashSet<>();
        if (categoryId == null) {
            return ids;
        }
        for (Binding binding : categories.get(categoryId).bindings()) {
            if (!binding.orphaned()) {
                ids.add(binding.roleId());
            }
        }
        return ids;
    }

    /** Number of triggers, counting menu options across categories. */
    public int triggerCount() {
        return effectiveTriggers().size();
    }

    // =========================================================================
    // Copies
    // =========================================================================

    public RoleMessage withId(String newId) {
        return new RoleMessage(newId, channelId, style, settings, content, stale, triggers, categories);
    }

    public RoleMessage withChannelId(String newChannelId) {
        return new RoleMessage(id, newChannelId, style, settings, content, stale, triggers, categories);
    }

    public RoleMessage withSettings(Settings newSettings) {
        return new RoleMessage(id, channelId, style, newSettings, content, stale, triggers, categories);
    }

    public RoleMessage withContent(MessageContent newContent) {
        return new RoleMessage(id, channelId, style, settings, newContent, stale, triggers, categories);
    }

    public RoleMessage withStale(boolean value) {
        return new RoleMessage(id, channelId, style, settings, content, value, triggers, categories);
    }

    public RoleMessage withTrigger(String key, Binding binding) {
        Map<String, Binding> next = new LinkedHashMap<>(triggers);
        next.put(key, binding);
        return new RoleMessage(id, channelId, style, settings, content, stale, next, categories);
    }

    /** Move a binding to a new trigger key, keeping its position. */
    public RoleMessage withRenamedTrigger(String oldKey, String newKey) {
        Map<String, Binding> next = new LinkedHashMap<>();
        for (var entry : triggers.entrySet()) {
            next.put(entry.getKey().equals(oldKey) ? newKey : entry.getKey(), entry.getValue());
        }
        return new RoleMessage(id, channelId, style, settings, content, stale, next, categories);
    }

    public RoleMessage withoutTrigger(String key) {
        Map<String, Binding> next = new LinkedHashMap<>(triggers);
        next.remove(key);
        return new RoleMessage(id, channelId, style, settings, content, stale, next, categories);
    }

    public RoleMessage withCategory(String categoryId, Category category) {
        Map<String, Category> next = new LinkedHashMap<>(categories);
        next.put(categoryId, category);
        return new RoleMessage(id, channelId, style, settings, content, stale, triggers, next);
    }

    public RoleMessage withoutCategory(String categoryId) {
        Map<String, Category> next = new LinkedHashMap<>(categories);
        next.remove(categoryId);
        return new RoleMessage(id, channelId, style, settings, content, stale, triggers, next);
    }

    /**
     * Replace the binding of a role wherever it lives (trigger map or category).
     */
    public RoleMessage replaceBinding(String roleId, Binding replacement) {
        return mapBindings(roleId, replacement);
    }

    /**
     * Remove the binding of a role wherever it lives.
     */
    public RoleMessage removeBinding(String roleId) {
        return mapBindings(roleId, null);
    }

    private RoleMessage mapBindings(String roleId, Binding replacement) {
        Map<String, Binding> nextTriggers = new LinkedHashMap<>();
        for (var entry : triggers.entrySet()) {
            if (!entry.getValue().roleId().equals(roleId)) {
                nextTriggers.put(entry.getKey(), entry.getValue());
            } else if (replacement != null) {
                nextTriggers.put(entry.getKey(), replacement);
            }
        }
        Map<String, Category> nextCategories = new LinkedHashMap<>();
        for (var entry : categories.entrySet()) {
            List<Binding> bindings = new ArrayList<>();
            for (Binding binding : entry.getValue().bindings()) {
                if (!binding.roleId().equals(roleId)) {
                    bindings.add(binding);
                } else if (replacement != null) {
                    bindings.add(replacement);
                }
            }
            nextCategories.put(entry.getKey(), entry.getValue().withBindings(bindings));
        }
        return new RoleMessage(id, channelId, style, settings, content, stale, nextTriggers, nextCategories);
    }
}
