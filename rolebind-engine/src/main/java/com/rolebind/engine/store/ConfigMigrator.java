package com.rolebind.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolebind.engine.PersistenceException;
import com.rolebind.engine.model.Binding;
import com.rolebind.engine.model.BindingMode;
import com.rolebind.engine.model.Category;
import com.rolebind.engine.model.MessageContent;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.Settings;
import com.rolebind.engine.model.TriggerKeys;
import com.rolebind.engine.model.TriggerStyle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a persisted JSON tree into a {@link BindingDocument}, upgrading older
 * layouts on the way.
 * <p>
 * Layouts:
 * <ul>
 * <li>legacy (no {@code version}): {@code {guild: {message: {<emoji>: {role_id,
 * mode, label} | <role_id>, settings: {...}}}}}</li>
 * <li>1: {@code {version: 1, guilds: {guild: {message: RoleMessage}}}}</li>
 * </ul>
 */
@Slf4j
public final class ConfigMigrator {

    public static final int CURRENT_VERSION = 1;

    private static final String SETTINGS_KEY = "settings";
    private static final Pattern HEX_COLOR = Pattern.compile("#?[0-9a-fA-F]{6}");

    private ConfigMigrator() {
    }

    /**
     * @param root parsed file content, nullable
     * @throws PersistenceException for unknown future versions or malformed
     *                              content
     */
    public static BindingDocument migrate(JsonNode root, ObjectMapper mapper) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return BindingDocument.empty();
        }
        if (!root.isObject()) {
            throw new PersistenceException("Binding document root must be an object");
        }
        JsonNode version = root.get("version");
        if (version == null) {
            BindingDocument upgraded = fromLegacy(root);
            log.info("Migrated legacy binding document ({} guilds)", upgraded.guilds().size());
            return upgraded;
        }
        if (!version.canConvertToInt() || version.asInt() < 1) {
            throw new PersistenceException("Invalid binding document version: " + version);
        }
        if (version.asInt() > CURRENT_VERSION) {
            throw new PersistenceException("Unsupported binding document version " + version.asInt()
                    + " (this build reads up to " + CURRENT_VERSION + ")");
        }
        try {
            return mapper.treeToValue(root, BindingDocument.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PersistenceException("Malformed binding document: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // Legacy layout
    // =========================================================================

    static BindingDocument fromLegacy(JsonNode root) {
        Map<String, Map<String, RoleMessage>> guilds = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> guild = it.next();
            if (!guild.getValue().isObject()) {
                log.warn("Skipping legacy guild entry {}: not an object", guild.getKey());
                continue;
            }
            Map<String, RoleMessage> messages = new LinkedHashMap<>();
            for (Iterator<Map.Entry<String, JsonNode>> mit = guild.getValue().fields(); mit.hasNext();) {
                Map.Entry<String, JsonNode> message = mit.next();
                if (!message.getValue().isObject()) {
                    log.warn("Skipping legacy message {}/{}: not an object", guild.getKey(), message.getKey());
                    continue;
                }
                RoleMessage migrated;
                try {
                    migrated = legacyMessage(message.getKey(), message.getValue());
                } catch (IllegalArgumentException e) {
                    throw new PersistenceException("Malformed legacy message " + guild.getKey() + "/"
                            + message.getKey() + ": " + e.getMessage(), e);
                }
                messages.put(message.getKey(), migrated);
                logFollowUps(guild.getKey(), migrated);
            }
            if (!messages.isEmpty()) {
                guilds.put(guild.getKey(), messages);
            }
        }
        return new BindingDocument(CURRENT_VERSION, guilds);
    }

    /**
     * Migrated interactive messages still show components with the old custom
     * ids, and custom emoji triggers are keyed by bare name. Both are repaired
     * by {@code /reaction rebuild}.
     */
    private static void logFollowUps(String guildId, RoleMessage message) {
        if (!needsRebuild(message)) {
            return;
        }
        if (message.style().interactive()) {
            log.warn("Migrated {} message {}/{} still carries old component ids; run /reaction rebuild "
                    + "to make its components respond", message.style().key(), guildId, message.id());
            return;
        }
        List<String> byName = bareEmojiKeys(message);
        if (!byName.isEmpty()) {
            log.warn("Migrated message {}/{} keys custom emojis {} by name; run /reaction rebuild to resolve "
                    + "them", guildId, message.id(), byName);
        }
    }

    static boolean needsRebuild(RoleMessage message) {
        return message.style().interactive() || !bareEmojiKeys(message).isEmpty();
    }

    /** Reaction trigger keys that name a custom emoji without its id. */
    static List<String> bareEmojiKeys(RoleMessage message) {
        List<String> keys = new ArrayList<>();
        if (message.style() != TriggerStyle.REACTION) {
            return keys;
        }
        for (String key : message.triggers().keySet()) {
            if (TriggerKeys.isBareEmojiName(key)) {
                keys.add(key);
            }
        }
        return keys;
    }

    private static RoleMessage legacyMessage(String messageId, JsonNode node) {
        JsonNode settings = node.path(SETTINGS_KEY);
        TriggerStyle style = TriggerStyle.fromKey(text(settings.get("style")));

        Map<String, Binding> triggers = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (SETTINGS_KEY.equals(entry.getKey())) {
                continue;
            }
            triggers.put(entry.getKey(), legacyBinding(entry.getValue()));
        }

        Map<String, Category> categories = new LinkedHashMap<>();
        JsonNode legacyCategories = settings.path("categories");
        for (Iterator<Map.Entry<String, JsonNode>> it = legacyCategories.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode cat = entry.getValue();
            List<Binding> bindings = new ArrayList<>();
            for (JsonNode role : cat.path("roles")) {
                bindings.add(legacyBinding(role));
            }
            String name = text(cat.get("name"));
            categories.put(entry.getKey(), new Category(name != null ? name : entry.getKey(),
                    text(cat.get("emoji")), text(cat.get("description")), bindings));
        }
        if (style == TriggerStyle.MENU) {
            triggers.clear();
        }

        return new RoleMessage(messageId, null, style, legacySettings(settings), legacyContent(settings),
                false, triggers, categories);
    }

    /**
     * A legacy binding is either a bare role id or {@code {role_id, mode, label,
     * emoji, description}}.
     */
    private static Binding legacyBinding(JsonNode node) {
        if (node.isValueNode()) {
            return Binding.of(node.asText(), BindingMode.NORMAL);
        }
        return new Binding(text(node.get("role_id")), BindingMode.fromKey(text(node.get("mode"))),
                text(node.get("label")), text(node.get("emoji")), text(node.get("description")), false);
    }

    private static Settings legacySettings(JsonNode settings) {
        Set<String> required = new LinkedHashSet<>();
        JsonNode requiredNode = settings.path("required_roles");
        if (requiredNode.isArray()) {
            requiredNode.forEach(r -> required.add(r.asText()));
        } else if (requiredNode.isValueNode() && !requiredNode.isNull()) {
            required.add(requiredNode.asText());
        }
        Integer maxRoles = null;
        JsonNode max = settings.get("max_roles");
        if (max == null || max.isNull()) {
            max = settings.get("limit");
        }
        if (max != null && max.canConvertToInt() && max.asInt() > 0) {
            maxRoles = max.asInt();
        }
        return new Settings(required, maxRoles);
    }

    private static MessageContent legacyContent(JsonNode settings) {
        JsonNode embed = settings.get("embed_data");
        if (embed == null || !embed.isObject()) {
            return null;
        }
        String color = text(embed.get("color"));
        if (color != null) {
            color = HEX_COLOR.matcher(color).matches()
                    ? (color.startsWith("#") ? color : "#" + color).toUpperCase()
                    : null;
        }
        return new MessageContent(text(embed.get("title")), text(embed.get("description")), color);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }
}
