package com.rolebind.engine.dispatch;

import com.rolebind.engine.model.Category;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.TriggerStyle;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Derives component identities from configuration and parses them back.
 * <p>
 * Format: {@code rb:<guildId>:<messageId>:<b|m>:<base64url(key)>}. The
 * mapping is a pure function of the role message, so re-deriving after a
 * restart yields the ids of the components already posted.
 */
public final class ComponentIdentities {

    public static final String PREFIX = "rb";
    /** Discord custom_id limit. */
    public static final int MAX_LENGTH = 100;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private ComponentIdentities() {
    }

    /**
     * One identity per button trigger, one per non-empty menu category. None
     * for reaction messages or stale messages.
     */
    public static List<ComponentIdentity> derive(String guildId, RoleMessage message) {
        List<ComponentIdentity> ids = new ArrayList<>();
        if (message.stale()) {
            return ids;
        }
        if (message.style() == TriggerStyle.BUTTON) {
            for (String key : message.triggers().keySet()) {
                ids.add(new ComponentIdentity(guildId, message.id(), ComponentIdentity.Kind.BUTTON, key));
            }
        } else if (message.style() == TriggerStyle.MENU) {
            for (Map.Entry<String, Category> entry : message.categories().entrySet()) {
                if (!entry.getValue().bindings().isEmpty()) {
                    ids.add(new ComponentIdentity(guildId, message.id(), ComponentIdentity.Kind.MENU,
                            entry.getKey()));
                }
            }
        }
        return ids;
    }

    static String format(ComponentIdentity identity) {
        return PREFIX + ":" + identity.guildId() + ":" + identity.messageId() + ":" + identity.kind().code()
                + ":" + ENCODER.encodeToString(identity.key().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Parse a custom id.
     *
     * @return the identity, or null if the id is not one of ours or is
     *         malformed
     */
    public static ComponentIdentity parse(String value) {
        if (value == null || !value.startsWith(PREFIX + ":")) {
            return null;
        }
        String[] parts = value.split(":", -1);
        if (parts.length != 5 || parts[1].isEmpty() || parts[2].isEmpty()) {
            return null;
        }
        ComponentIdentity.Kind kind = ComponentIdentity.Kind.fromCode(parts[3]);
        if (kind == null) {
            return null;
        }
        try {
            String key = new String(DECODER.decode(parts[4]), StandardCharsets.UTF_8);
            return key.isEmpty() ? null : new ComponentIdentity(parts[1], parts[2], kind, key);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** Whether the identity fits the platform's custom id limit. */
    public static boolean fits(ComponentIdentity identity) {
        return identity.value().length() <= MAX_LENGTH;
    }
}
