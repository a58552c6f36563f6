package com.rolebind.app;

import com.rolebind.engine.PlatformException;
import com.rolebind.engine.model.MessageContent;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.platform.GuildRole;
import com.rolebind.engine.platform.MessagePlatform;
import com.rolebind.engine.platform.MutationStatus;
import com.rolebind.engine.platform.RolePlatform;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single-guild platform fake for command tests.
 */
public class FakePlatform implements RolePlatform, MessagePlatform {

    public final Map<String, GuildRole> roles = new LinkedHashMap<>();
    public final Map<String, Set<String>> members = new HashMap<>();
    /** message id to channel id. */
    public final Map<String, String> messages = new LinkedHashMap<>();
    public final Map<String, MessageContent> posted = new HashMap<>();
    public final List<RoleMessage> rendered = new ArrayList<>();
    public int selfTop = 50;
    private long nextId = 5000;

    public FakePlatform role(String id, String name, int position) {
        roles.put(id, new GuildRole(id, name, position, false));
        return this;
    }

    @Override
    public Set<String> fetchMemberRoles(String guildId, String memberId) {
        Set<String> held = members.get(memberId);
        if (held == null) {
            throw new PlatformException("Unknown member " + memberId, MutationStatus.NOT_FOUND);
        }
        return new LinkedHashSet<>(held);
    }

    @Override
    public MutationStatus addRole(String guildId, String memberId, String roleId) {
        if (!roles.containsKey(roleId)) {
            return MutationStatus.NOT_FOUND;
        }
        members.computeIfAbsent(memberId, k -> new LinkedHashSet<>()).add(roleId);
        return MutationStatus.OK;
    }

    @Override
    public MutationStatus removeRole(String guildId, String memberId, String roleId) {
        members.computeIfAbsent(memberId, k -> new LinkedHashSet<>()).remove(roleId);
        return MutationStatus.OK;
    }

    @Override
    public List<GuildRole> fetchGuildRoles(String guildId) {
        return new ArrayList<>(roles.values());
    }

    @Override
    public int selfTopRolePosition(String guildId) {
        return selfTop;
    }

    @Override
    public String locateMessage(String guildId, String channelIdHint, String messageId) {
        return messages.get(messageId);
    }

    @Override
    public String createMessage(String guildId, String channelId, MessageContent content) {
        String id = String.valueOf(nextId++);
        messages.put(id, channelId);
        posted.put(id, content);
        return id;
    }

    @Override
    public void renderView(String guildId, RoleMessage message) {
        rendered.add(message);
    }

    @Override
    public void syncReactions(String guildId, String channelId, String messageId, List<String> emojis) {
    }

    @Override
    public void addReaction(String guildId, String channelId, String messageId, String emoji) {
    }

    @Override
    public void clearReaction(String guildId, String channelId, String messageId, String emoji) {
    }

    @Override
    public void removeUserReaction(String guildId, String channelId, String messageId, String emoji,
            String userId) {
    }
}
