package com.rolebind.discord;

import com.rolebind.engine.PlatformException;
import com.rolebind.engine.model.MessageContent;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.TriggerStyle;
import com.rolebind.engine.platform.GuildRole;
import com.rolebind.engine.platform.MessagePlatform;
import com.rolebind.engine.platform.MutationStatus;
import com.rolebind.engine.platform.RolePlatform;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.UserSnowflake;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.entities.emoji.RichCustomEmoji;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.interactions.components.ActionRow;
import net.dv8tion.jda.api.utils.messages.MessageEditBuilder;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * JDA implementation of both platform ports.
 * <p>
 * Calls block with {@code complete()}; callers run them on the worker
 * executor, never on the JDA event thread.
 */
@Slf4j
public class JdaPlatform implements RolePlatform, MessagePlatform {

    private final JDA jda;

    public JdaPlatform(JDA jda) {
        this.jda = jda;
    }

    // =========================================================================
    // RolePlatform
    // =========================================================================

    @Override
    public Set<String> fetchMemberRoles(String guildId, String memberId) {
        Guild guild = guild(guildId);
        try {
            Member member = guild.retrieveMemberById(memberId).useCache(false).complete();
            Set<String> ids = new LinkedHashSet<>();
            for (Role role : member.getRoles()) {
                ids.add(role.getId());
            }
            return ids;
        } catch (RuntimeException e) {
            throw DiscordErrors.translate("Failed to fetch member " + memberId, e);
        }
    }

    @Override
    public MutationStatus addRole(String guildId, String memberId, String roleId) {
        Guild guild = guild(guildId);
        Role role = guild.getRoleById(roleId);
        if (role == null) {
            return MutationStatus.NOT_FOUND;
        }
        try {
            guild.addRoleToMember(UserSnowflake.fromId(memberId), role).complete();
            return MutationStatus.OK;
        } catch (RuntimeException e) {
            log.warn("Failed to add role {} to {} in {}: {}", roleId, memberId, guildId, e.getMessage());
            return DiscordErrors.statusOf(e);
        }
    }

    @Override
    public MutationStatus removeRole(String guildId, String memberId, String roleId) {
        Guild guild = guild(guildId);
        Role role = guild.getRoleById(roleId);
        if (role == null) {
            // nothing to remove
            return MutationStatus.OK;
        }
        try {
            guild.removeRoleFromMember(UserSnowflake.fromId(memberId), role).complete();
            return MutationStatus.OK;
        } catch (RuntimeException e) {
            log.warn("Failed to remove role {} from {} in {}: {}", roleId, memberId, guildId, e.getMessage());
            return DiscordErrors.statusOf(e);
        }
    }

    @Override
    public List<GuildRole> fetchGuildRoles(String guildId) {
        List<GuildRole> roles = new ArrayList<>();
        for (Role role : guild(guildId).getRoles()) {
            if (!role.isPublicRole()) {
                roles.add(new GuildRole(role.getId(), role.getName(), role.getPosition(), role.isManaged()));
            }
        }
        return roles;
    }

    @Override
    public int selfTopRolePosition(String guildId) {
        return guild(guildId).getSelfMember().getRoles().stream()
                .mapToInt(Role::getPosition)
                .max()
                .orElse(0);
    }

    // =========================================================================
    // MessagePlatform
    // =========================================================================

    @Override
    public String locateMessage(String guildId, String channelIdHint, String messageId) {
        Guild guild = guild(guildId);
        if (channelIdHint != null) {
            GuildMessageChannel hinted = guild.getChannelById(GuildMessageChannel.class, channelIdHint);
            if (hinted != null && holds(hinted, messageId)) {
                return hinted.getId();
            }
        }
        for (TextChannel channel : guild.getTextChannels()) {
            if (channel.getId().equals(channelIdHint) || !channel.canTalk()) {
                continue;
            }
            if (holds(channel, messageId)) {
                return channel.getId();
            }
        }
        return null;
    }

    private boolean holds(GuildMessageChannel channel, String messageId) {
        try {
            channel.retrieveMessageById(messageId).complete();
            return true;
        } catch (RuntimeException e) {
            MutationStatus status = DiscordErrors.statusOf(e);
            if (status == MutationStatus.NOT_FOUND || status == MutationStatus.FORBIDDEN) {
                return false;
            }
            throw DiscordErrors.translate("Failed to look up message " + messageId, e);
        }
    }

    @Override
    public String createMessage(String guildId, String channelId, MessageContent content) {
        GuildMessageChannel channel = channel(guildId, channelId);
        try {
            return channel.sendMessageEmbeds(DiscordComponents.embed(content)).complete().getId();
        } catch (RuntimeException e) {
            throw DiscordErrors.translate("Failed to post in channel " + channelId, e);
        }
    }

    @Override
    public void renderView(String guildId, RoleMessage message) {
        GuildMessageChannel channel = channel(guildId, message.channelId());
        Guild guild = channel.getGuild();
        List<ActionRow> rows = DiscordComponents.rows(guildId, message, roleId -> {
            Role role = guild.getRoleById(roleId);
            return role != null ? role.getName() : roleId;
        });
        try {
            if (message.content() == null) {
                // registered messages may belong to someone else; only components are ours
                channel.editMessageComponentsById(message.id(), rows).complete();
                return;
            }
            MessageEmbed embed = message.style() == TriggerStyle.MENU
                    ? DiscordComponents.menuEmbed(message)
                    : DiscordComponents.embed(message.content());
            channel.editMessageById(message.id(), new MessageEditBuilder()
                    .setEmbeds(embed)
                    .setComponents(rows)
                    .build()).complete();
        } catch (RuntimeException e) {
            throw DiscordErrors.translate("Failed to render message " + message.id(), e);
        }
    }

    @Override
    public void syncReactions(String guildId, String channelId, String messageId, List<String> emojis) {
        GuildMessageChannel channel = channel(guildId, channelId);
        try {
            channel.clearReactionsById(messageId).complete();
            for (String emoji : emojis) {
                channel.addReactionById(messageId, DiscordEmoji.toEmoji(emoji)).complete();
            }
        } catch (RuntimeException e) {
            throw DiscordErrors.translate("Failed to sync reactions on " + messageId, e);
        }
    }

    @Override
    public void addReaction(String guildId, String channelId, String messageId, String emoji) {
        try {
            channel(guildId, channelId).addReactionById(messageId, DiscordEmoji.toEmoji(emoji)).complete();
        } catch (PlatformException e) {
            throw e;
        } catch (RuntimeException e) {
            throw DiscordErrors.translate("Failed to add reaction " + emoji, e);
        }
    }

    @Override
    public void clearReaction(String guildId, String channelId, String messageId, String emoji) {
        try {
            channel(guildId, channelId).clearReactionsById(messageId, DiscordEmoji.toEmoji(emoji)).complete();
        } catch (PlatformException e) {
            throw e;
        } catch (RuntimeException e) {
            throw DiscordErrors.translate("Failed to clear reaction " + emoji, e);
        }
    }

    @Override
    public void removeUserReaction(String guildId, String channelId, String messageId, String emoji,
            String userId) {
        try {
            channel(guildId, channelId)
                    .removeReactionById(messageId, DiscordEmoji.toEmoji(emoji), UserSnowflake.fromId(userId))
                    .complete();
        } catch (PlatformException e) {
            throw e;
        } catch (RuntimeException e) {
            throw DiscordErrors.translate("Failed to remove reaction of " + userId, e);
        }
    }

    @Override
    public String resolveCustomEmoji(String guildId, String name) {
        try {
            for (RichCustomEmoji emoji : guild(guildId).retrieveEmojis().complete()) {
                if (emoji.getName().equals(name)) {
                    return emoji.getFormatted();
                }
            }
            return null;
        } catch (PlatformException e) {
            throw e;
        } catch (RuntimeException e) {
            throw DiscordErrors.translate("Failed to list emojis of guild " + guildId, e);
        }
    }

    // =========================================================================
    // Direct messages
    // =========================================================================

    /**
     * Send a direct message to a user. Delivery failures (closed DMs) are
     * logged and otherwise ignored.
     */
    public void sendDirectMessage(String userId, String text) {
        jda.retrieveUserById(userId)
                .flatMap(user -> user.openPrivateChannel())
                .flatMap(channel -> channel.sendMessage(text))
                .queue(null, err -> log.debug("Could not DM {}: {}", userId, err.getMessage()));
    }

    // =========================================================================
    // Lookup
    // =========================================================================

    private Guild guild(String guildId) {
        Guild guild = jda.getGuildById(guildId);
        if (guild == null) {
            throw new PlatformException("Unknown guild " + guildId, MutationStatus.NOT_FOUND);
        }
        return guild;
    }

    private GuildMessageChannel channel(String guildId, String channelId) {
        GuildMessageChannel channel = channelId != null
                ? guild(guildId).getChannelById(GuildMessageChannel.class, channelId)
                : null;
        if (channel == null) {
            throw new PlatformException("Unknown channel " + channelId, MutationStatus.NOT_FOUND);
        }
        return channel;
    }
}
