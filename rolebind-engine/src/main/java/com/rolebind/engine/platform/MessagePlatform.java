package com.rolebind.engine.platform;

import com.rolebind.engine.model.MessageContent;
import com.rolebind.engine.model.RoleMessage;

import java.util.List;

/**
 * Message side of the platform, used by configuration, rebuild and clone. The
 * resolver never touches it.
 */
public interface MessagePlatform {

    /**
     * Find the channel that currently holds the message.
     *
     * @param channelIdHint channel to check first, nullable
     * @return the channel id, or null if the message no longer exists
     */
    String locateMessage(String guildId, String channelIdHint, String messageId);

    /**
     * Post a new message with the given embed text.
     *
     * @return the new message id
     */
    String createMessage(String guildId, String channelId, MessageContent content);

    /**
     * Replace the interactive components of a button or menu message with the
     * view derived from its configuration.
     */
    void renderView(String guildId, RoleMessage message);

    /**
     * Clear the message's reactions and add the given emojis in order.
     */
    void syncReactions(String guildId, String channelId, String messageId, List<String> emojis);

    /** Add one reaction to the message. */
    void addReaction(String guildId, String channelId, String messageId, String emoji);

    /** Remove every reaction using the emoji. */
    void clearReaction(String guildId, String channelId, String messageId, String emoji);

    /** Withdraw one user's reaction. */
    void removeUserReaction(String guildId, String channelId, String messageId, String emoji, String userId);

    /**
     * Look up a guild custom emoji by name.
     *
     * @return its formatted form ({@code <:name:id>}), or null if the guild has
     *         none by that name
     */
    default String resolveCustomEmoji(String guildId, String name) {
        return null;
    }
}
