package com.rolebind.app.commands;

import java.util.Set;

/**
 * Context passed to every command handler: where the command was issued,
 * by whom, and what the sender is allowed to do in the guild.
 */
public record CommandContext(
        String guildId,
        String channelId,
        String senderId,
        Set<Capability> capabilities) {

    public CommandContext {
        capabilities = Set.copyOf(capabilities != null ? capabilities : Set.of());
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }
}
