package com.rolebind.engine.platform;

/**
 * A role as currently defined in a guild.
 *
 * @param position hierarchy position; higher sits above
 * @param managed  owned by an integration and not assignable
 */
public record GuildRole(String id, String name, int position, boolean managed) {
}
