package com.rolebind.engine.platform;

import java.util.List;
import java.util.Set;

/**
 * Role side of the platform. Mutations are idempotent: adding a held role or
 * removing an unheld one succeeds without effect.
 */
public interface RolePlatform {

    /**
     * Fetch the member's current role ids, bypassing any cache.
     *
     * @throws com.rolebind.engine.PlatformException if the member cannot be
     *                                               fetched
     */
    Set<String> fetchMemberRoles(String guildId, String memberId);

    MutationStatus addRole(String guildId, String memberId, String roleId);

    MutationStatus removeRole(String guildId, String memberId, String roleId);

    /** All roles of the guild. */
    List<GuildRole> fetchGuildRoles(String guildId);

    /** Position of the highest role held by the bot itself in the guild. */
    int selfTopRolePosition(String guildId);
}
