package com.rolebind.app.commands;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * Capability check performed before any command reaches the engine.
 * <p>
 * Guild-wide and destructive subcommands ({@code verify}, {@code cleanup},
 * {@code rebuild}, {@code export}, {@code delete}) need ADMINISTRATOR; every
 * other subcommand needs MANAGE_ROLES, which ADMINISTRATOR implies.
 */
@Slf4j
public class CommandAuthorization {

    private static final Set<String> ADMIN_ONLY = Set.of("verify", "cleanup", "rebuild", "export", "delete");

    private CommandAuthorization() {
    }

    public static Capability requiredFor(String subcommand) {
        return ADMIN_ONLY.contains(subcommand) ? Capability.ADMINISTRATOR : Capability.MANAGE_ROLES;
    }

    /**
     * Check if a sender may run the subcommand.
     */
    public static boolean isAuthorized(String subcommand, CommandContext ctx) {
        if (ctx.has(Capability.ADMINISTRATOR)) {
            return true;
        }
        boolean authorized = ctx.has(requiredFor(subcommand));
        if (!authorized) {
            log.info("Sender {} lacks {} for /reaction {} in guild {}", ctx.senderId(), requiredFor(subcommand),
                    subcommand, ctx.guildId());
        }
        return authorized;
    }
}
