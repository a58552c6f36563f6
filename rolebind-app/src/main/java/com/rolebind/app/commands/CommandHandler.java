package com.rolebind.app.commands;

/**
 * Functional interface for command handlers.
 */
@FunctionalInterface
public interface CommandHandler {
    /**
     * Handle a command.
     *
     * @param options the command options by name
     * @param ctx     the command context (guild, sender, capabilities)
     * @return the reply
     */
    CommandResult handle(CommandOptions options, CommandContext ctx);
}
