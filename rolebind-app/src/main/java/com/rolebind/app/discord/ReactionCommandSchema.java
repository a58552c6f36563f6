package com.rolebind.app.discord;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.channel.ChannelType;
import net.dv8tion.jda.api.interactions.commands.DefaultMemberPermissions;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.OptionData;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import net.dv8tion.jda.api.interactions.commands.build.SubcommandData;

/**
 * Schema of the {@code /reaction} slash command as registered with Discord.
 * Option names match what {@link com.rolebind.app.commands.ReactionRoleCommands}
 * reads.
 */
public final class ReactionCommandSchema {

    private ReactionCommandSchema() {
    }

    public static final String COMMAND_NAME = "reaction";

    public static SlashCommandData build() {
        return Commands.slash(COMMAND_NAME, "Manage reaction, button and menu roles")
                .setGuildOnly(true)
                .setDefaultPermissions(DefaultMemberPermissions.enabledFor(Permission.MANAGE_ROLES))
                .addSubcommands(
                        new SubcommandData("create", "Create a reaction or button role message")
                                .addOptions(channel(true), title(), description(), color(), style()),
                        new SubcommandData("create_menu", "Create a role menu with categories")
                                .addOptions(channel(true), title(), description(), color()),
                        new SubcommandData("adopt", "Turn an existing message into a role message")
                                .addOptions(messageId(), channel(false), style()),
                        new SubcommandData("edit", "Change the embed text of a role message")
                                .addOptions(messageId(), title(), description(), color()),
                        new SubcommandData("add", "Bind an emoji or button to a role")
                                .addOptions(messageId(),
                                        new OptionData(OptionType.STRING, "trigger",
                                                "Emoji to react with, or the button label", true),
                                        role(), mode(),
                                        new OptionData(OptionType.STRING, "label", "Button label"),
                                        new OptionData(OptionType.STRING, "emoji", "Emoji shown on the button")),
                        new SubcommandData("remove", "Remove a trigger from a role message")
                                .addOptions(messageId(),
                                        new OptionData(OptionType.STRING, "trigger", "Emoji or button label", true)),
                        new SubcommandData("add_category", "Add a category to a role menu")
                                .addOptions(messageId(),
                                        new OptionData(OptionType.STRING, "name", "Category name", true),
                                        new OptionData(OptionType.STRING, "emoji", "Category emoji"),
                                        new OptionData(OptionType.STRING, "description", "Category description")),
                        new SubcommandData("remove_category", "Remove a category from a role menu")
                                .addOptions(messageId(),
                                        new OptionData(OptionType.STRING, "name", "Category name", true)),
                        new SubcommandData("add_menu_role", "Add a role to a menu category")
                                .addOptions(messageId(),
                                        new OptionData(OptionType.STRING, "category", "Category name", true),
                                        role(), mode(),
                                        new OptionData(OptionType.STRING, "description", "Shown under the option"),
                                        new OptionData(OptionType.STRING, "emoji", "Option emoji"),
                                        new OptionData(OptionType.STRING, "label", "Option text instead of the role name")),
                        new SubcommandData("remove_menu_role", "Remove a role from a role menu")
                                .addOptions(messageId(), role()),
                        new SubcommandData("settings", "Configure limits and required roles")
                                .addOptions(messageId(),
                                        new OptionData(OptionType.INTEGER, "max_roles",
                                                "Most roles a member can hold from this message")
                                                .setMinValue(1),
                                        new OptionData(OptionType.BOOLEAN, "clear_max_roles", "Remove the limit"),
                                        new OptionData(OptionType.ROLE, "required_role",
                                                "Add a role needed to use this message"),
                                        new OptionData(OptionType.BOOLEAN, "clear_required",
                                                "Clear the required roles first")),
                        new SubcommandData("list", "List the role messages of this server"),
                        new SubcommandData("delete", "Stop tracking a role message")
                                .addOptions(messageId()),
                        new SubcommandData("clone", "Copy a role message to another channel")
                                .addOptions(messageId(), channel(true)),
                        new SubcommandData("export", "Export this server's configuration as JSON"),
                        new SubcommandData("verify", "Check every role message for problems"),
                        new SubcommandData("cleanup", "Remove deleted roles and mark missing messages"),
                        new SubcommandData("rebuild", "Re-render every role message"));
    }

    private static OptionData messageId() {
        return new OptionData(OptionType.STRING, "message_id", "ID of the role message", true);
    }

    private static OptionData role() {
        return new OptionData(OptionType.ROLE, "role", "Role", true);
    }

    private static OptionData channel(boolean required) {
        return new OptionData(OptionType.CHANNEL, "channel", "Text channel", required)
                .setChannelTypes(ChannelType.TEXT);
    }

    private static OptionData title() {
        return new OptionData(OptionType.STRING, "title", "Embed title");
    }

    private static OptionData description() {
        return new OptionData(OptionType.STRING, "description", "Embed description");
    }

    private static OptionData color() {
        return new OptionData(OptionType.STRING, "color", "Embed color as a hex code like #FF0000");
    }

    private static OptionData style() {
        return new OptionData(OptionType.STRING, "style", "Reactions or buttons")
                .addChoice("Traditional Reactions", "reactions")
                .addChoice("Modern Buttons", "buttons");
    }

    private static OptionData mode() {
        return new OptionData(OptionType.STRING, "mode", "How the role combines with others")
                .addChoice("Normal - toggle freely", "normal")
                .addChoice("Unique - one role per message or category", "unique")
                .addChoice("Exclusive - removes every other bound role", "exclusive");
    }
}
